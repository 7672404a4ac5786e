package com.arbtrader.ledger;

import com.arbtrader.domain.model.InstrumentId;
import java.math.BigDecimal;

/**
 * Source of quantity already traded for one leg of one tagged target.
 * Quantities are scoped to the tag, not to the instrument's total holding.
 */
public interface TradedQuantityProvider {

    BigDecimal getTradedQuantity(String tag, InstrumentId instrument);
}
