package com.arbtrader.ledger;

import com.arbtrader.domain.model.InstrumentId;
import java.math.BigDecimal;
import lombok.Value;

/** Target signed quantity for one leg, with the lot size used as fulfillment tolerance. */
@Value
public class LegTarget {

    InstrumentId instrument;
    BigDecimal quantity;
    BigDecimal lotSize;
}
