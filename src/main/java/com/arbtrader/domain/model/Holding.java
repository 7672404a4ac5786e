package com.arbtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Position held at a brokerage account. */
@Value
@Builder
public class Holding {

    InstrumentId instrument;
    BigDecimal quantity;
    BigDecimal averagePrice;
    BigDecimal marketPrice;

    public BigDecimal getMarketValue() {
        BigDecimal price = marketPrice != null ? marketPrice : averagePrice;
        if (price == null || quantity == null) {
            return BigDecimal.ZERO;
        }
        return quantity.multiply(price);
    }
}
