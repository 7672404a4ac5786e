package com.arbtrader.domain.enums;

import java.math.BigDecimal;

/** Buy or sell side of an order. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Side that moves a position by the given signed quantity. */
    public static OrderSide forQuantity(BigDecimal signedQuantity) {
        return signedQuantity.signum() >= 0 ? BUY : SELL;
    }

    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
