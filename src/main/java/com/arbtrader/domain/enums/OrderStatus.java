package com.arbtrader.domain.enums;

/**
 * Lifecycle status of an order.
 * NEW is the internal pre-submission state; the remaining states are reported by the brokerage.
 */
public enum OrderStatus {
    NEW,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isOpen() {
        return this == NEW || this == SUBMITTED || this == PARTIALLY_FILLED;
    }

    public boolean isFill() {
        return this == PARTIALLY_FILLED || this == FILLED;
    }
}
