package com.arbtrader.domain.enums;

/** Direction carried by a single-leg signal. Exit signals are always FLAT. */
public enum SignalDirection {
    UP,
    DOWN,
    FLAT;

    public static SignalDirection forEntry(SpreadDirection direction) {
        return direction == SpreadDirection.LONG_SPREAD ? UP : DOWN;
    }
}
