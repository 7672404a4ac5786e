package com.arbtrader.domain.enums;

/**
 * Which side of the spread a grid level trades.
 * LONG_SPREAD buys leg1 and sells leg2 (spread expected to widen back up from below zero);
 * SHORT_SPREAD sells leg1 and buys leg2.
 */
public enum SpreadDirection {
    LONG_SPREAD,
    SHORT_SPREAD;

    public SpreadDirection opposite() {
        return this == LONG_SPREAD ? SHORT_SPREAD : LONG_SPREAD;
    }
}
