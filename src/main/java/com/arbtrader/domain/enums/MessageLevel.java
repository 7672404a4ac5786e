package com.arbtrader.domain.enums;

/** Severity of a brokerage message. */
public enum MessageLevel {
    INFO,
    WARNING,
    ERROR,
    DISCONNECT,
    RECONNECT
}
