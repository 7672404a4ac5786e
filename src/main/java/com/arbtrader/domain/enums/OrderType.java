package com.arbtrader.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
