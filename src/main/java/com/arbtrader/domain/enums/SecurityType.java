package com.arbtrader.domain.enums;

/** Asset class of an instrument. Used by the security-type order router. */
public enum SecurityType {
    EQUITY,
    CRYPTO,
    CRYPTO_FUTURE,
    FUTURE,
    FOREX,
    OPTION,
    CFD
}
