package com.arbtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories raised by the arbitrage core. The fatal flag marks errors that must abort
 * startup rather than be isolated to a single signal, target or account.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", true),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", true),
    NOT_FOUND("NOT_FOUND", false),
    BROKER_ERROR("BROKER_ERROR", true);

    private final String code;
    private final boolean fatal;
}
