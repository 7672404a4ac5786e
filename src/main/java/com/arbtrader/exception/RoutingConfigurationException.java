package com.arbtrader.exception;

/** Thrown when an order router fails its self-check before first use. */
public class RoutingConfigurationException extends BaseException {

    public RoutingConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
