package com.arbtrader.exception;

import java.util.Map;

/**
 * Thrown when a configuration value object is constructed with invalid parameters
 * (grid levels, level pairs, instrument identifiers, backup tiers). The offending
 * parameter is named in the message and carried in the details map under "parameter".
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String parameter, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("parameter", parameter));
    }

    public String getParameter() {
        Object parameter = getDetails().get("parameter");
        return parameter != null ? parameter.toString() : null;
    }
}
