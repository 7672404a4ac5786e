package com.arbtrader.exception;

import java.util.List;
import java.util.Map;

public class BrokerException extends BaseException {

    public BrokerException(String message, List<String> failedAccounts) {
        super(ErrorCode.BROKER_ERROR, message, Map.of("failedAccounts", List.copyOf(failedAccounts)));
    }
}
