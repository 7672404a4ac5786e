package com.arbtrader.domain.model;

import com.arbtrader.domain.enums.MessageLevel;
import lombok.Builder;
import lombok.Value;

/** Free-form message from a brokerage connection (warnings, disconnects, reconnects). */
@Value
@Builder(toBuilder = true)
public class BrokerageMessage {

    String account;
    MessageLevel level;
    String code;
    String message;
}
