package com.arbtrader.event;

import com.arbtrader.domain.model.BrokerageMessage;
import org.springframework.context.ApplicationEvent;

public class BrokerageMessageEvent extends ApplicationEvent {

    private final BrokerageMessage message;

    public BrokerageMessageEvent(Object source, BrokerageMessage message) {
        super(source);
        this.message = message;
    }

    public BrokerageMessage getMessage() {
        return message;
    }
}
