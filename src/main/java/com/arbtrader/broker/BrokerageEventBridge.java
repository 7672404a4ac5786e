package com.arbtrader.broker;

import com.arbtrader.domain.enums.MessageLevel;
import com.arbtrader.domain.model.AccountChange;
import com.arbtrader.domain.model.BrokerageMessage;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.event.EventPublisherHelper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Republishes the multi-brokerage manager's unified event stream as Spring application events.
 * Runs on the emitting connection's thread.
 */
@Component
public class BrokerageEventBridge implements BrokerageEventListener {

    private static final Logger log = LoggerFactory.getLogger(BrokerageEventBridge.class);

    private final MultiBrokerageManager multiBrokerageManager;
    private final EventPublisherHelper eventPublisherHelper;

    public BrokerageEventBridge(
            MultiBrokerageManager multiBrokerageManager, EventPublisherHelper eventPublisherHelper) {
        this.multiBrokerageManager = multiBrokerageManager;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @PostConstruct
    public void subscribe() {
        multiBrokerageManager.addListener(this);
    }

    @Override
    public void onOrderStatusChanged(OrderUpdate update) {
        eventPublisherHelper.publishOrderUpdate(this, update);
    }

    @Override
    public void onAccountChanged(AccountChange change) {
        eventPublisherHelper.publishAccountChanged(this, change);
    }

    @Override
    public void onMessage(BrokerageMessage message) {
        if (message.getLevel() == MessageLevel.ERROR || message.getLevel() == MessageLevel.DISCONNECT) {
            log.warn(
                    "Brokerage {} [{}] {}: {}",
                    message.getAccount(),
                    message.getLevel(),
                    message.getCode(),
                    message.getMessage());
        } else {
            log.info(
                    "Brokerage {} [{}] {}: {}",
                    message.getAccount(),
                    message.getLevel(),
                    message.getCode(),
                    message.getMessage());
        }
        eventPublisherHelper.publishBrokerageMessage(this, message);
    }

    @Override
    public void onOptionPositionAssigned(OrderUpdate assignment) {
        log.info(
                "Option assignment on {}: {} x {}",
                assignment.getAccount(),
                assignment.getInstrument(),
                assignment.getFillQuantity());
        eventPublisherHelper.publishOptionAssignment(this, assignment);
    }
}
