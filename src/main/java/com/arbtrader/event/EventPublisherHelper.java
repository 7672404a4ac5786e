package com.arbtrader.event;

import com.arbtrader.domain.model.AccountChange;
import com.arbtrader.domain.model.BrokerageMessage;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.grid.TradingPairChanges;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the arbitrage core's events.
 *
 * <p>Delivery depends on the listener: plain {@code @EventListener} methods run on the
 * publishing thread, which for brokerage events is the connection's I/O thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Brokerage ----

    public void publishOrderUpdate(Object source, OrderUpdate orderUpdate) {
        applicationEventPublisher.publishEvent(new OrderUpdateEvent(source, orderUpdate));
    }

    public void publishAccountChanged(Object source, AccountChange accountChange) {
        applicationEventPublisher.publishEvent(new AccountChangedEvent(source, accountChange));
    }

    public void publishBrokerageMessage(Object source, BrokerageMessage message) {
        applicationEventPublisher.publishEvent(new BrokerageMessageEvent(source, message));
    }

    public void publishOptionAssignment(Object source, OrderUpdate assignment) {
        applicationEventPublisher.publishEvent(new OptionAssignmentEvent(source, assignment));
    }

    // ---- Trading pairs ----

    public void publishTradingPairsChanged(Object source, TradingPairChanges changes) {
        applicationEventPublisher.publishEvent(new TradingPairsChangedEvent(source, changes));
    }
}
