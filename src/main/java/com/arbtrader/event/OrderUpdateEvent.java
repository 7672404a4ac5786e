package com.arbtrader.event;

import com.arbtrader.domain.model.OrderUpdate;
import org.springframework.context.ApplicationEvent;

/**
 * Published when any registered brokerage connection reports an order status change or fill.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>TradingPairManager: applies grid fills to positions</li>
 * </ul>
 */
public class OrderUpdateEvent extends ApplicationEvent {

    private final OrderUpdate orderUpdate;

    public OrderUpdateEvent(Object source, OrderUpdate orderUpdate) {
        super(source);
        this.orderUpdate = orderUpdate;
    }

    public OrderUpdate getOrderUpdate() {
        return orderUpdate;
    }
}
