package com.arbtrader.oms;

import com.arbtrader.broker.MultiBrokerageManager;
import com.arbtrader.domain.model.Order;
import com.arbtrader.oms.routing.OrderRouter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Order entry point for the execution layer: route to an account, then place on that account's
 * connection through the multi-brokerage manager.
 *
 * <p>The router is validated at construction, so a misconfigured routing table fails at startup
 * rather than on the first order.
 */
@Component
public class RoutedOrderGateway {

    private static final Logger log = LoggerFactory.getLogger(RoutedOrderGateway.class);

    private final OrderRouter orderRouter;
    private final MultiBrokerageManager multiBrokerageManager;

    public RoutedOrderGateway(OrderRouter orderRouter, MultiBrokerageManager multiBrokerageManager) {
        orderRouter.ensureValid();
        this.orderRouter = orderRouter;
        this.multiBrokerageManager = multiBrokerageManager;
    }

    /** Routes and places the order. The chosen account is written to the order. */
    public boolean placeOrder(Order order) {
        String account = orderRouter.route(order);
        order.setAccount(account);
        log.debug("Routing order {} on {} to account {}", order.getId(), order.getInstrument(), account);
        return multiBrokerageManager.placeOrder(order, account);
    }

    public boolean cancelOrder(Order order) {
        String account = order.getAccount() != null ? order.getAccount() : orderRouter.route(order);
        return multiBrokerageManager.cancelOrder(order, account);
    }

    public boolean updateOrder(Order order) {
        String account = order.getAccount() != null ? order.getAccount() : orderRouter.route(order);
        return multiBrokerageManager.updateOrder(order, account);
    }

    public List<Order> getOpenOrders() {
        return multiBrokerageManager.getOpenOrders();
    }
}
