package com.arbtrader.broker;

import com.arbtrader.domain.model.CashBalance;
import com.arbtrader.domain.model.Holding;
import com.arbtrader.domain.model.Order;
import java.util.List;

/**
 * One connection to one brokerage account.
 *
 * <p>Implementations deliver events on their own I/O thread. Order operations report failure
 * by returning false. {@link #connect()} may block and applies its own timeout.
 */
public interface BrokerageConnection {

    // ---- Lifecycle ----

    void connect();

    void disconnect();

    boolean isConnected();

    // ---- Orders ----

    boolean placeOrder(Order order);

    boolean updateOrder(Order order);

    boolean cancelOrder(Order order);

    List<Order> getOpenOrders();

    // ---- Account ----

    List<Holding> getAccountHoldings();

    List<CashBalance> getCashBalance();

    // ---- Events ----

    void addListener(BrokerageEventListener listener);

    void removeListener(BrokerageEventListener listener);
}
