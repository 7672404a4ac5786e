package com.arbtrader.broker;

import com.arbtrader.domain.model.AccountChange;
import com.arbtrader.domain.model.BrokerageMessage;
import com.arbtrader.domain.model.OrderUpdate;

/** Receives brokerage events. Methods are invoked on the emitting connection's thread. */
public interface BrokerageEventListener {

    default void onOrderStatusChanged(OrderUpdate update) {}

    default void onAccountChanged(AccountChange change) {}

    default void onMessage(BrokerageMessage message) {}

    default void onOptionPositionAssigned(OrderUpdate assignment) {}
}
