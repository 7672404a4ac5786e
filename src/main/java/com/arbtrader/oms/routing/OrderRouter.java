package com.arbtrader.oms.routing;

import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import com.arbtrader.exception.RoutingConfigurationException;

/**
 * Maps an order to the account (registered brokerage connection name) that should execute it.
 *
 * <p>Routing is a pure function of the order. Every router has a default account used when no
 * mapping matches, and {@link #validate()} must pass before the router is used.
 */
public interface OrderRouter {

    String route(Order order);

    /** Routes a prospective order on the given instrument. */
    default String route(InstrumentId instrument) {
        return route(Order.builder().instrument(instrument).build());
    }

    /** True if the mapping table and default account are usable. */
    boolean validate();

    /** Human-readable reason {@link #validate()} fails, or null. */
    String describeProblem();

    default void ensureValid() {
        if (!validate()) {
            throw new RoutingConfigurationException(getClass().getSimpleName() + ": " + describeProblem());
        }
    }
}
