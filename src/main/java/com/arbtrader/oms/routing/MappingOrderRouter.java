package com.arbtrader.oms.routing;

import com.arbtrader.domain.model.Order;
import java.util.Map;

/**
 * Base for routers that look up one attribute of the order in a mapping table and fall back to
 * a default account.
 */
public abstract class MappingOrderRouter<K> implements OrderRouter {

    private final Map<K, String> mappings;
    private final String defaultAccount;

    protected MappingOrderRouter(Map<K, String> mappings, String defaultAccount) {
        this.mappings = mappings;
        this.defaultAccount = defaultAccount;
    }

    /** Attribute of the order used as the lookup key; null when the order does not carry it. */
    protected abstract K keyOf(Order order);

    @Override
    public String route(Order order) {
        K key = order.getInstrument() != null ? keyOf(order) : null;
        if (key != null) {
            String account = mappings.get(key);
            if (account != null) {
                return account;
            }
        }
        return defaultAccount;
    }

    @Override
    public boolean validate() {
        return describeProblem() == null;
    }

    @Override
    public String describeProblem() {
        if (mappings == null || mappings.isEmpty()) {
            return "mapping table is empty";
        }
        if (defaultAccount == null || defaultAccount.isBlank()) {
            return "default account is not set";
        }
        for (Map.Entry<K, String> entry : mappings.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                return "mapping for " + entry.getKey() + " has no account";
            }
        }
        return null;
    }

    public Map<K, String> getMappings() {
        return Map.copyOf(mappings);
    }

    public String getDefaultAccount() {
        return defaultAccount;
    }
}
