package com.arbtrader.broker;

import com.arbtrader.domain.model.AccountChange;
import com.arbtrader.domain.model.BrokerageMessage;
import com.arbtrader.domain.model.CashBalance;
import com.arbtrader.domain.model.ExecutionRecord;
import com.arbtrader.domain.model.Holding;
import com.arbtrader.domain.model.Order;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.exception.BrokerException;
import com.arbtrader.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aggregates N named brokerage connections (accounts) behind one brokerage surface.
 *
 * <p>Lifecycle is all-or-nothing: {@link #connectAll()} connects every account and, if any
 * account throws or is still not connected afterwards, disconnects all of them and throws.
 * A half-connected multi-account system cannot safely trade.
 *
 * <p>Per-account order operations take an explicit account name. Failures there are caught,
 * logged and returned as {@code false} so one account cannot affect the others. The inherited
 * single-account forms are rejected: there is no implicit default account.
 *
 * <p>Events from every connection are re-emitted on this manager's listener list, stamped with
 * the account name. No lock is held while listeners run, and a failing listener does not stop
 * delivery to the others.
 */
@Component
public class MultiBrokerageManager implements BrokerageConnection, ExecutionHistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(MultiBrokerageManager.class);

    private final ConcurrentMap<String, Registration> registrations = new ConcurrentHashMap<>();
    private final List<BrokerageEventListener> listeners = new CopyOnWriteArrayList<>();

    // ---- Registry ----

    /**
     * Registers a connection under an account name and subscribes to its events.
     *
     * @throws ValidationException if the name is blank or already registered
     */
    public void registerBrokerage(String account, BrokerageConnection connection) {
        if (account == null || account.isBlank()) {
            throw new ValidationException("account", "Account name is required");
        }
        if (connection == null) {
            throw new ValidationException("connection", "Brokerage connection is required for account " + account);
        }
        ExecutionHistoryProvider history =
                connection instanceof ExecutionHistoryProvider provider ? provider : null;
        Registration registration = new Registration(account, connection, new Forwarder(account), history);
        if (registrations.putIfAbsent(account, registration) != null) {
            throw new ValidationException("account", "Account already registered: " + account);
        }
        connection.addListener(registration.forwarder());
        log.info("Registered brokerage account {} (executionHistory={})", account, history != null);
    }

    public boolean unregisterBrokerage(String account) {
        Registration registration = account != null ? registrations.remove(account) : null;
        if (registration == null) {
            return false;
        }
        registration.connection().removeListener(registration.forwarder());
        log.info("Unregistered brokerage account {}", account);
        return true;
    }

    public Set<String> getAccounts() {
        return Set.copyOf(registrations.keySet());
    }

    public Optional<BrokerageConnection> getBrokerage(String account) {
        return Optional.ofNullable(lookup(account)).map(Registration::connection);
    }

    // ---- Lifecycle ----

    /**
     * Connects every account.
     *
     * @throws BrokerException listing the failed accounts after disconnecting all of them
     */
    public void connectAll() {
        List<String> failed = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            try {
                registration.connection().connect();
                if (!registration.connection().isConnected()) {
                    log.error("Brokerage account {} did not report connected after connect()", registration.account());
                    failed.add(registration.account());
                }
            } catch (RuntimeException e) {
                log.error("Failed to connect brokerage account {}", registration.account(), e);
                failed.add(registration.account());
            }
        }
        if (!failed.isEmpty()) {
            disconnectAll();
            throw new BrokerException("Failed to connect brokerage accounts: " + String.join(", ", failed), failed);
        }
        log.info("Connected {} brokerage accounts", registrations.size());
    }

    public void disconnectAll() {
        for (Registration registration : registrations.values()) {
            try {
                registration.connection().disconnect();
            } catch (RuntimeException e) {
                log.error("Failed to disconnect brokerage account {}", registration.account(), e);
            }
        }
        log.info("Disconnected {} brokerage accounts", registrations.size());
    }

    @Override
    public void connect() {
        connectAll();
    }

    @Override
    public void disconnect() {
        disconnectAll();
    }

    /** True if at least one account is registered and every account is connected. */
    @Override
    public boolean isConnected() {
        if (registrations.isEmpty()) {
            return false;
        }
        return registrations.values().stream().allMatch(r -> r.connection().isConnected());
    }

    // ---- Orders ----

    public boolean placeOrder(Order order, String account) {
        return invoke(account, "place", order, c -> c.placeOrder(order));
    }

    public boolean updateOrder(Order order, String account) {
        return invoke(account, "update", order, c -> c.updateOrder(order));
    }

    public boolean cancelOrder(Order order, String account) {
        return invoke(account, "cancel", order, c -> c.cancelOrder(order));
    }

    public List<Order> getOpenOrders(String account) {
        Registration registration = lookup(account);
        if (registration == null) {
            log.error("Cannot list open orders: unknown account {}", account);
            return List.of();
        }
        try {
            List<Order> orders = registration.connection().getOpenOrders();
            return orders != null ? orders : List.of();
        } catch (RuntimeException e) {
            log.error("Failed to list open orders for account {}", account, e);
            return List.of();
        }
    }

    @Override
    public boolean placeOrder(Order order) {
        throw new UnsupportedOperationException(
                "Multi-account mode requires an account: use placeOrder(order, account)");
    }

    @Override
    public boolean updateOrder(Order order) {
        throw new UnsupportedOperationException(
                "Multi-account mode requires an account: use updateOrder(order, account)");
    }

    @Override
    public boolean cancelOrder(Order order) {
        throw new UnsupportedOperationException(
                "Multi-account mode requires an account: use cancelOrder(order, account)");
    }

    /** Open orders of every account, each stamped with its account. */
    @Override
    public List<Order> getOpenOrders() {
        List<Order> all = new ArrayList<>();
        for (String account : registrations.keySet()) {
            for (Order order : getOpenOrders(account)) {
                if (order.getAccount() == null) {
                    order.setAccount(account);
                }
                all.add(order);
            }
        }
        return all;
    }

    // ---- Account ----

    @Override
    public List<Holding> getAccountHoldings() {
        List<Holding> all = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            try {
                all.addAll(registration.connection().getAccountHoldings());
            } catch (RuntimeException e) {
                log.error("Failed to read holdings for account {}", registration.account(), e);
            }
        }
        return all;
    }

    @Override
    public List<CashBalance> getCashBalance() {
        List<CashBalance> all = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            try {
                all.addAll(registration.connection().getCashBalance());
            } catch (RuntimeException e) {
                log.error("Failed to read cash balance for account {}", registration.account(), e);
            }
        }
        return all;
    }

    // ---- Execution history ----

    /** Concatenated history of every account that supports it. */
    @Override
    public List<ExecutionRecord> getExecutionHistory(LocalDateTime from, LocalDateTime to) {
        List<ExecutionRecord> all = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            if (registration.history() == null) {
                log.debug("Account {} does not provide execution history, skipping", registration.account());
                continue;
            }
            try {
                all.addAll(registration.history().getExecutionHistory(from, to));
            } catch (RuntimeException e) {
                log.error("Failed to read execution history for account {}", registration.account(), e);
            }
        }
        return all;
    }

    // ---- Events ----

    @Override
    public void addListener(BrokerageEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(BrokerageEventListener listener) {
        listeners.remove(listener);
    }

    private void dispatch(String account, String eventName, Consumer<BrokerageEventListener> delivery) {
        for (BrokerageEventListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (RuntimeException e) {
                log.error("Listener {} failed handling {} from account {}", listener, eventName, account, e);
            }
        }
    }

    private Registration lookup(String account) {
        return account != null ? registrations.get(account) : null;
    }

    private boolean invoke(String account, String operation, Order order, OrderOperation call) {
        Registration registration = lookup(account);
        if (registration == null) {
            log.error("Cannot {} order {}: unknown account {}", operation, order.getId(), account);
            return false;
        }
        try {
            boolean result = call.apply(registration.connection());
            if (!result) {
                log.warn("Brokerage account {} refused to {} order {}", account, operation, order.getId());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to {} order {} on account {}", operation, order.getId(), account, e);
            return false;
        }
    }

    @FunctionalInterface
    private interface OrderOperation {
        boolean apply(BrokerageConnection connection);
    }

    private record Registration(
            String account,
            BrokerageConnection connection,
            BrokerageEventListener forwarder,
            ExecutionHistoryProvider history) {}

    /** Re-emits one connection's events on the manager, stamped with the account. */
    private final class Forwarder implements BrokerageEventListener {

        private final String account;

        private Forwarder(String account) {
            this.account = account;
        }

        @Override
        public void onOrderStatusChanged(OrderUpdate update) {
            log.trace("Order status from {}: {}", account, update);
            OrderUpdate stamped = update.toBuilder().account(account).build();
            dispatch(account, "order status", l -> l.onOrderStatusChanged(stamped));
        }

        @Override
        public void onAccountChanged(AccountChange change) {
            log.trace("Account change from {}: {}", account, change);
            AccountChange stamped = change.toBuilder().account(account).build();
            dispatch(account, "account change", l -> l.onAccountChanged(stamped));
        }

        @Override
        public void onMessage(BrokerageMessage message) {
            log.trace("Message from {}: {}", account, message);
            BrokerageMessage stamped = message.toBuilder().account(account).build();
            dispatch(account, "message", l -> l.onMessage(stamped));
        }

        @Override
        public void onOptionPositionAssigned(OrderUpdate assignment) {
            log.trace("Option assignment from {}: {}", account, assignment);
            OrderUpdate stamped = assignment.toBuilder().account(account).build();
            dispatch(account, "option assignment", l -> l.onOptionPositionAssigned(stamped));
        }
    }
}
