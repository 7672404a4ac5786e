package com.arbtrader.ledger;

import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Outstanding paired targets keyed by tag.
 *
 * <p>Keyed by tag rather than instrument: one instrument can carry several grid levels at once,
 * each an independent economic position with its own target.
 *
 * <p>A target is fulfilled when, for every leg:
 * <ul>
 *   <li>{@code |target - traded| < lotSize}, with traded quantity scoped to the tag</li>
 *   <li>the remaining open-order quantity carrying this tag on that leg is below the lot size</li>
 * </ul>
 * Open orders with other tags on the same instrument are ignored.
 *
 * <p>Each operation is a single concurrent-map mutation. Fulfilled targets are removed only if
 * they were not replaced in the meantime, so a concurrent upsert is never lost.
 */
@Component
public class ArbitrageTargetLedger {

    private static final Logger log = LoggerFactory.getLogger(ArbitrageTargetLedger.class);

    private final ConcurrentMap<String, ArbitrageTarget> targets = new ConcurrentHashMap<>();

    /** Inserts or replaces the target for its tag. */
    public void upsert(ArbitrageTarget target) {
        targets.put(target.getTag(), target);
    }

    public void addAll(Collection<ArbitrageTarget> newTargets) {
        for (ArbitrageTarget target : newTargets) {
            upsert(target);
        }
    }

    public Optional<ArbitrageTarget> get(String tag) {
        return Optional.ofNullable(targets.get(tag));
    }

    public boolean remove(String tag) {
        return targets.remove(tag) != null;
    }

    /** Point-in-time copy. */
    public List<ArbitrageTarget> getTargets() {
        return List.copyOf(targets.values());
    }

    public int size() {
        return targets.size();
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public void clear() {
        targets.clear();
    }

    /**
     * Removes every fulfilled target.
     *
     * @param tradedQuantities quantity already traded per (tag, leg)
     * @param openOrders       all open orders across accounts; filtered by tag here
     * @return the removed targets
     */
    public List<ArbitrageTarget> clearFulfilled(TradedQuantityProvider tradedQuantities, Collection<Order> openOrders) {
        List<ArbitrageTarget> cleared = new ArrayList<>();
        for (ArbitrageTarget target : getTargets()) {
            if (isFulfilled(target, tradedQuantities, openOrders) && targets.remove(target.getTag(), target)) {
                cleared.add(target);
            }
        }
        if (!cleared.isEmpty()) {
            log.debug("Cleared {} fulfilled targets, {} outstanding", cleared.size(), targets.size());
        }
        return cleared;
    }

    public boolean isFulfilled(
            ArbitrageTarget target, TradedQuantityProvider tradedQuantities, Collection<Order> openOrders) {
        for (LegTarget leg : target.getLegs()) {
            BigDecimal traded = tradedQuantities.getTradedQuantity(target.getTag(), leg.getInstrument());
            if (leg.getQuantity().subtract(traded).abs().compareTo(leg.getLotSize()) >= 0) {
                return false;
            }
            BigDecimal open = openQuantity(openOrders, target.getTag(), leg.getInstrument());
            if (open.abs().compareTo(leg.getLotSize()) >= 0) {
                return false;
            }
        }
        return true;
    }

    /** Remaining signed quantity of open orders carrying the tag on the instrument. */
    public static BigDecimal openQuantity(Collection<Order> openOrders, String tag, InstrumentId instrument) {
        BigDecimal total = BigDecimal.ZERO;
        for (Order order : openOrders) {
            if (Objects.equals(order.getTag(), tag) && instrument.equals(order.getInstrument())) {
                total = total.add(order.getRemainingSignedQuantity());
            }
        }
        return total;
    }
}
