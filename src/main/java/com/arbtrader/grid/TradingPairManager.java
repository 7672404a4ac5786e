package com.arbtrader.grid;

import com.arbtrader.domain.enums.MarketState;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.domain.model.Security;
import com.arbtrader.event.EventPublisherHelper;
import com.arbtrader.event.OrderUpdateEvent;
import com.arbtrader.ledger.TradedQuantityProvider;
import com.arbtrader.tag.GridTag;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registry of trading pairs and the entry point for grid fills.
 *
 * <p>Pairs are unique per ordered (leg1, leg2): adding an existing combination returns the
 * existing instance. Removal publishes a {@link com.arbtrader.event.TradingPairsChangedEvent}
 * before the pair leaves the registry, so live signals on either leg are cancelled first.
 *
 * <p>Fill processing ({@link #processOrderUpdate}) runs on brokerage I/O threads:
 * <ol>
 *   <li>drop updates whose execution id was already applied</li>
 *   <li>decode the order's tag; untagged or foreign orders are ignored</li>
 *   <li>get or create the grid position of the tag's level pair and apply the fill</li>
 *   <li>remove the position once a FILLED update leaves it flat with no open orders</li>
 *   <li>record the fill time per market for execution-history reconciliation</li>
 * </ol>
 */
@Service
public class TradingPairManager implements TradedQuantityProvider {

    private static final Logger log = LoggerFactory.getLogger(TradingPairManager.class);

    private final EventPublisherHelper eventPublisherHelper;

    private final ConcurrentMap<TradingPairKey, TradingPair> pairs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProcessedExecution> processedExecutions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LocalDateTime> lastFillTimeByMarket = new ConcurrentHashMap<>();

    public TradingPairManager(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ---- Pair registry ----

    /** Adds a pair, or returns the existing pair for the same ordered legs. */
    public TradingPair addPair(Security leg1, Security leg2, String pairType) {
        TradingPairKey key = new TradingPairKey(leg1.getInstrument(), leg2.getInstrument());
        TradingPair created = new TradingPair(leg1, leg2, pairType);
        TradingPair existing = pairs.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }
        log.info("Added trading pair {} (type={})", key, pairType);
        eventPublisherHelper.publishTradingPairsChanged(this, TradingPairChanges.added(created));
        return created;
    }

    public boolean removePair(InstrumentId leg1, InstrumentId leg2) {
        TradingPairKey key = new TradingPairKey(leg1, leg2);
        TradingPair pair = pairs.get(key);
        if (pair == null) {
            return false;
        }
        eventPublisherHelper.publishTradingPairsChanged(this, TradingPairChanges.removed(pair));
        boolean removed = pairs.remove(key, pair);
        if (removed) {
            log.info("Removed trading pair {} with {} open grid positions", key, pair.getPositions().size());
        }
        return removed;
    }

    public Optional<TradingPair> getPair(InstrumentId leg1, InstrumentId leg2) {
        return Optional.ofNullable(pairs.get(new TradingPairKey(leg1, leg2)));
    }

    public List<TradingPair> getPairs() {
        return List.copyOf(pairs.values());
    }

    public List<TradingPair> getCrossedPairs() {
        return pairs.values().stream()
                .filter(p -> p.getMarketState() == MarketState.CROSSED)
                .toList();
    }

    /** Security of any registered leg, used for prices and lot sizes. */
    public Optional<Security> findSecurity(InstrumentId instrument) {
        for (TradingPair pair : pairs.values()) {
            if (pair.getLeg1Id().equals(instrument)) {
                return Optional.of(pair.getLeg1());
            }
            if (pair.getLeg2Id().equals(instrument)) {
                return Optional.of(pair.getLeg2());
            }
        }
        return Optional.empty();
    }

    public void updateAll(LocalDateTime now) {
        for (TradingPair pair : pairs.values()) {
            pair.update(now);
        }
    }

    // ---- Grid positions ----

    /** Grid position addressed by a tag, if the tag decodes and its pair and position exist. */
    public Optional<GridPosition> findPosition(String tag) {
        return GridTagCodec.tryDecode(tag).flatMap(this::findPosition);
    }

    public Optional<GridPosition> findPosition(GridTag gridTag) {
        return getPair(gridTag.getLeg1(), gridTag.getLeg2()).flatMap(p -> p.findPosition(gridTag.getLevelPair()));
    }

    /**
     * Removes positions that hold less than a lot on both legs and have no open orders, such as
     * positions whose only orders were rejected.
     *
     * @return the number of positions removed
     */
    public int closeIdlePositions() {
        int closed = 0;
        for (TradingPair pair : pairs.values()) {
            for (GridPosition position : pair.getPositions()) {
                if (removeIfFlat(pair, position)) {
                    closed++;
                }
            }
        }
        return closed;
    }

    public List<GridPosition> getAllPositions() {
        return pairs.values().stream()
                .flatMap(p -> p.getPositions().stream())
                .toList();
    }

    /**
     * Attaches an order about to be submitted to the grid position its tag names, creating the
     * position if the entry has not been seen yet.
     *
     * @return false if the tag does not resolve to a registered pair
     */
    public boolean registerOrder(String tag, Order order, LocalDateTime now) {
        Optional<GridTag> decoded = GridTagCodec.tryDecode(tag);
        if (decoded.isEmpty()) {
            log.warn("Cannot register order {}: undecodable tag {}", order.getId(), tag);
            return false;
        }
        GridTag gridTag = decoded.get();
        Optional<TradingPair> pair = getPair(gridTag.getLeg1(), gridTag.getLeg2());
        if (pair.isEmpty()) {
            log.warn(
                    "Cannot register order {}: no trading pair {}/{}",
                    order.getId(),
                    gridTag.getLeg1(),
                    gridTag.getLeg2());
            return false;
        }
        pair.get().getOrCreatePosition(gridTag.getLevelPair(), now).registerOrder(order);
        return true;
    }

    @Override
    public BigDecimal getTradedQuantity(String tag, InstrumentId instrument) {
        return findPosition(tag).map(p -> p.getQuantity(instrument)).orElse(BigDecimal.ZERO);
    }

    // ---- Fill processing ----

    @EventListener
    public void onOrderUpdate(OrderUpdateEvent event) {
        processOrderUpdate(event.getOrderUpdate());
    }

    /**
     * Applies a brokerage order update to the grid.
     *
     * @return true if a fill was applied to a grid position
     */
    public boolean processOrderUpdate(OrderUpdate update) {
        Optional<GridTag> decoded = GridTagCodec.tryDecode(update.getTag());
        if (decoded.isEmpty()) {
            return false;
        }
        GridTag gridTag = decoded.get();
        Optional<TradingPair> pairOpt = getPair(gridTag.getLeg1(), gridTag.getLeg2());
        if (pairOpt.isEmpty()) {
            log.warn(
                    "Order update {} references unknown trading pair {}/{}",
                    update.getOrderId(),
                    gridTag.getLeg1(),
                    gridTag.getLeg2());
            return false;
        }
        TradingPair pair = pairOpt.get();

        if (!update.hasFill()) {
            pair.findPosition(gridTag.getLevelPair()).ifPresent(p -> {
                p.applyOrderUpdate(update);
                removeIfFlat(pair, p);
            });
            return false;
        }

        LocalDateTime fillTime = update.getTime() != null ? update.getTime() : LocalDateTime.now();
        if (update.getExecutionId() != null) {
            String market = update.getInstrument() != null ? update.getInstrument().getMarket() : null;
            ProcessedExecution processed = new ProcessedExecution(update.getExecutionId(), market, fillTime);
            if (processedExecutions.putIfAbsent(update.getExecutionId(), processed) != null) {
                log.debug("Skipping duplicate execution {}", update.getExecutionId());
                return false;
            }
        }

        GridPosition position = pair.getOrCreatePosition(gridTag.getLevelPair(), fillTime);
        position.applyOrderUpdate(update);
        if (!position.processFill(update.getInstrument(), update.getFillQuantity(), update.getFillPrice(), fillTime)) {
            return false;
        }
        lastFillTimeByMarket.merge(update.getInstrument().getMarket(), fillTime, (a, b) -> a.isAfter(b) ? a : b);

        log.info(
                "Grid fill {} {} @ {} on {} (level={}, leg1Qty={}, leg2Qty={})",
                update.getInstrument(),
                update.getFillQuantity().toPlainString(),
                update.getFillPrice().toPlainString(),
                pair.getKey(),
                gridTag.getLevelPair().getEntry().getNaturalKey(),
                position.getLeg1Quantity().toPlainString(),
                position.getLeg2Quantity().toPlainString());

        if (update.getStatus() == OrderStatus.FILLED) {
            removeIfFlat(pair, position);
        }
        return true;
    }

    public boolean isExecutionProcessed(String executionId) {
        return processedExecutions.containsKey(executionId);
    }

    public List<ProcessedExecution> getProcessedExecutions() {
        return List.copyOf(processedExecutions.values());
    }

    /**
     * Drops processed executions older than their market's last fill. Executions at exactly the
     * last fill time are kept, since history replay still considers them.
     *
     * @return the number of entries removed
     */
    public int pruneProcessedExecutions() {
        int removed = 0;
        for (ProcessedExecution execution : processedExecutions.values()) {
            LocalDateTime lastFill = execution.market() != null ? lastFillTimeByMarket.get(execution.market()) : null;
            if (lastFill != null
                    && execution.time().isBefore(lastFill)
                    && processedExecutions.remove(execution.executionId(), execution)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} processed executions, {} remain", removed, processedExecutions.size());
        }
        return removed;
    }

    /**
     * Reloads de-duplication state saved with a grid backup, so that history replay after a
     * restart skips fills already contained in restored positions.
     */
    public void restoreFillState(Map<String, LocalDateTime> lastFillTimes, List<ProcessedExecution> executions) {
        if (lastFillTimes != null) {
            lastFillTimes.forEach((market, time) ->
                    lastFillTimeByMarket.merge(market, time, (a, b) -> a.isAfter(b) ? a : b));
        }
        if (executions != null) {
            for (ProcessedExecution execution : executions) {
                processedExecutions.putIfAbsent(execution.executionId(), execution);
            }
        }
        log.info(
                "Restored fill state: {} markets, {} processed executions",
                lastFillTimeByMarket.size(),
                processedExecutions.size());
    }

    public Map<String, LocalDateTime> getLastFillTimes() {
        return Map.copyOf(lastFillTimeByMarket);
    }

    public Optional<LocalDateTime> getLastFillTime(String market) {
        return Optional.ofNullable(lastFillTimeByMarket.get(market));
    }

    private boolean removeIfFlat(TradingPair pair, GridPosition position) {
        if (position.isInvested() || position.hasOutstandingOrders()) {
            return false;
        }
        if (!pair.removePosition(position)) {
            return false;
        }
        log.info(
                "Closed grid position {} on {}",
                position.getLevelPair().getEntry().getNaturalKey(),
                pair.getKey());
        return true;
    }
}
