package com.arbtrader.grid;

import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import com.arbtrader.domain.model.OrderUpdate;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live two-leg position opened by one grid level pair of one trading pair.
 *
 * <p>Quantities and average costs change only through {@link #processFill}. Fills for the two
 * legs arrive on brokerage I/O threads in any order and in separate callbacks, so all reads and
 * writes of the leg state are synchronized on the position.
 *
 * <p>Broker order ids are durable and are written to grid state backups. The live order list is
 * transient: after a restart it is rebuilt from the brokerage's open orders using the durable ids.
 */
public class GridPosition {

    private static final Logger log = LoggerFactory.getLogger(GridPosition.class);

    private final InstrumentId leg1;
    private final InstrumentId leg2;
    private final BigDecimal leg1LotSize;
    private final BigDecimal leg2LotSize;
    private final GridLevelPair levelPair;
    private final LocalDateTime openTime;

    private LocalDateTime firstFillTime;
    private BigDecimal leg1Quantity = BigDecimal.ZERO;
    private BigDecimal leg1AverageCost = BigDecimal.ZERO;
    private BigDecimal leg2Quantity = BigDecimal.ZERO;
    private BigDecimal leg2AverageCost = BigDecimal.ZERO;

    private final Set<String> brokerOrderIds = ConcurrentHashMap.newKeySet();
    private final List<Order> liveOrders = new CopyOnWriteArrayList<>();

    public GridPosition(
            InstrumentId leg1,
            InstrumentId leg2,
            BigDecimal leg1LotSize,
            BigDecimal leg2LotSize,
            GridLevelPair levelPair,
            LocalDateTime openTime) {
        this.leg1 = Objects.requireNonNull(leg1, "leg1");
        this.leg2 = Objects.requireNonNull(leg2, "leg2");
        this.leg1LotSize = leg1LotSize;
        this.leg2LotSize = leg2LotSize;
        this.levelPair = Objects.requireNonNull(levelPair, "levelPair");
        this.openTime = openTime;
    }

    /** Rebuilds a position from a persisted snapshot. Live orders are restored separately. */
    public static GridPosition restore(
            InstrumentId leg1,
            InstrumentId leg2,
            BigDecimal leg1LotSize,
            BigDecimal leg2LotSize,
            GridLevelPair levelPair,
            PersistedState state) {
        GridPosition position = new GridPosition(leg1, leg2, leg1LotSize, leg2LotSize, levelPair, state.openTime());
        position.firstFillTime = state.firstFillTime();
        position.leg1Quantity = orZero(state.leg1Quantity());
        position.leg1AverageCost = orZero(state.leg1AverageCost());
        position.leg2Quantity = orZero(state.leg2Quantity());
        position.leg2AverageCost = orZero(state.leg2AverageCost());
        if (state.brokerOrderIds() != null) {
            position.brokerOrderIds.addAll(state.brokerOrderIds());
        }
        return position;
    }

    /**
     * Applies one fill to the matching leg using an incremental weighted-average cost.
     * The average cost resets to zero when the leg quantity returns to zero.
     *
     * @param fillQuantity signed fill quantity (positive for buys)
     * @return false if the instrument is not one of this position's legs
     */
    public synchronized boolean processFill(
            InstrumentId instrument, BigDecimal fillQuantity, BigDecimal fillPrice, LocalDateTime time) {
        if (fillQuantity == null || fillQuantity.signum() == 0) {
            return false;
        }
        if (leg1.equals(instrument)) {
            BigDecimal total = leg1AverageCost.multiply(leg1Quantity).add(fillPrice.multiply(fillQuantity));
            leg1Quantity = leg1Quantity.add(fillQuantity);
            leg1AverageCost = averageCost(total, leg1Quantity);
        } else if (leg2.equals(instrument)) {
            BigDecimal total = leg2AverageCost.multiply(leg2Quantity).add(fillPrice.multiply(fillQuantity));
            leg2Quantity = leg2Quantity.add(fillQuantity);
            leg2AverageCost = averageCost(total, leg2Quantity);
        } else {
            log.warn("Fill for {} does not belong to grid position {}/{}", instrument, leg1, leg2);
            return false;
        }
        if (firstFillTime == null) {
            firstFillTime = time;
        }
        return true;
    }

    /**
     * True when either leg holds at least one lot. Residual quantities below the lot size
     * count as flat.
     */
    public synchronized boolean isInvested() {
        return leg1Quantity.abs().compareTo(leg1LotSize) >= 0 || leg2Quantity.abs().compareTo(leg2LotSize) >= 0;
    }

    /**
     * Exit check against this position's own level pair. A LONG_SPREAD position exits once the
     * spread has risen to the exit threshold, a SHORT_SPREAD position once it has fallen to it.
     */
    public boolean shouldExit(BigDecimal currentSpread) {
        if (currentSpread == null || !isInvested()) {
            return false;
        }
        BigDecimal exitThreshold = levelPair.getExit().getSpreadThreshold();
        if (levelPair.getDirection() == SpreadDirection.LONG_SPREAD) {
            return currentSpread.compareTo(exitThreshold) >= 0;
        }
        return currentSpread.compareTo(exitThreshold) <= 0;
    }

    /** Signed quantity held on the given leg, zero for any other instrument. */
    public synchronized BigDecimal getQuantity(InstrumentId instrument) {
        if (leg1.equals(instrument)) {
            return leg1Quantity;
        }
        if (leg2.equals(instrument)) {
            return leg2Quantity;
        }
        return BigDecimal.ZERO;
    }

    // ---- Orders ----

    public void registerOrder(Order order) {
        if (order.getBrokerOrderId() != null) {
            brokerOrderIds.add(order.getBrokerOrderId());
        }
        boolean known = liveOrders.stream().anyMatch(o -> o == order || Objects.equals(o.getId(), order.getId()));
        if (!known) {
            liveOrders.add(order);
        }
    }

    /**
     * Tracks the status of a live order from a brokerage update. Orders that reach a terminal
     * status leave the live list; their broker ids stay durable.
     */
    public void applyOrderUpdate(OrderUpdate update) {
        if (update.getBrokerOrderId() != null) {
            brokerOrderIds.add(update.getBrokerOrderId());
        }
        for (Order order : liveOrders) {
            boolean sameOrder = (update.getOrderId() != null && update.getOrderId().equals(order.getId()))
                    || (update.getBrokerOrderId() != null
                            && update.getBrokerOrderId().equals(order.getBrokerOrderId()));
            if (!sameOrder) {
                continue;
            }
            if (order.getBrokerOrderId() == null) {
                order.setBrokerOrderId(update.getBrokerOrderId());
            }
            if (update.getStatus() != null) {
                order.setStatus(update.getStatus());
            }
            if (update.hasFill()) {
                BigDecimal filled = order.getFilledQuantity() != null ? order.getFilledQuantity() : BigDecimal.ZERO;
                order.setFilledQuantity(filled.add(update.getFillQuantity().abs()));
            }
            order.setUpdatedAt(update.getTime());
            if (!order.getStatus().isOpen()) {
                liveOrders.remove(order);
            }
        }
    }

    public boolean hasOutstandingOrders() {
        return liveOrders.stream().anyMatch(o -> o.getStatus() != null && o.getStatus().isOpen());
    }

    /**
     * Re-attaches open brokerage orders whose broker ids this position owns.
     *
     * @return the number of orders attached
     */
    public int restoreLiveOrders(Collection<Order> openOrders) {
        int restored = 0;
        for (Order order : openOrders) {
            if (order.getBrokerOrderId() == null || !brokerOrderIds.contains(order.getBrokerOrderId())) {
                continue;
            }
            boolean known = liveOrders.stream().anyMatch(o -> order.getBrokerOrderId().equals(o.getBrokerOrderId()));
            if (!known) {
                liveOrders.add(order);
                restored++;
            }
        }
        return restored;
    }

    public List<Order> getLiveOrders() {
        return List.copyOf(liveOrders);
    }

    public Set<String> getBrokerOrderIds() {
        return Set.copyOf(brokerOrderIds);
    }

    // ---- Snapshot ----

    public synchronized PersistedState toPersistedState() {
        return new PersistedState(
                openTime,
                firstFillTime,
                leg1Quantity,
                leg1AverageCost,
                leg2Quantity,
                leg2AverageCost,
                Set.copyOf(brokerOrderIds));
    }

    public InstrumentId getLeg1() {
        return leg1;
    }

    public InstrumentId getLeg2() {
        return leg2;
    }

    public GridLevelPair getLevelPair() {
        return levelPair;
    }

    public LocalDateTime getOpenTime() {
        return openTime;
    }

    public synchronized LocalDateTime getFirstFillTime() {
        return firstFillTime;
    }

    public synchronized BigDecimal getLeg1Quantity() {
        return leg1Quantity;
    }

    public synchronized BigDecimal getLeg1AverageCost() {
        return leg1AverageCost;
    }

    public synchronized BigDecimal getLeg2Quantity() {
        return leg2Quantity;
    }

    public synchronized BigDecimal getLeg2AverageCost() {
        return leg2AverageCost;
    }

    @Override
    public String toString() {
        return "GridPosition{" + leg1 + "/" + leg2 + ", " + levelPair.getEntry().getNaturalKey() + "}";
    }

    private static BigDecimal averageCost(BigDecimal total, BigDecimal quantity) {
        return quantity.signum() != 0 ? total.divide(quantity, MathContext.DECIMAL64) : BigDecimal.ZERO;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /** Durable part of a position, written to and read from grid state backups. */
    public record PersistedState(
            LocalDateTime openTime,
            LocalDateTime firstFillTime,
            BigDecimal leg1Quantity,
            BigDecimal leg1AverageCost,
            BigDecimal leg2Quantity,
            BigDecimal leg2AverageCost,
            Set<String> brokerOrderIds) {}
}
