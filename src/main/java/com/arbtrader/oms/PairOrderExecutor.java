package com.arbtrader.oms;

import com.arbtrader.domain.enums.OrderSide;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.enums.OrderType;
import com.arbtrader.domain.model.Order;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.ledger.ArbitrageTarget;
import com.arbtrader.ledger.LegTarget;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Issues the orders that move each tagged target's legs toward their target quantities.
 *
 * <p>Per target:
 * <ol>
 *   <li>skip while any open order carries the tag (a previous submission is still working)</li>
 *   <li>per leg, delta = target - traded for the tag; legs within one lot are left alone</li>
 *   <li>register each order on its grid position, then place it through the routed gateway</li>
 *   <li>stop at the first leg that fails to place so the second leg is not sent unhedged</li>
 * </ol>
 * Orders are market orders stamped with the target's tag.
 */
@Component
public class PairOrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(PairOrderExecutor.class);

    private final RoutedOrderGateway routedOrderGateway;
    private final TradingPairManager tradingPairManager;

    public PairOrderExecutor(RoutedOrderGateway routedOrderGateway, TradingPairManager tradingPairManager) {
        this.routedOrderGateway = routedOrderGateway;
        this.tradingPairManager = tradingPairManager;
    }

    /** @return the orders that were placed successfully */
    public List<Order> execute(Collection<ArbitrageTarget> targets, Collection<Order> openOrders, LocalDateTime now) {
        List<Order> placed = new ArrayList<>();
        for (ArbitrageTarget target : targets) {
            boolean working = openOrders.stream().anyMatch(o -> Objects.equals(o.getTag(), target.getTag()));
            if (working) {
                log.debug("Target {} has working orders, waiting", target.getTag());
                continue;
            }
            placed.addAll(executeTarget(target, now));
        }
        return placed;
    }

    private List<Order> executeTarget(ArbitrageTarget target, LocalDateTime now) {
        List<Order> placed = new ArrayList<>();
        for (LegTarget leg : target.getLegs()) {
            BigDecimal traded = tradingPairManager.getTradedQuantity(target.getTag(), leg.getInstrument());
            BigDecimal delta = leg.getQuantity().subtract(traded);
            if (delta.abs().compareTo(leg.getLotSize()) < 0) {
                continue;
            }

            Order order = Order.builder()
                    .id(UUID.randomUUID().toString())
                    .instrument(leg.getInstrument())
                    .side(OrderSide.forQuantity(delta))
                    .type(OrderType.MARKET)
                    .quantity(delta.abs())
                    .tag(target.getTag())
                    .placedAt(now)
                    .build();
            tradingPairManager.registerOrder(target.getTag(), order, now);

            if (!routedOrderGateway.placeOrder(order)) {
                order.setStatus(OrderStatus.REJECTED);
                log.warn(
                        "Failed to place {} {} {} for tag {}, remaining legs not sent",
                        order.getSide(),
                        order.getQuantity().toPlainString(),
                        order.getInstrument(),
                        target.getTag());
                break;
            }
            if (order.getStatus() == OrderStatus.NEW) {
                order.setStatus(OrderStatus.SUBMITTED);
            }
            // picks up the broker order id assigned during placement
            tradingPairManager.registerOrder(target.getTag(), order, now);
            log.info(
                    "Placed {} {} {} on {} for tag {}",
                    order.getSide(),
                    order.getQuantity().toPlainString(),
                    order.getInstrument(),
                    order.getAccount(),
                    target.getTag());
            placed.add(order);
        }
        return placed;
    }
}
