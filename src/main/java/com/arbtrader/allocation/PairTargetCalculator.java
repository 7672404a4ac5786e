package com.arbtrader.allocation;

import com.arbtrader.broker.AccountPortfolioProvider;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Security;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.ledger.ArbitrageTarget;
import com.arbtrader.ledger.LegTarget;
import com.arbtrader.oms.routing.OrderRouter;
import com.arbtrader.tag.GridTag;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts paired percentage allocations into per-leg quantity targets.
 *
 * <p>Both legs of a level trade the same notional so the position stays hedged:
 * <ol>
 *   <li>route each leg to its account</li>
 *   <li>planned notional = min over legs of (account portfolio value x |percent|)</li>
 *   <li>cap the notional by the smaller buying power of the two accounts</li>
 *   <li>quantity = notional / mid price, rounded toward zero to the leg's lot size</li>
 * </ol>
 * Flatten allocations become zero-quantity targets without touching account data.
 */
@Component
public class PairTargetCalculator {

    private static final Logger log = LoggerFactory.getLogger(PairTargetCalculator.class);

    private final OrderRouter orderRouter;
    private final AccountPortfolioProvider accountPortfolioProvider;
    private final TradingPairManager tradingPairManager;

    public PairTargetCalculator(
            OrderRouter orderRouter,
            AccountPortfolioProvider accountPortfolioProvider,
            TradingPairManager tradingPairManager) {
        this.orderRouter = orderRouter;
        this.accountPortfolioProvider = accountPortfolioProvider;
        this.tradingPairManager = tradingPairManager;
    }

    public List<ArbitrageTarget> calculate(List<AllocationTarget> allocations) {
        Map<String, List<AllocationTarget>> byTag = new LinkedHashMap<>();
        for (AllocationTarget allocation : allocations) {
            byTag.computeIfAbsent(allocation.getTag(), t -> new ArrayList<>()).add(allocation);
        }

        List<ArbitrageTarget> targets = new ArrayList<>();
        for (Map.Entry<String, List<AllocationTarget>> entry : byTag.entrySet()) {
            try {
                calculate(entry.getKey(), entry.getValue()).ifPresent(targets::add);
            } catch (RuntimeException e) {
                log.error("Failed to size targets for tag {}", entry.getKey(), e);
            }
        }
        return targets;
    }

    private Optional<ArbitrageTarget> calculate(String tag, List<AllocationTarget> allocations) {
        Optional<GridTag> decoded = GridTagCodec.tryDecode(tag);
        if (decoded.isEmpty()) {
            List<LegTarget> legs = allocations.stream()
                    .filter(AllocationTarget::isFlat)
                    .map(a -> new LegTarget(a.getInstrument(), BigDecimal.ZERO, lotSize(a.getInstrument())))
                    .toList();
            if (legs.size() != allocations.size()) {
                log.warn("Skipping non-flat allocation with undecodable tag {}", tag);
                return Optional.empty();
            }
            return Optional.of(new ArbitrageTarget(tag, legs));
        }

        GridTag gridTag = decoded.get();
        InstrumentId leg1 = gridTag.getLeg1();
        InstrumentId leg2 = gridTag.getLeg2();
        BigDecimal percent1 = percentFor(allocations, leg1);
        BigDecimal percent2 = percentFor(allocations, leg2);
        BigDecimal lot1 = lotSize(leg1);
        BigDecimal lot2 = lotSize(leg2);

        if (percent1.signum() == 0 && percent2.signum() == 0) {
            return Optional.of(new ArbitrageTarget(
                    tag,
                    List.of(new LegTarget(leg1, BigDecimal.ZERO, lot1), new LegTarget(leg2, BigDecimal.ZERO, lot2))));
        }

        Optional<BigDecimal> price1 = midPrice(leg1);
        Optional<BigDecimal> price2 = midPrice(leg2);
        if (price1.isEmpty() || price2.isEmpty()) {
            log.warn("No prices to size tag {}, skipping", tag);
            return Optional.empty();
        }

        String account1 = orderRouter.route(leg1);
        String account2 = orderRouter.route(leg2);
        BigDecimal notional1 = accountPortfolioProvider.getTotalPortfolioValue(account1).multiply(percent1.abs());
        BigDecimal notional2 = accountPortfolioProvider.getTotalPortfolioValue(account2).multiply(percent2.abs());
        BigDecimal buyingPower = accountPortfolioProvider
                .getBuyingPower(account1)
                .min(accountPortfolioProvider.getBuyingPower(account2));
        BigDecimal notional = notional1.min(notional2).min(buyingPower);

        BigDecimal quantity1 = roundToLot(notional.divide(price1.get(), MathContext.DECIMAL64), lot1);
        BigDecimal quantity2 = roundToLot(notional.divide(price2.get(), MathContext.DECIMAL64), lot2);
        if (percent1.signum() < 0) {
            quantity1 = quantity1.negate();
        }
        if (percent2.signum() < 0) {
            quantity2 = quantity2.negate();
        }

        log.debug(
                "Sized tag {}: notional={} {}={} {}={}",
                tag,
                notional.toPlainString(),
                leg1,
                quantity1.toPlainString(),
                leg2,
                quantity2.toPlainString());
        return Optional.of(new ArbitrageTarget(
                tag, List.of(new LegTarget(leg1, quantity1, lot1), new LegTarget(leg2, quantity2, lot2))));
    }

    private static BigDecimal roundToLot(BigDecimal quantity, BigDecimal lotSize) {
        return quantity.divide(lotSize, 0, RoundingMode.DOWN).multiply(lotSize).stripTrailingZeros();
    }

    private static BigDecimal percentFor(List<AllocationTarget> allocations, InstrumentId instrument) {
        return allocations.stream()
                .filter(a -> a.getInstrument().equals(instrument))
                .map(AllocationTarget::getPercent)
                .reduce((first, second) -> second)
                .orElse(BigDecimal.ZERO);
    }

    private BigDecimal lotSize(InstrumentId instrument) {
        return tradingPairManager
                .findSecurity(instrument)
                .map(Security::getLotSize)
                .orElse(Security.DEFAULT_LOT_SIZE);
    }

    private Optional<BigDecimal> midPrice(InstrumentId instrument) {
        return tradingPairManager.findSecurity(instrument).map(Security::getMidPrice);
    }
}
