package com.arbtrader.reconciliation;

import com.arbtrader.broker.ExecutionHistoryProvider;
import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.model.ExecutionRecord;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.tag.GridTagCodec;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays grid fills that happened while the process was down or disconnected.
 *
 * <p>Steps:
 * <ol>
 *   <li>window start = earliest per-market last fill time minus the overlap, or now minus the
 *       default lookback when no fill has been seen</li>
 *   <li>fetch execution history from every account that supports it</li>
 *   <li>keep grid-tagged executions not yet applied and not older than their market's last fill</li>
 *   <li>replay them in time order through the trading pair manager's fill processing</li>
 * </ol>
 * Execution id de-duplication in the manager makes repeated runs harmless. Afterwards, processed
 * ids older than their market's last fill are pruned, since the window never reaches them again.
 */
@Service
public class GridReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(GridReconciliationService.class);

    private final TradingPairManager tradingPairManager;
    private final ExecutionHistoryProvider executionHistoryProvider;
    private final ArbitrageProperties arbitrageProperties;

    public GridReconciliationService(
            TradingPairManager tradingPairManager,
            ExecutionHistoryProvider executionHistoryProvider,
            ArbitrageProperties arbitrageProperties) {
        this.tradingPairManager = tradingPairManager;
        this.executionHistoryProvider = executionHistoryProvider;
        this.arbitrageProperties = arbitrageProperties;
    }

    /** @return the number of executions replayed */
    public int reconcile(LocalDateTime now) {
        LocalDateTime from = windowStart(now);
        List<ExecutionRecord> history = executionHistoryProvider.getExecutionHistory(from, now);

        List<ExecutionRecord> missed = history.stream()
                .filter(r -> GridTagCodec.isGridTag(r.getTag()))
                .filter(r -> r.getExecutionId() == null || !tradingPairManager.isExecutionProcessed(r.getExecutionId()))
                .filter(this::notBeforeLastFill)
                .sorted(Comparator.comparing(ExecutionRecord::getTime))
                .toList();

        int replayed = 0;
        for (ExecutionRecord record : missed) {
            if (tradingPairManager.processOrderUpdate(toOrderUpdate(record))) {
                replayed++;
            }
        }
        int pruned = tradingPairManager.pruneProcessedExecutions();
        log.info(
                "Reconciliation from {}: {} executions in history, {} missed, {} replayed, {} ids pruned",
                from,
                history.size(),
                missed.size(),
                replayed,
                pruned);
        return replayed;
    }

    private LocalDateTime windowStart(LocalDateTime now) {
        ArbitrageProperties.Reconciliation config = arbitrageProperties.getReconciliation();
        Map<String, LocalDateTime> lastFills = tradingPairManager.getLastFillTimes();
        return lastFills.values().stream()
                .min(Comparator.naturalOrder())
                .map(earliest -> earliest.minus(config.getOverlap()))
                .orElse(now.minus(config.getDefaultLookback()));
    }

    private boolean notBeforeLastFill(ExecutionRecord record) {
        if (record.getTime() == null || record.getInstrument() == null) {
            return false;
        }
        Optional<LocalDateTime> lastFill = tradingPairManager.getLastFillTime(record.getInstrument().getMarket());
        return lastFill.isEmpty() || !record.getTime().isBefore(lastFill.get());
    }

    private static OrderUpdate toOrderUpdate(ExecutionRecord record) {
        return OrderUpdate.builder()
                .brokerOrderId(record.getBrokerOrderId())
                .instrument(record.getInstrument())
                .status(OrderStatus.FILLED)
                .fillPrice(record.getPrice())
                .fillQuantity(record.getQuantity())
                .executionId(record.getExecutionId())
                .tag(record.getTag())
                .account(record.getAccount())
                .time(record.getTime())
                .fee(record.getFee())
                .build();
    }
}
