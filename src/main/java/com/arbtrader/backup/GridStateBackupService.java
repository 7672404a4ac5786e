package com.arbtrader.backup;

import com.arbtrader.broker.MultiBrokerageManager;
import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.model.Order;
import com.arbtrader.grid.GridPosition;
import com.arbtrader.grid.ProcessedExecution;
import com.arbtrader.grid.TradingPair;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.mapper.JsonHelper;
import com.arbtrader.tag.GridTag;
import com.arbtrader.tag.GridTagCodec;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Persists grid positions through the tiered backup manager and rebuilds them on startup.
 *
 * <p>Restore runs after trading pairs are registered: each saved position is re-attached to its
 * pair, then its live order references are rebuilt from the brokerages' open orders using the
 * saved broker order ids. Positions whose pair is no longer registered are skipped. The saved
 * last fill times and processed execution ids are loaded into the trading pair manager first,
 * which bounds the reconciliation window that follows.
 */
@Service
public class GridStateBackupService {

    private static final Logger log = LoggerFactory.getLogger(GridStateBackupService.class);

    private final TradingPairManager tradingPairManager;
    private final TieredBackupManager tieredBackupManager;
    private final MultiBrokerageManager multiBrokerageManager;
    private final ArbitrageProperties arbitrageProperties;

    public GridStateBackupService(
            TradingPairManager tradingPairManager,
            TieredBackupManager tieredBackupManager,
            MultiBrokerageManager multiBrokerageManager,
            ArbitrageProperties arbitrageProperties) {
        this.tradingPairManager = tradingPairManager;
        this.tieredBackupManager = tieredBackupManager;
        this.multiBrokerageManager = multiBrokerageManager;
        this.arbitrageProperties = arbitrageProperties;
    }

    /**
     * Scheduled backup attempt every minute. The tiered backup manager decides whether the
     * attempt is written.
     */
    @Scheduled(fixedDelayString = "${arbtrader.backup.check-interval-ms:60000}")
    public void scheduledBackup() {
        if (!arbitrageProperties.getBackup().isEnabled()) {
            return;
        }
        try {
            backup(LocalDateTime.now());
        } catch (RuntimeException e) {
            log.error("Scheduled grid state backup failed", e);
        }
    }

    /** Prunes stale processed executions, then writes a snapshot through the tiered manager. */
    public Optional<BackupRecord> backup(LocalDateTime now) {
        tradingPairManager.pruneProcessedExecutions();
        GridStateSnapshot snapshot = createSnapshot(now);
        return tieredBackupManager.saveBackup(JsonHelper.toJson(snapshot), now);
    }

    public GridStateSnapshot createSnapshot(LocalDateTime now) {
        GridStateSnapshot snapshot = new GridStateSnapshot();
        snapshot.setSavedAt(now);
        snapshot.getLastFillTimes().putAll(tradingPairManager.getLastFillTimes());
        for (ProcessedExecution execution : tradingPairManager.getProcessedExecutions()) {
            snapshot.getProcessedExecutions()
                    .add(GridStateSnapshot.ExecutionState.builder()
                            .executionId(execution.executionId())
                            .market(execution.market())
                            .time(execution.time())
                            .build());
        }
        for (GridPosition position : tradingPairManager.getAllPositions()) {
            GridPosition.PersistedState state = position.toPersistedState();
            snapshot.getPositions()
                    .add(GridStateSnapshot.PositionState.builder()
                            .tag(GridTagCodec.encode(position.getLeg1(), position.getLeg2(), position.getLevelPair()))
                            .openTime(state.openTime())
                            .firstFillTime(state.firstFillTime())
                            .leg1Quantity(state.leg1Quantity())
                            .leg1AverageCost(state.leg1AverageCost())
                            .leg2Quantity(state.leg2Quantity())
                            .leg2AverageCost(state.leg2AverageCost())
                            .brokerOrderIds(state.brokerOrderIds())
                            .build());
        }
        return snapshot;
    }

    /**
     * Restores positions from the latest backup.
     *
     * @return the number of positions restored
     */
    public int restore() {
        Optional<String> content = tieredBackupManager.restoreLatest();
        if (content.isEmpty()) {
            return 0;
        }
        GridStateSnapshot snapshot;
        try {
            snapshot = JsonHelper.fromJson(content.get(), GridStateSnapshot.class);
        } catch (IllegalStateException e) {
            log.error("Latest grid state backup is unreadable, starting with an empty grid", e);
            return 0;
        }
        if (snapshot == null) {
            return 0;
        }
        restoreFillState(snapshot);
        if (snapshot.getPositions() == null) {
            return 0;
        }

        List<Order> openOrders = multiBrokerageManager.getOpenOrders();
        int restored = 0;
        for (GridStateSnapshot.PositionState state : snapshot.getPositions()) {
            Optional<GridTag> decoded = GridTagCodec.tryDecode(state.getTag());
            if (decoded.isEmpty()) {
                log.warn("Skipping saved grid position with undecodable tag {}", state.getTag());
                continue;
            }
            GridTag gridTag = decoded.get();
            Optional<TradingPair> pair = tradingPairManager.getPair(gridTag.getLeg1(), gridTag.getLeg2());
            if (pair.isEmpty()) {
                log.warn(
                        "Skipping saved grid position for unregistered pair {}/{}",
                        gridTag.getLeg1(),
                        gridTag.getLeg2());
                continue;
            }
            GridPosition position = GridPosition.restore(
                    gridTag.getLeg1(),
                    gridTag.getLeg2(),
                    pair.get().getLeg1().getLotSize(),
                    pair.get().getLeg2().getLotSize(),
                    gridTag.getLevelPair(),
                    new GridPosition.PersistedState(
                            state.getOpenTime(),
                            state.getFirstFillTime(),
                            state.getLeg1Quantity(),
                            state.getLeg1AverageCost(),
                            state.getLeg2Quantity(),
                            state.getLeg2AverageCost(),
                            state.getBrokerOrderIds()));
            int liveOrders = position.restoreLiveOrders(openOrders);
            pair.get().restorePosition(position);
            restored++;
            log.info(
                    "Restored grid position {} on {} ({} live orders)",
                    gridTag.getLevelPair().getEntry().getNaturalKey(),
                    pair.get().getKey(),
                    liveOrders);
        }
        return restored;
    }

    private void restoreFillState(GridStateSnapshot snapshot) {
        List<ProcessedExecution> executions = snapshot.getProcessedExecutions() == null
                ? List.of()
                : snapshot.getProcessedExecutions().stream()
                        .filter(e -> e.getExecutionId() != null && e.getTime() != null)
                        .map(e -> new ProcessedExecution(e.getExecutionId(), e.getMarket(), e.getTime()))
                        .toList();
        tradingPairManager.restoreFillState(snapshot.getLastFillTimes(), executions);
    }
}
