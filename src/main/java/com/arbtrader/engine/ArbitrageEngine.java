package com.arbtrader.engine;

import com.arbtrader.allocation.AllocationTarget;
import com.arbtrader.allocation.ArbitrageAllocationBuilder;
import com.arbtrader.allocation.PairTargetCalculator;
import com.arbtrader.backup.GridStateBackupService;
import com.arbtrader.broker.MultiBrokerageManager;
import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.model.Order;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.ledger.ArbitrageTarget;
import com.arbtrader.ledger.ArbitrageTargetLedger;
import com.arbtrader.oms.PairOrderExecutor;
import com.arbtrader.oms.RoutedOrderGateway;
import com.arbtrader.reconciliation.GridReconciliationService;
import com.arbtrader.signal.ArbitrageSignalGenerator;
import com.arbtrader.signal.GridSignal;
import com.arbtrader.signal.SignalCollection;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives the arbitrage pipeline.
 *
 * <p>Startup ({@link #start}): connect every account (all-or-nothing), restore grid state from
 * the latest backup, then replay fills missed while offline.
 *
 * <p>One evaluation tick ({@link #evaluate}), synchronous and single-threaded:
 * <ol>
 *   <li>update spreads of all trading pairs and drop idle grid positions</li>
 *   <li>generate signals and add them to the signal collection</li>
 *   <li>build paired allocation targets from active signals and sweep expired ones</li>
 *   <li>size them into per-leg quantity targets and upsert them into the ledger by tag</li>
 *   <li>place orders for outstanding ledger targets</li>
 *   <li>clear fulfilled targets from the ledger</li>
 * </ol>
 */
@Service
public class ArbitrageEngine {

    private static final Logger log = LoggerFactory.getLogger(ArbitrageEngine.class);

    private final TradingPairManager tradingPairManager;
    private final ArbitrageSignalGenerator arbitrageSignalGenerator;
    private final SignalCollection signalCollection;
    private final ArbitrageAllocationBuilder arbitrageAllocationBuilder;
    private final PairTargetCalculator pairTargetCalculator;
    private final ArbitrageTargetLedger arbitrageTargetLedger;
    private final PairOrderExecutor pairOrderExecutor;
    private final RoutedOrderGateway routedOrderGateway;
    private final MultiBrokerageManager multiBrokerageManager;
    private final GridStateBackupService gridStateBackupService;
    private final GridReconciliationService gridReconciliationService;
    private final ArbitrageProperties arbitrageProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ArbitrageEngine(
            TradingPairManager tradingPairManager,
            ArbitrageSignalGenerator arbitrageSignalGenerator,
            SignalCollection signalCollection,
            ArbitrageAllocationBuilder arbitrageAllocationBuilder,
            PairTargetCalculator pairTargetCalculator,
            ArbitrageTargetLedger arbitrageTargetLedger,
            PairOrderExecutor pairOrderExecutor,
            RoutedOrderGateway routedOrderGateway,
            MultiBrokerageManager multiBrokerageManager,
            GridStateBackupService gridStateBackupService,
            GridReconciliationService gridReconciliationService,
            ArbitrageProperties arbitrageProperties) {
        this.tradingPairManager = tradingPairManager;
        this.arbitrageSignalGenerator = arbitrageSignalGenerator;
        this.signalCollection = signalCollection;
        this.arbitrageAllocationBuilder = arbitrageAllocationBuilder;
        this.pairTargetCalculator = pairTargetCalculator;
        this.arbitrageTargetLedger = arbitrageTargetLedger;
        this.pairOrderExecutor = pairOrderExecutor;
        this.routedOrderGateway = routedOrderGateway;
        this.multiBrokerageManager = multiBrokerageManager;
        this.gridStateBackupService = gridStateBackupService;
        this.gridReconciliationService = gridReconciliationService;
        this.arbitrageProperties = arbitrageProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (arbitrageProperties.getEngine().isAutoStart()) {
            start(LocalDateTime.now());
        }
    }

    /**
     * Connects all accounts, restores grid state and reconciles missed fills.
     *
     * @throws com.arbtrader.exception.BrokerException if any account fails to connect
     */
    public void start(LocalDateTime now) {
        if (running.get()) {
            log.warn("Arbitrage engine already running");
            return;
        }
        multiBrokerageManager.connectAll();
        int restored = gridStateBackupService.restore();
        int replayed = gridReconciliationService.reconcile(now);
        running.set(true);
        log.info("Arbitrage engine started: {} grid positions restored, {} fills replayed", restored, replayed);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        gridStateBackupService.backup(LocalDateTime.now());
        multiBrokerageManager.disconnectAll();
        log.info("Arbitrage engine stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedDelayString = "${arbtrader.engine.evaluation-interval-ms:1000}")
    public void scheduledEvaluation() {
        if (!running.get()) {
            return;
        }
        try {
            evaluate(LocalDateTime.now());
        } catch (RuntimeException e) {
            log.error("Evaluation tick failed", e);
        }
    }

    public EvaluationResult evaluate(LocalDateTime now) {
        tradingPairManager.updateAll(now);
        tradingPairManager.closeIdlePositions();

        List<GridSignal> signals = arbitrageSignalGenerator.generate(now);
        signalCollection.addAll(signals);

        List<AllocationTarget> allocations = arbitrageAllocationBuilder.createTargets(now);
        List<ArbitrageTarget> targets = pairTargetCalculator.calculate(allocations);
        arbitrageTargetLedger.addAll(targets);

        List<Order> openOrders = routedOrderGateway.getOpenOrders();
        List<Order> placed = pairOrderExecutor.execute(arbitrageTargetLedger.getTargets(), openOrders, now);
        List<ArbitrageTarget> fulfilled = arbitrageTargetLedger.clearFulfilled(tradingPairManager, openOrders);

        if (!signals.isEmpty() || !placed.isEmpty() || !fulfilled.isEmpty()) {
            log.info(
                    "Evaluation: {} signals, {} allocations, {} targets, {} orders placed, {} targets fulfilled",
                    signals.size(),
                    allocations.size(),
                    targets.size(),
                    placed.size(),
                    fulfilled.size());
        }
        return EvaluationResult.builder()
                .signals(signals)
                .allocations(allocations)
                .targets(targets)
                .placedOrders(placed)
                .fulfilledTargets(fulfilled)
                .build();
    }
}
