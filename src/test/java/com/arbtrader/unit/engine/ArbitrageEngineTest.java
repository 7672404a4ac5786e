package com.arbtrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.arbtrader.allocation.AllocationTarget;
import com.arbtrader.allocation.ArbitrageAllocationBuilder;
import com.arbtrader.allocation.PairTargetCalculator;
import com.arbtrader.backup.GridStateBackupService;
import com.arbtrader.broker.MultiBrokerageManager;
import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.enums.SignalDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import com.arbtrader.engine.ArbitrageEngine;
import com.arbtrader.engine.EvaluationResult;
import com.arbtrader.exception.BrokerException;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.ledger.ArbitrageTarget;
import com.arbtrader.ledger.ArbitrageTargetLedger;
import com.arbtrader.oms.PairOrderExecutor;
import com.arbtrader.oms.RoutedOrderGateway;
import com.arbtrader.reconciliation.GridReconciliationService;
import com.arbtrader.signal.ArbitrageSignalGenerator;
import com.arbtrader.signal.GridSignal;
import com.arbtrader.signal.SignalCollection;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ArbitrageEngine covering startup ordering, shutdown and how one evaluation
 * tick passes data between the pipeline stages.
 */
@ExtendWith(MockitoExtension.class)
class ArbitrageEngineTest {

    private static final InstrumentId AAPL = InstrumentId.of(SecurityType.EQUITY, "nasdaq", "AAPL");
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 14, 30);

    @Mock
    private TradingPairManager tradingPairManager;

    @Mock
    private ArbitrageSignalGenerator arbitrageSignalGenerator;

    @Mock
    private SignalCollection signalCollection;

    @Mock
    private ArbitrageAllocationBuilder arbitrageAllocationBuilder;

    @Mock
    private PairTargetCalculator pairTargetCalculator;

    @Mock
    private ArbitrageTargetLedger arbitrageTargetLedger;

    @Mock
    private PairOrderExecutor pairOrderExecutor;

    @Mock
    private RoutedOrderGateway routedOrderGateway;

    @Mock
    private MultiBrokerageManager multiBrokerageManager;

    @Mock
    private GridStateBackupService gridStateBackupService;

    @Mock
    private GridReconciliationService gridReconciliationService;

    private ArbitrageEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ArbitrageEngine(
                tradingPairManager,
                arbitrageSignalGenerator,
                signalCollection,
                arbitrageAllocationBuilder,
                pairTargetCalculator,
                arbitrageTargetLedger,
                pairOrderExecutor,
                routedOrderGateway,
                multiBrokerageManager,
                gridStateBackupService,
                gridReconciliationService,
                new ArbitrageProperties());
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Start connects, restores and reconciles in that order")
        void startOrder() {
            engine.start(NOW);

            InOrder order = inOrder(multiBrokerageManager, gridStateBackupService, gridReconciliationService);
            order.verify(multiBrokerageManager).connectAll();
            order.verify(gridStateBackupService).restore();
            order.verify(gridReconciliationService).reconcile(NOW);
            assertThat(engine.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Connection failure leaves the engine stopped and skips restore")
        void connectFailure() {
            doThrow(new BrokerException("connect failed", List.of("crypto")))
                    .when(multiBrokerageManager)
                    .connectAll();

            assertThatThrownBy(() -> engine.start(NOW)).isInstanceOf(BrokerException.class);

            assertThat(engine.isRunning()).isFalse();
            verify(gridStateBackupService, never()).restore();
        }

        @Test
        @DisplayName("Stop writes a backup before disconnecting")
        void stopOrder() {
            engine.start(NOW);

            engine.stop();

            InOrder order = inOrder(gridStateBackupService, multiBrokerageManager);
            order.verify(gridStateBackupService).backup(any());
            order.verify(multiBrokerageManager).disconnectAll();
            assertThat(engine.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Stop before start does nothing")
        void stopWhenNotRunning() {
            engine.stop();

            verify(gridStateBackupService, never()).backup(any());
            verify(multiBrokerageManager, never()).disconnectAll();
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Each stage receives the previous stage's output")
        void stagesWired() {
            GridSignal signal = GridSignal.builder()
                    .instrument(AAPL)
                    .direction(SignalDirection.UP)
                    .type(LevelType.ENTRY)
                    .tag("t1")
                    .generatedTime(NOW)
                    .period(Duration.ofMinutes(5))
                    .build();
            AllocationTarget allocation = AllocationTarget.flat(AAPL, "t1");
            ArbitrageTarget target = new ArbitrageTarget("t1", List.of());
            Order openOrder = Order.builder().id("o-1").instrument(AAPL).build();
            Order placed = Order.builder().id("o-2").instrument(AAPL).build();

            when(arbitrageSignalGenerator.generate(NOW)).thenReturn(List.of(signal));
            when(arbitrageAllocationBuilder.createTargets(NOW)).thenReturn(List.of(allocation));
            when(pairTargetCalculator.calculate(List.of(allocation))).thenReturn(List.of(target));
            when(routedOrderGateway.getOpenOrders()).thenReturn(List.of(openOrder));
            when(arbitrageTargetLedger.getTargets()).thenReturn(List.of(target));
            when(pairOrderExecutor.execute(List.of(target), List.of(openOrder), NOW)).thenReturn(List.of(placed));
            when(arbitrageTargetLedger.clearFulfilled(tradingPairManager, List.of(openOrder)))
                    .thenReturn(List.of());

            EvaluationResult result = engine.evaluate(NOW);

            InOrder order = inOrder(tradingPairManager, signalCollection, arbitrageTargetLedger, pairOrderExecutor);
            order.verify(tradingPairManager).updateAll(NOW);
            order.verify(tradingPairManager).closeIdlePositions();
            order.verify(signalCollection).addAll(List.of(signal));
            order.verify(arbitrageTargetLedger).addAll(List.of(target));
            order.verify(pairOrderExecutor).execute(List.of(target), List.of(openOrder), NOW);
            order.verify(arbitrageTargetLedger).clearFulfilled(tradingPairManager, List.of(openOrder));

            assertThat(result.getSignals()).containsExactly(signal);
            assertThat(result.getAllocations()).containsExactly(allocation);
            assertThat(result.getTargets()).containsExactly(target);
            assertThat(result.getPlacedOrders()).containsExactly(placed);
            assertThat(result.getFulfilledTargets()).isEmpty();
        }
    }
}
