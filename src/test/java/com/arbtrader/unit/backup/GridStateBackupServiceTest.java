package com.arbtrader.unit.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.arbtrader.backup.BackupOptions;
import com.arbtrader.backup.GridStateBackupService;
import com.arbtrader.backup.GridStateSnapshot;
import com.arbtrader.backup.InMemoryBackupStorage;
import com.arbtrader.backup.TieredBackupManager;
import com.arbtrader.broker.ExecutionHistoryProvider;
import com.arbtrader.broker.MultiBrokerageManager;
import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.enums.OrderSide;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.enums.OrderType;
import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.ExecutionRecord;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.domain.model.Security;
import com.arbtrader.event.EventPublisherHelper;
import com.arbtrader.grid.GridLevelPair;
import com.arbtrader.grid.GridPosition;
import com.arbtrader.grid.ProcessedExecution;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.reconciliation.GridReconciliationService;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for GridStateBackupService covering snapshot contents and rebuilding grid
 * positions, including their live orders, after a restart.
 */
class GridStateBackupServiceTest {

    private static final InstrumentId AAPL = InstrumentId.of(SecurityType.EQUITY, "nasdaq", "AAPL");
    private static final InstrumentId AAPL_X = InstrumentId.of(SecurityType.CRYPTO, "binance", "AAPLUSDT");
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 14, 30);

    private InMemoryBackupStorage storage;
    private MultiBrokerageManager multiBrokerageManager;
    private ArbitrageProperties properties;
    private TradingPairManager tradingPairManager;
    private GridStateBackupService service;
    private GridLevelPair levelPair;
    private String tag;

    @BeforeEach
    void setUp() {
        storage = new InMemoryBackupStorage("memory");
        multiBrokerageManager = mock(MultiBrokerageManager.class);
        properties = new ArbitrageProperties();
        tradingPairManager = newManager();
        service = newService(tradingPairManager);

        levelPair = GridLevelPair.of(
                SpreadDirection.LONG_SPREAD, new BigDecimal("-0.02"), new BigDecimal("0.01"), new BigDecimal("0.5"));
        tag = GridTagCodec.encode(AAPL, AAPL_X, levelPair);
    }

    private static TradingPairManager newManager() {
        TradingPairManager manager = new TradingPairManager(mock(EventPublisherHelper.class));
        manager.addPair(new Security(AAPL, BigDecimal.ONE), new Security(AAPL_X), "crypto_stock");
        return manager;
    }

    private GridStateBackupService newService(TradingPairManager manager) {
        TieredBackupManager backups = new TieredBackupManager("bot", BackupOptions.defaults(), List.of(storage));
        return new GridStateBackupService(manager, backups, multiBrokerageManager, properties);
    }

    private void openPosition() {
        tradingPairManager.processOrderUpdate(OrderUpdate.builder()
                .brokerOrderId("B-1")
                .instrument(AAPL)
                .status(OrderStatus.FILLED)
                .fillQuantity(new BigDecimal("50"))
                .fillPrice(new BigDecimal("100"))
                .executionId("e-1")
                .tag(tag)
                .time(NOW)
                .build());
        tradingPairManager.registerOrder(tag, workingOrder(), NOW);
    }

    private Order workingOrder() {
        return Order.builder()
                .id("o-2")
                .brokerOrderId("B-2")
                .instrument(AAPL_X)
                .side(OrderSide.SELL)
                .type(OrderType.MARKET)
                .quantity(new BigDecimal("100"))
                .status(OrderStatus.SUBMITTED)
                .tag(tag)
                .build();
    }

    @Nested
    @DisplayName("Snapshot")
    class Snapshot {

        @Test
        @DisplayName("Snapshot carries tag, quantities and broker order ids per position")
        void snapshotContents() {
            openPosition();

            GridStateSnapshot snapshot = service.createSnapshot(NOW);

            assertThat(snapshot.getSavedAt()).isEqualTo(NOW);
            assertThat(snapshot.getPositions()).singleElement().satisfies(p -> {
                assertThat(p.getTag()).isEqualTo(tag);
                assertThat(p.getLeg1Quantity()).isEqualByComparingTo("50");
                assertThat(p.getLeg1AverageCost()).isEqualByComparingTo("100");
                assertThat(p.getBrokerOrderIds()).containsExactlyInAnyOrder("B-1", "B-2");
            });
        }

        @Test
        @DisplayName("Snapshot carries last fill times and processed execution ids")
        void snapshotFillState() {
            openPosition();

            GridStateSnapshot snapshot = service.createSnapshot(NOW);

            assertThat(snapshot.getLastFillTimes()).containsEntry("nasdaq", NOW);
            assertThat(snapshot.getProcessedExecutions()).singleElement().satisfies(e -> {
                assertThat(e.getExecutionId()).isEqualTo("e-1");
                assertThat(e.getMarket()).isEqualTo("nasdaq");
                assertThat(e.getTime()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("Backup is written through the tiered manager")
        void backupWritten() {
            openPosition();

            assertThat(service.backup(NOW)).isPresent();
            assertThat(storage.listKeys("trade_data/bot/backups/")).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Restore")
    class Restore {

        @Test
        @DisplayName("Restarted manager gets positions and their open orders back")
        void restoreAfterRestart() {
            openPosition();
            service.backup(NOW);

            TradingPairManager restarted = newManager();
            when(multiBrokerageManager.getOpenOrders()).thenReturn(List.of(workingOrder()));

            int restored = newService(restarted).restore();

            assertThat(restored).isEqualTo(1);
            GridPosition position = restarted.findPosition(tag).orElseThrow();
            assertThat(position.getLeg1Quantity()).isEqualByComparingTo("50");
            assertThat(position.getFirstFillTime()).isEqualTo(NOW);
            assertThat(position.getLiveOrders()).extracting(Order::getBrokerOrderId).containsExactly("B-2");
            assertThat(restarted.getTradedQuantity(tag, AAPL)).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("Reconciliation after restore does not replay fills already in restored positions")
        void restoredFillsNotReplayed() {
            openPosition();
            service.backup(NOW);

            TradingPairManager restarted = newManager();
            when(multiBrokerageManager.getOpenOrders()).thenReturn(List.of(workingOrder()));
            newService(restarted).restore();

            ExecutionHistoryProvider history = mock(ExecutionHistoryProvider.class);
            when(history.getExecutionHistory(any(), any())).thenReturn(List.of(ExecutionRecord.builder()
                    .executionId("e-1")
                    .brokerOrderId("B-1")
                    .instrument(AAPL)
                    .quantity(new BigDecimal("50"))
                    .price(new BigDecimal("100"))
                    .time(NOW)
                    .tag(tag)
                    .account("stocks")
                    .build()));
            GridReconciliationService reconciliation = new GridReconciliationService(restarted, history, properties);

            int replayed = reconciliation.reconcile(NOW.plusMinutes(1));

            assertThat(replayed).isZero();
            assertThat(restarted.isExecutionProcessed("e-1")).isTrue();
            assertThat(restarted.getLastFillTime("nasdaq")).contains(NOW);
            assertThat(restarted.getTradedQuantity(tag, AAPL)).isEqualByComparingTo("50");
            assertThat(restarted.getProcessedExecutions())
                    .containsExactly(new ProcessedExecution("e-1", "nasdaq", NOW));
        }

        @Test
        @DisplayName("Positions of pairs no longer registered are skipped")
        void unregisteredPairSkipped() {
            openPosition();
            service.backup(NOW);

            TradingPairManager empty = new TradingPairManager(mock(EventPublisherHelper.class));
            when(multiBrokerageManager.getOpenOrders()).thenReturn(List.of());

            assertThat(newService(empty).restore()).isZero();
            assertThat(empty.getAllPositions()).isEmpty();
        }

        @Test
        @DisplayName("Unreadable backup restores nothing")
        void unreadableBackup() {
            storage.save("trade_data/bot/backups/daily/20250310_000000", "{not json");

            assertThat(service.restore()).isZero();
        }

        @Test
        @DisplayName("No backup restores nothing")
        void noBackup() {
            assertThat(service.restore()).isZero();
        }
    }
}
