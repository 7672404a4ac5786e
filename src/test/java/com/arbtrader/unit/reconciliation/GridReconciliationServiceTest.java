package com.arbtrader.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.arbtrader.broker.ExecutionHistoryProvider;
import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.ExecutionRecord;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Security;
import com.arbtrader.event.EventPublisherHelper;
import com.arbtrader.grid.GridLevelPair;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.reconciliation.GridReconciliationService;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for GridReconciliationService covering the history window and which
 * executions are replayed into the grid.
 */
class GridReconciliationServiceTest {

    private static final InstrumentId AAPL = InstrumentId.of(SecurityType.EQUITY, "nasdaq", "AAPL");
    private static final InstrumentId AAPL_X = InstrumentId.of(SecurityType.CRYPTO, "binance", "AAPLUSDT");
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 14, 30);

    private TradingPairManager tradingPairManager;
    private ExecutionHistoryProvider historyProvider;
    private GridReconciliationService service;
    private String tag;

    @BeforeEach
    void setUp() {
        tradingPairManager = new TradingPairManager(mock(EventPublisherHelper.class));
        tradingPairManager.addPair(new Security(AAPL, BigDecimal.ONE), new Security(AAPL_X), "crypto_stock");
        historyProvider = mock(ExecutionHistoryProvider.class);
        service = new GridReconciliationService(tradingPairManager, historyProvider, new ArbitrageProperties());

        GridLevelPair levelPair = GridLevelPair.of(
                SpreadDirection.LONG_SPREAD, new BigDecimal("-0.02"), new BigDecimal("0.01"), new BigDecimal("0.5"));
        tag = GridTagCodec.encode(AAPL, AAPL_X, levelPair);
    }

    private ExecutionRecord execution(
            String id, InstrumentId instrument, String qty, String recordTag, int minutesAgo) {
        return ExecutionRecord.builder()
                .executionId(id)
                .brokerOrderId("B-" + id)
                .instrument(instrument)
                .quantity(new BigDecimal(qty))
                .price(new BigDecimal("100"))
                .time(NOW.minusMinutes(minutesAgo))
                .tag(recordTag)
                .account("stocks")
                .build();
    }

    @Test
    @DisplayName("Without prior fills the window starts at now minus the default lookback")
    void defaultLookbackWindow() {
        when(historyProvider.getExecutionHistory(any(), any())).thenReturn(List.of());

        assertThat(service.reconcile(NOW)).isZero();

        verify(historyProvider).getExecutionHistory(NOW.minusMinutes(30), NOW);
    }

    @Test
    @DisplayName("Missed grid executions are replayed in time order and others are ignored")
    void replaysGridExecutions() {
        when(historyProvider.getExecutionHistory(any(), any()))
                .thenReturn(List.of(
                        execution("e-2", AAPL_X, "-100", tag, 5),
                        execution("e-1", AAPL, "50", tag, 10),
                        execution("e-3", AAPL, "10", "manual-order", 8),
                        execution("e-4", AAPL, "10", null, 7)));

        int replayed = service.reconcile(NOW);

        assertThat(replayed).isEqualTo(2);
        assertThat(tradingPairManager.getTradedQuantity(tag, AAPL)).isEqualByComparingTo("50");
        assertThat(tradingPairManager.getTradedQuantity(tag, AAPL_X)).isEqualByComparingTo("-100");
        assertThat(tradingPairManager.findPosition(tag).orElseThrow().getFirstFillTime())
                .isEqualTo(NOW.minusMinutes(10));
    }

    @Test
    @DisplayName("A second run skips executions already applied and starts from the last fill minus the overlap")
    void repeatedRunIsHarmless() {
        List<ExecutionRecord> history = List.of(execution("e-1", AAPL, "50", tag, 10));
        when(historyProvider.getExecutionHistory(any(), any())).thenReturn(history);
        service.reconcile(NOW);

        int replayed = service.reconcile(NOW);

        assertThat(replayed).isZero();
        assertThat(tradingPairManager.getTradedQuantity(tag, AAPL)).isEqualByComparingTo("50");
        verify(historyProvider).getExecutionHistory(NOW.minusMinutes(15), NOW);
    }

    @Test
    @DisplayName("Executions older than their market's last fill are not replayed")
    void olderThanLastFillSkipped() {
        when(historyProvider.getExecutionHistory(any(), any()))
                .thenReturn(List.of(execution("e-1", AAPL, "50", tag, 10)));
        service.reconcile(NOW);

        when(historyProvider.getExecutionHistory(any(), any()))
                .thenReturn(List.of(execution("e-0", AAPL, "20", tag, 12)));

        assertThat(service.reconcile(NOW)).isZero();
        assertThat(tradingPairManager.getTradedQuantity(tag, AAPL)).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Ids older than their market's last fill are pruned and still never replayed")
    void staleIdsPruned() {
        List<ExecutionRecord> history =
                List.of(execution("e-1", AAPL, "50", tag, 10), execution("e-5", AAPL, "10", tag, 4));
        when(historyProvider.getExecutionHistory(any(), any())).thenReturn(history);

        assertThat(service.reconcile(NOW)).isEqualTo(2);

        assertThat(tradingPairManager.isExecutionProcessed("e-1")).isFalse();
        assertThat(tradingPairManager.isExecutionProcessed("e-5")).isTrue();
        assertThat(service.reconcile(NOW)).isZero();
        assertThat(tradingPairManager.getTradedQuantity(tag, AAPL)).isEqualByComparingTo("60");
    }
}
