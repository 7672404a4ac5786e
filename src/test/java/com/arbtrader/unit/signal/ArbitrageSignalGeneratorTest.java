package com.arbtrader.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.OrderStatus;
import com.arbtrader.domain.enums.SecurityType;
import com.arbtrader.domain.enums.SignalDirection;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.OrderUpdate;
import com.arbtrader.domain.model.Security;
import com.arbtrader.event.EventPublisherHelper;
import com.arbtrader.event.TradingPairsChangedEvent;
import com.arbtrader.grid.GridLevelPair;
import com.arbtrader.grid.TradingPair;
import com.arbtrader.grid.TradingPairChanges;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.signal.ArbitrageSignalGenerator;
import com.arbtrader.signal.GridSignal;
import com.arbtrader.signal.InMemorySignalCollection;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ArbitrageSignalGenerator covering entry and exit triggers, de-duplication
 * against live signals, and reactions to trading pairs being added or removed.
 */
class ArbitrageSignalGeneratorTest {

    private static final InstrumentId AAPL = InstrumentId.of(SecurityType.EQUITY, "nasdaq", "AAPL");
    private static final InstrumentId AAPL_X = InstrumentId.of(SecurityType.CRYPTO, "binance", "AAPLUSDT");
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 14, 30);

    private TradingPairManager tradingPairManager;
    private InMemorySignalCollection signalCollection;
    private ArbitrageProperties properties;
    private ArbitrageSignalGenerator generator;
    private TradingPair pair;
    private GridLevelPair longLevel;

    @BeforeEach
    void setUp() {
        tradingPairManager = new TradingPairManager(mock(EventPublisherHelper.class));
        signalCollection = new InMemorySignalCollection();
        properties = new ArbitrageProperties();
        generator = new ArbitrageSignalGenerator(tradingPairManager, signalCollection, properties);

        pair = tradingPairManager.addPair(new Security(AAPL, BigDecimal.ONE), new Security(AAPL_X), "crypto_stock");
        longLevel = GridLevelPair.of(
                SpreadDirection.LONG_SPREAD, new BigDecimal("-0.02"), new BigDecimal("0.01"), new BigDecimal("0.5"));
        pair.addLevelPair(longLevel);
    }

    private void quote(String bid1, String ask1, String bid2, String ask2) {
        pair.getLeg1().updateQuote(new BigDecimal(bid1), new BigDecimal(ask1), NOW);
        pair.getLeg2().updateQuote(new BigDecimal(bid2), new BigDecimal(ask2), NOW);
        tradingPairManager.updateAll(NOW);
    }

    /** Spread around -0.032, below the LONG_SPREAD entry. */
    private void quoteLongEntry() {
        quote("100", "100.1", "103", "103.2");
    }

    /** Spread around +0.02, above the LONG_SPREAD exit. */
    private void quoteLongExit() {
        quote("102", "102.1", "100", "100.2");
    }

    private void invest() {
        String tag = GridTagCodec.encode(AAPL, AAPL_X, longLevel);
        tradingPairManager.processOrderUpdate(OrderUpdate.builder()
                .instrument(AAPL)
                .status(OrderStatus.FILLED)
                .fillQuantity(BigDecimal.TEN)
                .fillPrice(new BigDecimal("100"))
                .executionId("e-1")
                .tag(tag)
                .time(NOW)
                .build());
    }

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("Spread at or below LONG_SPREAD entry emits an UP entry signal on leg1")
        void longEntry() {
            quoteLongEntry();

            List<GridSignal> signals = generator.generate(NOW);

            assertThat(signals).hasSize(1);
            GridSignal signal = signals.get(0);
            assertThat(signal.getInstrument()).isEqualTo(AAPL);
            assertThat(signal.getDirection()).isEqualTo(SignalDirection.UP);
            assertThat(signal.getType()).isEqualTo(LevelType.ENTRY);
            assertThat(signal.getLevel()).isEqualTo(longLevel.getEntry());
            assertThat(signal.getTag()).isEqualTo(GridTagCodec.encode(AAPL, AAPL_X, longLevel));
            assertThat(signal.getCloseTime()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        }

        @Test
        @DisplayName("Entry trigger alone does not create a grid position")
        void entryLeavesGridUntouched() {
            quoteLongEntry();

            generator.generate(NOW);

            assertThat(pair.findPosition(longLevel)).isEmpty();
        }

        @Test
        @DisplayName("Unanswered entry leaves no position behind once the signal has expired")
        void unansweredEntryLeavesNoPosition() {
            quoteLongEntry();
            signalCollection.addAll(generator.generate(NOW));

            LocalDateTime nextDay = NOW.plusDays(1);
            quote("100", "100.1", "100", "100.1");
            signalCollection.removeExpired(nextDay);

            assertThat(generator.generate(nextDay)).isEmpty();
            assertThat(tradingPairManager.getAllPositions()).isEmpty();
        }

        @Test
        @DisplayName("Active signal for the same level suppresses a repeat")
        void deduplicated() {
            quoteLongEntry();
            signalCollection.addAll(generator.generate(NOW));

            assertThat(generator.generate(NOW.plusSeconds(30))).isEmpty();
        }

        @Test
        @DisplayName("Level fires again once the previous signal has expired")
        void firesAfterExpiry() {
            quoteLongEntry();
            signalCollection.addAll(generator.generate(NOW));

            assertThat(generator.generate(NOW.plusMinutes(6))).hasSize(1);
        }

        @Test
        @DisplayName("Invested level is not entered again")
        void investedNotReentered() {
            invest();
            quoteLongEntry();

            assertThat(generator.generate(NOW)).isEmpty();
        }

        @Test
        @DisplayName("Spread above the entry threshold emits nothing")
        void notTriggered() {
            quote("100", "100.1", "100.5", "100.6");

            assertThat(generator.generate(NOW)).isEmpty();
        }

        @Test
        @DisplayName("SHORT_SPREAD entry emits a DOWN signal")
        void shortEntry() {
            GridLevelPair shortLevel = GridLevelPair.of(
                    SpreadDirection.SHORT_SPREAD,
                    new BigDecimal("0.01"),
                    new BigDecimal("-0.005"),
                    new BigDecimal("0.5"));
            pair.addLevelPair(shortLevel);
            quoteLongExit();

            List<GridSignal> signals = generator.generate(NOW);

            assertThat(signals).hasSize(1);
            assertThat(signals.get(0).getDirection()).isEqualTo(SignalDirection.DOWN);
        }
    }

    @Nested
    @DisplayName("Exit")
    class Exit {

        @Test
        @DisplayName("Invested LONG_SPREAD position past its exit emits a FLAT exit signal")
        void exitSignal() {
            invest();
            quoteLongExit();

            List<GridSignal> signals = generator.generate(NOW);

            assertThat(signals).hasSize(1);
            assertThat(signals.get(0).getDirection()).isEqualTo(SignalDirection.FLAT);
            assertThat(signals.get(0).getType()).isEqualTo(LevelType.EXIT);
            assertThat(signals.get(0).getLevel()).isEqualTo(longLevel.getExit());
            assertThat(signals.get(0).getTag()).isEqualTo(GridTagCodec.encode(AAPL, AAPL_X, longLevel));
        }

        @Test
        @DisplayName("Exit follows the position's level pair after it leaves the configuration")
        void exitAfterLevelRemoved() {
            invest();
            pair.removeLevelPair(longLevel);
            quoteLongExit();

            assertThat(generator.generate(NOW)).extracting(GridSignal::getType).containsExactly(LevelType.EXIT);
        }

        @Test
        @DisplayName("Flat position does not exit")
        void flatPositionNoExit() {
            pair.getOrCreatePosition(longLevel, NOW);
            quoteLongExit();

            assertThat(generator.generate(NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Price Checks")
    class PriceChecks {

        @Test
        @DisplayName("Pair with missing quotes is skipped")
        void missingQuotes() {
            tradingPairManager.updateAll(NOW);

            assertThat(generator.generate(NOW)).isEmpty();
        }

        @Test
        @DisplayName("Inverted book is skipped")
        void invertedBook() {
            quote("100.2", "100.1", "103", "103.2");

            assertThat(generator.generate(NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Pair Changes")
    class PairChanges {

        @Test
        @DisplayName("Added pair without levels receives its type's grid template")
        void templateApplied() {
            TradingPair fresh = new TradingPair(
                    new Security(InstrumentId.of(SecurityType.EQUITY, "nasdaq", "TSLA")),
                    new Security(InstrumentId.of(SecurityType.CRYPTO, "binance", "TSLAUSDT")),
                    "crypto_stock");

            generator.onTradingPairsChanged(new TradingPairsChangedEvent(this, TradingPairChanges.added(fresh)));

            assertThat(fresh.getLevelPairs()).hasSize(2);
            assertThat(fresh.getLevelPairs())
                    .extracting(GridLevelPair::getDirection)
                    .containsExactlyInAnyOrder(SpreadDirection.LONG_SPREAD, SpreadDirection.SHORT_SPREAD);
        }

        @Test
        @DisplayName("Pair with an unknown type keeps an empty grid")
        void unknownTemplate() {
            TradingPair fresh = new TradingPair(
                    new Security(InstrumentId.of(SecurityType.EQUITY, "nasdaq", "TSLA")),
                    new Security(InstrumentId.of(SecurityType.CRYPTO, "binance", "TSLAUSDT")),
                    "options_box");

            generator.onTradingPairsChanged(new TradingPairsChangedEvent(this, TradingPairChanges.added(fresh)));

            assertThat(fresh.getLevelPairs()).isEmpty();
        }

        @Test
        @DisplayName("Pair with configured levels keeps them")
        void existingLevelsKept() {
            generator.onTradingPairsChanged(new TradingPairsChangedEvent(this, TradingPairChanges.added(pair)));

            assertThat(pair.getLevelPairs()).containsExactly(longLevel);
        }

        @Test
        @DisplayName("Removing a pair cancels live signals on its legs")
        void removalCancelsSignals() {
            LocalDateTime now = LocalDateTime.now();
            quoteLongEntry();
            signalCollection.addAll(generator.generate(now));

            generator.onTradingPairsChanged(new TradingPairsChangedEvent(this, TradingPairChanges.removed(pair)));

            assertThat(signalCollection.getActiveSignals(now.plusSeconds(1))).isEmpty();
            assertThat(signalCollection.size()).isEqualTo(1);
        }
    }
}
