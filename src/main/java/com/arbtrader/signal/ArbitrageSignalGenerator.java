package com.arbtrader.signal;

import com.arbtrader.config.ArbitrageProperties;
import com.arbtrader.config.ArbitrageProperties.GridTemplateLevel;
import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.SignalDirection;
import com.arbtrader.domain.enums.SpreadDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.event.TradingPairsChangedEvent;
import com.arbtrader.grid.GridLevel;
import com.arbtrader.grid.GridLevelPair;
import com.arbtrader.grid.GridPosition;
import com.arbtrader.grid.TradingPair;
import com.arbtrader.grid.TradingPairManager;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Detects grid threshold crossings and emits one tagged single-leg signal per trigger.
 *
 * <p>Per trading pair, on every evaluation:
 * <ol>
 *   <li>each invested grid position is checked for exit against its own level pair, so exit
 *       rules follow the position that opened them even if the pair's configuration changed</li>
 *   <li>each configured level pair without an invested position is checked for entry:
 *       LONG_SPREAD fires when spread &lt;= entry threshold, SHORT_SPREAD when spread &gt;= it</li>
 * </ol>
 *
 * <p>Entry signals are UP for LONG_SPREAD and DOWN for SHORT_SPREAD; exit signals are FLAT.
 * A trigger is suppressed while the signal collection already holds an active signal for the
 * same (instrument, level). The generator keeps no dedup state of its own, and it does not
 * create grid positions: a position appears when the first order for its level is registered.
 */
@Component
public class ArbitrageSignalGenerator {

    private static final Logger log = LoggerFactory.getLogger(ArbitrageSignalGenerator.class);

    private final TradingPairManager tradingPairManager;
    private final SignalCollection signalCollection;
    private final ArbitrageProperties arbitrageProperties;

    public ArbitrageSignalGenerator(
            TradingPairManager tradingPairManager,
            SignalCollection signalCollection,
            ArbitrageProperties arbitrageProperties) {
        this.tradingPairManager = tradingPairManager;
        this.signalCollection = signalCollection;
        this.arbitrageProperties = arbitrageProperties;
    }

    /** Evaluates every registered pair. Emitted signals are returned, not added to the collection. */
    public List<GridSignal> generate(LocalDateTime now) {
        List<GridSignal> activeSignals = signalCollection.getActiveSignals(now);
        List<GridSignal> emitted = new ArrayList<>();
        for (TradingPair pair : tradingPairManager.getPairs()) {
            emitted.addAll(generate(pair, activeSignals, now));
        }
        if (!emitted.isEmpty()) {
            log.debug("Generated {} grid signals", emitted.size());
        }
        return emitted;
    }

    private List<GridSignal> generate(TradingPair pair, List<GridSignal> activeSignals, LocalDateTime now) {
        ArbitrageProperties.Signal config = arbitrageProperties.getSignal();
        if (config.isRequireValidPrices() && !pair.hasValidPrices()) {
            return List.of();
        }
        BigDecimal spread = pair.getTheoreticalSpread();
        if (spread == null) {
            return List.of();
        }

        List<GridSignal> emitted = new ArrayList<>();
        InstrumentId leg1 = pair.getLeg1Id();

        for (GridPosition position : pair.getPositions()) {
            if (!position.shouldExit(spread)) {
                continue;
            }
            GridLevelPair levelPair = position.getLevelPair();
            if (hasActiveSignal(activeSignals, leg1, levelPair.getExit())) {
                continue;
            }
            log.info(
                    "Exit triggered on {}: spread={} level={}",
                    pair.getKey(),
                    spread,
                    levelPair.getExit().getNaturalKey());
            emitted.add(createSignal(pair, levelPair, levelPair.getExit(), SignalDirection.FLAT, LevelType.EXIT, now));
        }

        for (GridLevelPair levelPair : pair.getLevelPairs()) {
            Optional<GridPosition> existing = pair.findPosition(levelPair);
            if (existing.isPresent() && existing.get().isInvested()) {
                continue;
            }
            if (!entryTriggered(levelPair.getEntry(), spread)) {
                continue;
            }
            if (hasActiveSignal(activeSignals, leg1, levelPair.getEntry())) {
                continue;
            }
            log.info(
                    "Entry triggered on {}: spread={} level={}",
                    pair.getKey(),
                    spread,
                    levelPair.getEntry().getNaturalKey());
            emitted.add(createSignal(
                    pair,
                    levelPair,
                    levelPair.getEntry(),
                    SignalDirection.forEntry(levelPair.getDirection()),
                    LevelType.ENTRY,
                    now));
        }
        return emitted;
    }

    // ---- Pair lifecycle ----

    /**
     * Applies grid templates to added pairs that have no level pairs yet, and cancels live
     * signals on either leg of removed pairs.
     */
    @EventListener
    public void onTradingPairsChanged(TradingPairsChangedEvent event) {
        for (TradingPair pair : event.getChanges().getAdded()) {
            applyTemplate(pair);
        }
        LocalDateTime now = LocalDateTime.now();
        for (TradingPair pair : event.getChanges().getRemoved()) {
            List<GridSignal> toCancel = new ArrayList<>();
            toCancel.addAll(signalCollection.getActiveSignals(pair.getLeg1Id(), now));
            toCancel.addAll(signalCollection.getActiveSignals(pair.getLeg2Id(), now));
            signalCollection.cancel(toCancel, now);
            log.info("Cancelled {} live signals for removed pair {}", toCancel.size(), pair.getKey());
        }
    }

    private void applyTemplate(TradingPair pair) {
        if (!pair.getLevelPairs().isEmpty() || pair.getPairType() == null) {
            return;
        }
        List<GridTemplateLevel> template = arbitrageProperties.getGridTemplates().get(pair.getPairType());
        if (template == null || template.isEmpty()) {
            log.debug("No grid template for pair type {}", pair.getPairType());
            return;
        }
        for (GridTemplateLevel level : template) {
            pair.addLevelPair(level.toLevelPair());
        }
        log.info(
                "Applied {} grid template ({} level pairs) to {}",
                pair.getPairType(),
                template.size(),
                pair.getKey());
    }

    private static boolean entryTriggered(GridLevel entry, BigDecimal spread) {
        if (entry.getDirection() == SpreadDirection.LONG_SPREAD) {
            return spread.compareTo(entry.getSpreadThreshold()) <= 0;
        }
        return spread.compareTo(entry.getSpreadThreshold()) >= 0;
    }

    private static boolean hasActiveSignal(List<GridSignal> activeSignals, InstrumentId instrument, GridLevel level) {
        return activeSignals.stream()
                .anyMatch(s -> s.getInstrument().equals(instrument) && level.equals(s.getLevel()));
    }

    private GridSignal createSignal(
            TradingPair pair,
            GridLevelPair levelPair,
            GridLevel level,
            SignalDirection direction,
            LevelType type,
            LocalDateTime now) {
        ArbitrageProperties.Signal config = arbitrageProperties.getSignal();
        return GridSignal.builder()
                .instrument(pair.getLeg1Id())
                .direction(direction)
                .type(type)
                .level(level)
                .tag(GridTagCodec.encode(pair.getLeg1Id(), pair.getLeg2Id(), levelPair))
                .generatedTime(now)
                .period(config.getPeriod())
                .sourceModel(config.getSourceModel())
                .confidence(config.getConfidence())
                .build();
    }
}
