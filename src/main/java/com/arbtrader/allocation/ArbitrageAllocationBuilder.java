package com.arbtrader.allocation;

import com.arbtrader.domain.enums.LevelType;
import com.arbtrader.domain.enums.SignalDirection;
import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.signal.GridSignal;
import com.arbtrader.signal.SignalCollection;
import com.arbtrader.tag.GridTag;
import com.arbtrader.tag.GridTagCodec;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns active single-leg signals into paired allocation targets.
 *
 * <p>With N active tagged signals, each signal receives {@code |positionSize| / N} of portfolio
 * value, so simultaneous triggers never allocate more than one level's size in total. Each
 * decoded signal yields exactly two targets stamped with the same tag:
 * <ul>
 *   <li>entry UP: leg1 +share, leg2 -share</li>
 *   <li>entry DOWN: leg1 -share, leg2 +share</li>
 *   <li>exit / FLAT: both legs 0</li>
 * </ul>
 *
 * <p>A signal whose tag does not decode is skipped and logged; the rest of the batch proceeds.
 *
 * <p>Expired signals are swept on every call. An expired signal with no other active signal on
 * its instrument produces a flatten pair for both legs of its tag, or, when the tag does not
 * decode, a single flatten target for its own instrument.
 */
@Component
public class ArbitrageAllocationBuilder {

    private static final Logger log = LoggerFactory.getLogger(ArbitrageAllocationBuilder.class);

    private final SignalCollection signalCollection;

    public ArbitrageAllocationBuilder(SignalCollection signalCollection) {
        this.signalCollection = signalCollection;
    }

    public List<AllocationTarget> createTargets(LocalDateTime now) {
        List<GridSignal> activeSignals = signalCollection.getActiveSignals(now).stream()
                .filter(GridSignal::hasTag)
                .toList();

        List<AllocationTarget> targets = new ArrayList<>(createTargets(activeSignals));
        targets.addAll(flattenExpired(now));
        return targets;
    }

    /** Paired targets for the given active signals, sharing capital equally between them. */
    public List<AllocationTarget> createTargets(List<GridSignal> activeSignals) {
        List<AllocationTarget> targets = new ArrayList<>();
        if (activeSignals.isEmpty()) {
            return targets;
        }
        BigDecimal count = BigDecimal.valueOf(activeSignals.size());

        for (GridSignal signal : activeSignals) {
            Optional<GridTag> decoded = GridTagCodec.tryDecode(signal.getTag());
            if (decoded.isEmpty()) {
                log.warn(
                        "Skipping signal {} on {}: undecodable tag {}",
                        signal.getId(),
                        signal.getInstrument(),
                        signal.getTag());
                continue;
            }
            GridTag gridTag = decoded.get();

            if (signal.getType() == LevelType.EXIT || signal.getDirection() == SignalDirection.FLAT) {
                targets.add(AllocationTarget.flat(gridTag.getLeg1(), signal.getTag()));
                targets.add(AllocationTarget.flat(gridTag.getLeg2(), signal.getTag()));
                continue;
            }

            BigDecimal share = gridTag.getLevelPair()
                    .getEntry()
                    .getPositionSize()
                    .abs()
                    .divide(count, MathContext.DECIMAL64);
            BigDecimal leg1Percent = signal.getDirection() == SignalDirection.UP ? share : share.negate();
            targets.add(new AllocationTarget(gridTag.getLeg1(), leg1Percent, signal.getTag()));
            targets.add(new AllocationTarget(gridTag.getLeg2(), leg1Percent.negate(), signal.getTag()));
        }
        return targets;
    }

    private List<AllocationTarget> flattenExpired(LocalDateTime now) {
        List<AllocationTarget> targets = new ArrayList<>();
        Set<String> flattenedTags = new HashSet<>();
        Set<InstrumentId> flattenedInstruments = new HashSet<>();

        for (GridSignal expired : signalCollection.getExpiredSignals(now)) {
            if (!signalCollection.getActiveSignals(expired.getInstrument(), now).isEmpty()) {
                continue;
            }
            Optional<GridTag> decoded = GridTagCodec.tryDecode(expired.getTag());
            if (decoded.isPresent()) {
                if (flattenedTags.add(expired.getTag())) {
                    targets.add(AllocationTarget.flat(decoded.get().getLeg1(), expired.getTag()));
                    targets.add(AllocationTarget.flat(decoded.get().getLeg2(), expired.getTag()));
                }
            } else if (flattenedInstruments.add(expired.getInstrument())) {
                log.warn(
                        "Expired signal {} has undecodable tag, flattening {} only",
                        expired.getId(),
                        expired.getInstrument());
                targets.add(AllocationTarget.flat(expired.getInstrument(), expired.getTag()));
            }
        }

        List<GridSignal> removed = signalCollection.removeExpired(now);
        if (!removed.isEmpty()) {
            log.debug("Swept {} expired signals into {} flatten targets", removed.size(), targets.size());
        }
        return targets;
    }
}
