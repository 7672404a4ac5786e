package com.arbtrader.signal;

import com.arbtrader.domain.model.InstrumentId;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Thread-safe signal collection keyed by signal id. Queries return copies ordered by generation time. */
@Component
public class InMemorySignalCollection implements SignalCollection {

    private static final Logger log = LoggerFactory.getLogger(InMemorySignalCollection.class);

    private static final Comparator<GridSignal> BY_GENERATED_TIME = Comparator.comparing(GridSignal::getGeneratedTime);

    private final ConcurrentMap<String, GridSignal> signals = new ConcurrentHashMap<>();

    @Override
    public void addAll(Collection<GridSignal> newSignals) {
        for (GridSignal signal : newSignals) {
            signals.put(signal.getId(), signal);
        }
    }

    @Override
    public List<GridSignal> getActiveSignals(LocalDateTime now) {
        return signals.values().stream()
                .filter(s -> s.isActive(now))
                .sorted(BY_GENERATED_TIME)
                .toList();
    }

    @Override
    public List<GridSignal> getActiveSignals(InstrumentId instrument, LocalDateTime now) {
        return signals.values().stream()
                .filter(s -> s.getInstrument().equals(instrument) && s.isActive(now))
                .sorted(BY_GENERATED_TIME)
                .toList();
    }

    @Override
    public List<GridSignal> getExpiredSignals(LocalDateTime now) {
        return signals.values().stream()
                .filter(s -> s.isExpired(now))
                .sorted(BY_GENERATED_TIME)
                .toList();
    }

    @Override
    public void cancel(Collection<GridSignal> toCancel, LocalDateTime now) {
        for (GridSignal signal : toCancel) {
            signal.cancel(now);
        }
        if (!toCancel.isEmpty()) {
            log.debug("Cancelled {} signals", toCancel.size());
        }
    }

    @Override
    public List<GridSignal> removeExpired(LocalDateTime now) {
        List<GridSignal> removed = new ArrayList<>();
        for (GridSignal signal : getExpiredSignals(now)) {
            if (signals.remove(signal.getId(), signal)) {
                removed.add(signal);
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return signals.size();
    }
}
