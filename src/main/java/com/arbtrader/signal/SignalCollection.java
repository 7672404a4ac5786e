package com.arbtrader.signal;

import com.arbtrader.domain.model.InstrumentId;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Store of emitted signals shared by the signal generator and the allocation builder.
 *
 * <p>The generator deduplicates against this collection rather than keeping its own state,
 * so a restarted generator does not re-emit signals that are still live.
 */
public interface SignalCollection {

    void addAll(Collection<GridSignal> signals);

    List<GridSignal> getActiveSignals(LocalDateTime now);

    List<GridSignal> getActiveSignals(InstrumentId instrument, LocalDateTime now);

    List<GridSignal> getExpiredSignals(LocalDateTime now);

    void cancel(Collection<GridSignal> signals, LocalDateTime now);

    /** Drops expired signals and returns them. */
    List<GridSignal> removeExpired(LocalDateTime now);

    int size();
}
