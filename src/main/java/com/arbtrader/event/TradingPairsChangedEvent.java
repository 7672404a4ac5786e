package com.arbtrader.event;

import com.arbtrader.grid.TradingPairChanges;
import org.springframework.context.ApplicationEvent;

/**
 * Published when trading pairs are added or removed.
 *
 * <p>Delivered synchronously: for removals it is published before the pair leaves the manager,
 * so listeners (the signal generator cancelling live signals on both legs) finish first.
 */
public class TradingPairsChangedEvent extends ApplicationEvent {

    private final TradingPairChanges changes;

    public TradingPairsChangedEvent(Object source, TradingPairChanges changes) {
        super(source);
        this.changes = changes;
    }

    public TradingPairChanges getChanges() {
        return changes;
    }
}
