package com.arbtrader.grid;

import java.util.List;
import lombok.Value;

/** Pairs added to and removed from the trading pair manager in one change. */
@Value
public class TradingPairChanges {

    List<TradingPair> added;
    List<TradingPair> removed;

    public static TradingPairChanges added(TradingPair pair) {
        return new TradingPairChanges(List.of(pair), List.of());
    }

    public static TradingPairChanges removed(TradingPair pair) {
        return new TradingPairChanges(List.of(), List.of(pair));
    }
}
