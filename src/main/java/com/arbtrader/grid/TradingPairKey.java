package com.arbtrader.grid;

import com.arbtrader.domain.model.InstrumentId;
import lombok.Value;

/** Ordered (leg1, leg2) identity of a trading pair. Swapping the legs names a different pair. */
@Value
public class TradingPairKey {

    InstrumentId leg1;
    InstrumentId leg2;

    @Override
    public String toString() {
        return leg1 + "/" + leg2;
    }
}
