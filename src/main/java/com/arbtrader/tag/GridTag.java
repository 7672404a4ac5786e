package com.arbtrader.tag;

import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.grid.GridLevelPair;
import lombok.Value;

/** Decoded content of a pairing tag. */
@Value
public class GridTag {

    InstrumentId leg1;
    InstrumentId leg2;
    GridLevelPair levelPair;

    public boolean involves(InstrumentId instrument) {
        return leg1.equals(instrument) || leg2.equals(instrument);
    }
}
