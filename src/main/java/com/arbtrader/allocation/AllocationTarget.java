package com.arbtrader.allocation;

import com.arbtrader.domain.model.InstrumentId;
import java.math.BigDecimal;
import lombok.Value;

/** Signed fraction of portfolio value to hold in one instrument for one tagged grid level. */
@Value
public class AllocationTarget {

    InstrumentId instrument;
    BigDecimal percent;
    String tag;

    public static AllocationTarget flat(InstrumentId instrument, String tag) {
        return new AllocationTarget(instrument, BigDecimal.ZERO, tag);
    }

    public boolean isFlat() {
        return percent.signum() == 0;
    }
}
