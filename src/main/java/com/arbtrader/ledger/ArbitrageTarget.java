package com.arbtrader.ledger;

import com.arbtrader.domain.model.InstrumentId;
import java.util.List;
import java.util.Optional;
import lombok.Value;

/**
 * Outstanding quantity targets for the legs of one tagged grid level.
 *
 * <p>Normally two legs. A flatten target built from an undecodable tag carries a single leg.
 */
@Value
public class ArbitrageTarget {

    String tag;
    List<LegTarget> legs;

    public ArbitrageTarget(String tag, List<LegTarget> legs) {
        this.tag = tag;
        this.legs = List.copyOf(legs);
    }

    public Optional<LegTarget> getLeg(InstrumentId instrument) {
        return legs.stream().filter(l -> l.getInstrument().equals(instrument)).findFirst();
    }
}
