package com.arbtrader.oms.routing;

import com.arbtrader.domain.model.InstrumentId;
import com.arbtrader.domain.model.Order;
import java.util.HashMap;
import java.util.Map;

/** Routes specific instruments to specific accounts. */
public class InstrumentOrderRouter extends MappingOrderRouter<InstrumentId> {

    public InstrumentOrderRouter(Map<InstrumentId, String> instrumentToAccount, String defaultAccount) {
        super(instrumentToAccount != null ? new HashMap<>(instrumentToAccount) : Map.of(), defaultAccount);
    }

    @Override
    protected InstrumentId keyOf(Order order) {
        return order.getInstrument();
    }
}
