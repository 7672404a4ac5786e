package com.arbtrader.engine;

import com.arbtrader.allocation.AllocationTarget;
import com.arbtrader.domain.model.Order;
import com.arbtrader.ledger.ArbitrageTarget;
import com.arbtrader.signal.GridSignal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** What one evaluation tick produced. */
@Value
@Builder
public class EvaluationResult {

    List<GridSignal> signals;
    List<AllocationTarget> allocations;
    List<ArbitrageTarget> targets;
    List<Order> placedOrders;
    List<ArbitrageTarget> fulfilledTargets;
}
