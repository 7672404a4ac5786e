package com.arbtrader.event;

import com.arbtrader.domain.model.OrderUpdate;
import org.springframework.context.ApplicationEvent;

/** Published when a brokerage reports that a short option position was assigned. */
public class OptionAssignmentEvent extends ApplicationEvent {

    private final OrderUpdate assignment;

    public OptionAssignmentEvent(Object source, OrderUpdate assignment) {
        super(source);
        this.assignment = assignment;
    }

    public OrderUpdate getAssignment() {
        return assignment;
    }
}
