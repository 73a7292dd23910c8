package com.regimetrader.event;

import com.regimetrader.execution.ExecutionPlan;
import com.regimetrader.execution.OrderIntent;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a tick produces a non-halted execution plan for a canary-weighted order.
 *
 * <p>The order's {@code sizePct} is already scaled by the canary weight. Listeners hand the
 * plan to the exchange side asynchronously; nothing here blocks the tick path.
 */
public class ExecutionPlanEvent extends ApplicationEvent {

    private final OrderIntent order;
    private final ExecutionPlan plan;

    public ExecutionPlanEvent(Object source, OrderIntent order, ExecutionPlan plan) {
        super(source);
        this.order = order;
        this.plan = plan;
    }

    public OrderIntent getOrder() {
        return order;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }
}
