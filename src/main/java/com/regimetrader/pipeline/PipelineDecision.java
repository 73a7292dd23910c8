package com.regimetrader.pipeline;

import com.regimetrader.canary.CanaryState;
import com.regimetrader.domain.model.RegimeEstimate;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.execution.ExecutionPlan;
import com.regimetrader.execution.OrderIntent;
import com.regimetrader.risk.SizingResult;
import com.regimetrader.router.PolicyChoice;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one tick through a pipeline: every stage's output plus the canary-weighted order.
 *
 * <p>{@code order} and {@code plan} are null when the sizer declined to trade. When the
 * canary is DISABLED the plan is computed on the unweighted size and marked {@code shadow};
 * it is never dispatched.
 */
@Getter
@Builder
@ToString
public class PipelineDecision {

    private final String symbol;
    private final long tick;
    private final RegimeEstimate regime;

    /** Dominant regime before this tick; equals the current one unless {@code regimeShift}. */
    private final int previousDominantRegime;

    private final boolean regimeShift;
    private final PolicyChoice choice;
    private final TradeSignal signal;
    private final SizingResult sizing;
    private final CanaryState canaryState;
    private final double canaryWeight;

    /** sizing.recommendedSize × canaryWeight */
    private final double effectiveSize;

    private final OrderIntent order;
    private final ExecutionPlan plan;
    private final boolean shadow;

    /** True when the sizer's emergency latch was set during this tick. */
    private final boolean emergencyTriggered;

    public boolean isDispatchable() {
        return order != null && plan != null && !shadow && !plan.isHalt();
    }
}
