package com.regimetrader.execution;

import lombok.Builder;
import lombok.Value;

/**
 * Execution router output: a primary instruction, an optional fallback, and the
 * table coordinates that produced it so the choice can be audited.
 */
@Value
@Builder
public class ExecutionPlan {

    String symbol;
    ExecutionInstruction primary;

    /** Null when the primary style has no fallback. */
    ExecutionInstruction fallback;

    UncertaintyBucket uncertaintyBucket;
    VolatilityBucket volatilityBucket;
    int effectiveLiquidityTier;
    String reason;

    public boolean isHalt() {
        return primary.getType() == ExecutionType.HALT;
    }
}
