package com.regimetrader.pipeline;

import com.regimetrader.canary.CanaryStatus;
import com.regimetrader.domain.model.RegimeEstimate;
import com.regimetrader.router.PolicySnapshot;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Operator view of one symbol's pipeline.
 */
@Value
@Builder
public class PipelineStatus {

    String symbol;
    long ticks;
    String modelVersion;
    RegimeEstimate regime;
    List<PolicySnapshot> policies;
    boolean emergencyLatched;
    String emergencyReason;
    CanaryStatus canary;
}
