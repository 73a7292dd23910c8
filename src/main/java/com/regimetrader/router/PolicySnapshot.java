package com.regimetrader.router;

import lombok.Builder;
import lombok.Getter;

/**
 * Read-only view of one policy posterior, for operators and tests.
 *
 * <p>{@code confidence} is 1 − posteriorVariance / priorVariance clamped to [0, 1]:
 * 0 at cold start, approaching 1 as evidence accumulates.
 */
@Getter
@Builder
public class PolicySnapshot {

    private final String policyId;
    private final RewardModel rewardModel;
    private final double alpha;
    private final double beta;
    private final double mean;
    private final double variance;
    private final long timesChosen;
    private final long rewardUpdates;
    private final double expectedReward;
    private final double confidence;
    private final double[] weights;
}
