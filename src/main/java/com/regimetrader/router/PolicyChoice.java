package com.regimetrader.router;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link StrategyRouter#choose}: the winning policy and how its score was made up.
 */
@Getter
@Builder
@ToString
public class PolicyChoice {

    private final String policyId;
    private final double score;
    private final double sampledReward;
    private final double contextualAdjustment;
    private final double explorationBonus;
}
