package com.regimetrader.strategy;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Built-in policy variants and the ids they register with in the router.
 */
@Getter
@RequiredArgsConstructor
public enum PolicyType {
    TREND_FOLLOWING("p_ema"),
    BREAKOUT("p_breakout"),
    MEAN_REVERSION("p_mean_revert"),
    MOMENTUM("p_momentum");

    private final String policyId;
}
