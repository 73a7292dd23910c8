package com.regimetrader.execution;

import lombok.Builder;
import lombok.Value;

/**
 * Microstructure snapshot for execution routing.
 *
 * <p>{@code liquidityTier}: 1 = deep/liquid, 2 = normal, 3 = thin/illiquid.
 */
@Value
@Builder
public class MarketConditions {

    double spreadBps;
    double depthUsd;
    double volatilityPct;
    int liquidityTier;
}
