package com.regimetrader.canary;

import lombok.Builder;
import lombok.Value;

/**
 * Promotion criteria out of one rollout stage. All five must hold at once.
 */
@Value
@Builder
public class CanaryCriteria {

    int minTrades;
    double minWinRate;
    double maxDrawdown;
    double pnlThreshold;
    double cvarCap;
}
