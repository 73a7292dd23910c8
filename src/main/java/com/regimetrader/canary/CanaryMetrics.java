package com.regimetrader.canary;

import lombok.Builder;
import lombok.Value;

/**
 * Metrics over the canary trade window.
 *
 * <p>{@code maxDrawdown} is measured on the cumulative P&L path relative to max(peak, 1);
 * {@code cvar} is a proxy of 1.5 × maxDrawdown, floored at 0.01.
 */
@Value
@Builder
public class CanaryMetrics {

    int totalFills;
    double totalPnl;
    double winRate;
    double maxDrawdown;
    double cvar;

    public static CanaryMetrics empty() {
        return CanaryMetrics.builder().build();
    }
}
