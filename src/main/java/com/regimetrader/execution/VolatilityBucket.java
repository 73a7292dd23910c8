package com.regimetrader.execution;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Buckets of realized volatility in percent. Upper bounds are exclusive.
 */
@Getter
@RequiredArgsConstructor
public enum VolatilityBucket {
    CALM(2.0),
    NORMAL(5.0),
    ELEVATED(15.0),
    EXTREME(Double.POSITIVE_INFINITY);

    private final double upperBoundPct;

    /** Non-finite or negative input maps to EXTREME. */
    public static VolatilityBucket of(double volatilityPct) {
        if (!Double.isFinite(volatilityPct) || volatilityPct < 0.0) {
            return EXTREME;
        }
        for (VolatilityBucket bucket : values()) {
            if (volatilityPct < bucket.upperBoundPct) {
                return bucket;
            }
        }
        return EXTREME;
    }
}
