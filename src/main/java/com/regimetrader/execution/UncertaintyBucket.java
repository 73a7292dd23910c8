package com.regimetrader.execution;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Buckets of the regime detector's uncertainty scalar. Upper bounds are exclusive.
 */
@Getter
@RequiredArgsConstructor
public enum UncertaintyBucket {
    LOW(0.3),
    MEDIUM(0.6),
    HIGH(0.85),
    EXTREME(Double.POSITIVE_INFINITY);

    private final double upperBound;

    /** Non-finite or negative input maps to EXTREME. */
    public static UncertaintyBucket of(double uncertainty) {
        if (!Double.isFinite(uncertainty) || uncertainty < 0.0) {
            return EXTREME;
        }
        for (UncertaintyBucket bucket : values()) {
            if (uncertainty < bucket.upperBound) {
                return bucket;
            }
        }
        return EXTREME;
    }
}
