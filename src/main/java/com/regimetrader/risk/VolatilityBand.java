package com.regimetrader.risk;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stepped volatility scaling. Bands are inclusive upper bounds on the signal's
 * volatility; anything above HIGH falls into EXTREME.
 */
@Getter
@RequiredArgsConstructor
public enum VolatilityBand {
    LOW(0.02, 1.2),
    NORMAL(0.05, 1.0),
    HIGH(VolatilityBand.EXTREME_THRESHOLD, 0.7),
    EXTREME(Double.POSITIVE_INFINITY, 0.4);

    /** Volatility above this is EXTREME. */
    public static final double EXTREME_THRESHOLD = 0.10;

    private final double upperBound;
    private final double multiplier;

    public static VolatilityBand of(double volatility) {
        double v = Math.abs(volatility);
        for (VolatilityBand band : values()) {
            if (v <= band.upperBound) {
                return band;
            }
        }
        return EXTREME;
    }
}
