package com.regimetrader.domain.vo;

import lombok.Value;

/**
 * Filtered estimate of the hidden market state. Produced only by the regime detector.
 */
@Value
public class LatentState {

    public static final int DIMENSION = 7;

    double microprice;
    double spread;
    double imbalance;
    double momentum;
    double volatility;
    double onChainBias;
    double sentimentScore;

    public static LatentState of(double[] values) {
        if (values == null || values.length != DIMENSION) {
            throw new IllegalArgumentException("LatentState needs exactly " + DIMENSION + " components");
        }
        return new LatentState(values[0], values[1], values[2], values[3], values[4], values[5], values[6]);
    }

    public double[] toArray() {
        return new double[] {microprice, spread, imbalance, momentum, volatility, onChainBias, sentimentScore};
    }
}
