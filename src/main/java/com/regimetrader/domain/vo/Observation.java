package com.regimetrader.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-tick market observation fed to the regime detector.
 *
 * <p>Components are expected pre-normalized by the ingestion layer (returns, fractions,
 * z-scores) so that they live on the same scale as the latent state they are
 * compared against.
 */
@Value
@Builder
public class Observation {

    public static final int DIMENSION = 7;

    double price;
    double volume;
    double spread;
    double orderBookImbalance;
    double fundingRate;
    double gasPrice;
    double socialMentions;

    public static Observation of(double[] values) {
        if (values == null || values.length != DIMENSION) {
            throw new IllegalArgumentException("Observation needs exactly " + DIMENSION + " components");
        }
        return new Observation(values[0], values[1], values[2], values[3], values[4], values[5], values[6]);
    }

    public double[] toArray() {
        return new double[] {price, volume, spread, orderBookImbalance, fundingRate, gasPrice, socialMentions};
    }

    /** True when every component is a finite number. */
    public boolean isFinite() {
        for (double v : toArray()) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
