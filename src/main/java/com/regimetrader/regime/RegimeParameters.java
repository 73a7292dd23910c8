package com.regimetrader.regime;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Linear-Gaussian dynamics of one regime: x' = A·x + w (w ~ Q), z = C·x + v (v ~ R),
 * plus the regime's row of the regime-transition matrix and its descriptors.
 */
@Getter
@Builder
public class RegimeParameters {

    private final int id;
    private final String name;

    /** A */
    private final RealMatrix stateTransition;

    /** C */
    private final RealMatrix observation;

    /** Q */
    private final RealMatrix processNoise;

    /** R */
    private final RealMatrix observationNoise;

    /** Probability of moving from this regime to each regime on the next tick. */
    private final double[] transitionRow;

    private final double[] initialPrior;

    private final double meanReversionStrength;
    private final double volatility;
    private final double momentum;
}
