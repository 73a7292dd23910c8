package com.regimetrader.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Posterior probability of one regime plus the descriptors of that regime.
 * Probabilities across the full belief list sum to one.
 */
@Value
@Builder
public class RegimeBelief {

    int regimeId;
    String name;
    double probability;
    double meanReversionStrength;
    double volatility;
    double momentum;
}
