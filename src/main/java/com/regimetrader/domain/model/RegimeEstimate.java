package com.regimetrader.domain.model;

import com.regimetrader.domain.vo.LatentState;
import com.regimetrader.domain.vo.RegimeBelief;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Output of one regime detector step: mixed latent state, per-regime belief and the
 * trace of the mixed covariance as a scalar uncertainty.
 */
@Getter
@Builder
public class RegimeEstimate {

    private final LatentState state;
    private final List<RegimeBelief> beliefs;
    private final double uncertainty;
    private final int dominantRegime;

    /** True when the tick could not be used (non-finite input) and the belief was degraded. */
    private final boolean degraded;

    public double[] probabilities() {
        double[] probabilities = new double[beliefs.size()];
        for (int i = 0; i < beliefs.size(); i++) {
            probabilities[i] = beliefs.get(i).getProbability();
        }
        return probabilities;
    }

    public RegimeBelief dominantBelief() {
        return beliefs.get(dominantRegime);
    }
}
