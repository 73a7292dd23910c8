package com.regimetrader.regime;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Versioned, immutable regime-switching model loaded once at startup by {@link RegimeModelLoader}.
 *
 * <p>Holds the per-regime Kalman dynamics plus the defaults the detector starts from
 * (and returns to on reset). Matrices are shared by every pipeline, so callers must
 * never mutate them; the detector only reads them and copies before arithmetic.
 */
@Getter
@Builder
public class RegimeModel {

    private final String version;
    private final int dimension;
    private final RealVector initialState;
    private final RealMatrix initialCovariance;
    private final double[] initialRegimePrior;
    private final List<RegimeParameters> regimes;

    public int regimeCount() {
        return regimes.size();
    }

    public RegimeParameters regime(int id) {
        return regimes.get(id);
    }

    /** Probability of transitioning from regime {@code from} to regime {@code to}. */
    public double transition(int from, int to) {
        return regimes.get(from).getTransitionRow()[to];
    }
}
