package com.regimetrader.regime;

import com.regimetrader.domain.model.RegimeEstimate;
import com.regimetrader.domain.vo.LatentState;
import com.regimetrader.domain.vo.Observation;
import com.regimetrader.domain.vo.RegimeBelief;
import com.regimetrader.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regime-switching state estimator: a bank of Kalman filters, one per regime, mixed by a
 * hidden-Markov posterior over regimes.
 *
 * <p>Each {@link #update} runs, for every regime r:
 * <ol>
 *   <li>predict: x' = A·x, P' = A·P·Aᵗ + Q</li>
 *   <li>innovate: y = z − C·x', S = C·P'·Cᵗ + R</li>
 *   <li>update: K = P'·Cᵗ·S⁻¹, x_r = x' + K·y, P_r = (I − K·C)·P'</li>
 *   <li>score: Gaussian density of y under S</li>
 * </ol>
 * then predicts the regime prior through the transition matrix, optionally blends in an
 * external prior at a fixed small weight, multiplies by the likelihoods and renormalizes.
 * The output state and covariance are the probability-weighted mixture of the regime
 * estimates; uncertainty is the trace of the mixed covariance.
 *
 * <p>The detector never throws on market data. Singular covariances are regularized
 * ({@link GuardedMatrices}), likelihoods are floored, an all-underflow tick resets the
 * posterior to uniform, and a non-finite observation leaves the state untouched while
 * pulling the belief halfway toward uniform.
 *
 * <p>Instances are not thread-safe. Each pipeline owns one detector and calls it under
 * its own lock.
 */
public class RegimeDetector {

    private static final Logger log = LoggerFactory.getLogger(RegimeDetector.class);

    public static final double MAX_EXTERNAL_PRIOR_WEIGHT = 0.10;

    static final double LIKELIHOOD_FLOOR = 1e-10;

    private final RegimeModel model;
    private final double externalPriorWeight;
    private final int dimension;
    private final int regimeCount;
    private final double logNormalizer;

    private RealVector state;
    private RealMatrix covariance;
    private double[] posterior;
    private RegimeEstimate lastEstimate;
    private long updates;

    public RegimeDetector(RegimeModel model, double externalPriorWeight) {
        if (model == null) {
            throw ConfigurationException.regimeModelMissing("<null>");
        }
        if (!(externalPriorWeight >= 0.0 && externalPriorWeight <= MAX_EXTERNAL_PRIOR_WEIGHT)) {
            throw new ConfigurationException("External prior weight must be within [0, "
                    + MAX_EXTERNAL_PRIOR_WEIGHT + "] but was " + externalPriorWeight);
        }
        this.model = model;
        this.externalPriorWeight = externalPriorWeight;
        this.dimension = model.getDimension();
        this.regimeCount = model.regimeCount();
        this.logNormalizer = dimension * Math.log(2.0 * Math.PI);
        reset();
    }

    /** Restores the model's initial state, covariance and regime prior. */
    public void reset() {
        state = model.getInitialState().copy();
        covariance = model.getInitialCovariance().copy();
        posterior = model.getInitialRegimePrior().clone();
        updates = 0;
        lastEstimate = buildEstimate(false);
    }

    public RegimeEstimate update(Observation observation) {
        return update(observation, null);
    }

    /**
     * Advances the filter by one tick.
     *
     * @param observation   the tick's observation
     * @param externalPrior optional categorical hint over regimes (e.g. from a news model);
     *                      ignored when null or malformed
     * @return the mixed estimate after this tick
     */
    public RegimeEstimate update(Observation observation, double[] externalPrior) {
        if (observation == null || !observation.isFinite()) {
            return degrade();
        }

        RealVector z = new ArrayRealVector(observation.toArray(), false);
        RealVector[] regimeStates = new RealVector[regimeCount];
        RealMatrix[] regimeCovariances = new RealMatrix[regimeCount];
        double[] likelihoods = new double[regimeCount];

        for (int r = 0; r < regimeCount; r++) {
            RegimeParameters params = model.regime(r);
            RealMatrix a = params.getStateTransition();
            RealMatrix c = params.getObservation();

            RealVector predictedState = a.operate(state);
            RealMatrix predictedCovariance =
                    a.multiply(covariance).multiply(a.transpose()).add(params.getProcessNoise());

            RealVector innovation = z.subtract(c.operate(predictedState));
            RealMatrix innovationCovariance = GuardedMatrices.symmetrize(
                    c.multiply(predictedCovariance).multiply(c.transpose()).add(params.getObservationNoise()));
            RealMatrix innovationInverse = GuardedMatrices.inverse(innovationCovariance);

            RealMatrix gain = predictedCovariance.multiply(c.transpose()).multiply(innovationInverse);
            regimeStates[r] = predictedState.add(gain.operate(innovation));
            regimeCovariances[r] = GuardedMatrices.symmetrize(MatrixUtils.createRealIdentityMatrix(dimension)
                    .subtract(gain.multiply(c))
                    .multiply(predictedCovariance));

            likelihoods[r] = gaussianDensity(innovation, innovationInverse, innovationCovariance);
        }

        double[] prior = predictRegimePrior();
        blendExternalPrior(prior, externalPrior);
        posterior = combine(prior, likelihoods);

        mix(regimeStates, regimeCovariances);
        updates++;
        lastEstimate = buildEstimate(false);

        if (log.isDebugEnabled()) {
            log.debug(
                    "Regime update #{}: posterior={} likelihoods={} uncertainty={}",
                    updates,
                    Arrays.toString(posterior),
                    Arrays.toString(likelihoods),
                    lastEstimate.getUncertainty());
        }
        return lastEstimate;
    }

    public RegimeEstimate currentEstimate() {
        return lastEstimate;
    }

    public double[] getPosterior() {
        return posterior.clone();
    }

    public long getUpdates() {
        return updates;
    }

    public RegimeModel getModel() {
        return model;
    }

    // ========================
    // INTERNALS
    // ========================

    private RegimeEstimate degrade() {
        log.warn("Non-finite observation, keeping state and degrading regime belief toward uniform");
        double uniform = 1.0 / regimeCount;
        for (int r = 0; r < regimeCount; r++) {
            posterior[r] = 0.5 * posterior[r] + 0.5 * uniform;
        }
        normalizeInPlace(posterior);
        lastEstimate = buildEstimate(true);
        return lastEstimate;
    }

    /** N(y; 0, S), computed in log space and floored away from zero by the determinant floor. */
    private double gaussianDensity(RealVector innovation, RealMatrix inverse, RealMatrix covariance) {
        double mahalanobis = innovation.dotProduct(inverse.operate(innovation));
        if (!Double.isFinite(mahalanobis) || mahalanobis < 0.0) {
            return 0.0;
        }
        double logDensity = -0.5 * (mahalanobis + logNormalizer + Math.log(GuardedMatrices.determinant(covariance)));
        double density = Math.exp(logDensity);
        return Double.isFinite(density) ? density : 0.0;
    }

    /** prior[s] = Σ_r posterior[r] · T[r][s] */
    private double[] predictRegimePrior() {
        double[] prior = new double[regimeCount];
        for (int from = 0; from < regimeCount; from++) {
            for (int to = 0; to < regimeCount; to++) {
                prior[to] += posterior[from] * model.transition(from, to);
            }
        }
        normalizeInPlace(prior);
        return prior;
    }

    private void blendExternalPrior(double[] prior, double[] externalPrior) {
        if (externalPrior == null || externalPriorWeight == 0.0) {
            return;
        }
        if (externalPrior.length != regimeCount) {
            log.debug("Ignoring external prior with {} entries, expected {}", externalPrior.length, regimeCount);
            return;
        }
        double sum = 0.0;
        for (double p : externalPrior) {
            if (!Double.isFinite(p) || p < 0.0) {
                log.debug("Ignoring malformed external prior {}", Arrays.toString(externalPrior));
                return;
            }
            sum += p;
        }
        if (sum <= 0.0) {
            return;
        }
        for (int r = 0; r < regimeCount; r++) {
            prior[r] = (1.0 - externalPriorWeight) * prior[r] + externalPriorWeight * (externalPrior[r] / sum);
        }
    }

    private double[] combine(double[] prior, double[] likelihoods) {
        boolean allUnderflow = true;
        for (double likelihood : likelihoods) {
            if (likelihood >= LIKELIHOOD_FLOOR) {
                allUnderflow = false;
                break;
            }
        }
        if (allUnderflow) {
            log.debug("All regime likelihoods underflowed, resetting posterior to uniform");
            return uniform();
        }

        double[] combined = new double[regimeCount];
        double total = 0.0;
        for (int r = 0; r < regimeCount; r++) {
            combined[r] = prior[r] * Math.max(likelihoods[r], LIKELIHOOD_FLOOR);
            total += combined[r];
        }
        if (!Double.isFinite(total) || total <= 0.0) {
            log.debug("Degenerate regime normalizer {}, resetting posterior to uniform", total);
            return uniform();
        }
        for (int r = 0; r < regimeCount; r++) {
            combined[r] /= total;
        }
        return combined;
    }

    /** Moment-matched collapse of the regime estimates into one state and covariance. */
    private void mix(RealVector[] regimeStates, RealMatrix[] regimeCovariances) {
        RealVector mixedState = new ArrayRealVector(dimension);
        for (int r = 0; r < regimeCount; r++) {
            mixedState = mixedState.add(regimeStates[r].mapMultiply(posterior[r]));
        }

        RealMatrix mixedCovariance = MatrixUtils.createRealMatrix(dimension, dimension);
        for (int r = 0; r < regimeCount; r++) {
            RealVector spread = regimeStates[r].subtract(mixedState);
            mixedCovariance = mixedCovariance.add(
                    regimeCovariances[r].add(spread.outerProduct(spread)).scalarMultiply(posterior[r]));
        }

        if (mixedState.isNaN() || mixedState.isInfinite() || !GuardedMatrices.isFinite(mixedCovariance)) {
            log.warn("Mixed regime estimate is not finite, keeping previous state and resetting belief");
            posterior = uniform();
            return;
        }
        state = mixedState;
        covariance = mixedCovariance;
    }

    private RegimeEstimate buildEstimate(boolean degraded) {
        List<RegimeBelief> beliefs = new ArrayList<>(regimeCount);
        int dominant = 0;
        for (int r = 0; r < regimeCount; r++) {
            RegimeParameters params = model.regime(r);
            beliefs.add(RegimeBelief.builder()
                    .regimeId(r)
                    .name(params.getName())
                    .probability(posterior[r])
                    .meanReversionStrength(params.getMeanReversionStrength())
                    .volatility(params.getVolatility())
                    .momentum(params.getMomentum())
                    .build());
            if (posterior[r] > posterior[dominant]) {
                dominant = r;
            }
        }
        return RegimeEstimate.builder()
                .state(LatentState.of(state.toArray()))
                .beliefs(List.copyOf(beliefs))
                .uncertainty(covariance.getTrace())
                .dominantRegime(dominant)
                .degraded(degraded)
                .build();
    }

    private double[] uniform() {
        double[] values = new double[regimeCount];
        Arrays.fill(values, 1.0 / regimeCount);
        return values;
    }

    private static void normalizeInPlace(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        if (sum <= 0.0 || !Double.isFinite(sum)) {
            Arrays.fill(values, 1.0 / values.length);
            return;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] /= sum;
        }
    }
}
