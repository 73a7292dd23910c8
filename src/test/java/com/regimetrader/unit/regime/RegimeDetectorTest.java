package com.regimetrader.unit.regime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.regimetrader.domain.model.RegimeEstimate;
import com.regimetrader.domain.vo.Observation;
import com.regimetrader.domain.vo.RegimeBelief;
import com.regimetrader.exception.ConfigurationException;
import com.regimetrader.regime.RegimeDetector;
import com.regimetrader.regime.RegimeModel;
import com.regimetrader.support.TestModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RegimeDetectorTest {

    private RegimeModel model;
    private RegimeDetector detector;

    @BeforeEach
    void setUp() {
        model = TestModels.defaultModel();
        detector = new RegimeDetector(model, 0.0);
    }

    private static void assertDistribution(RegimeEstimate estimate) {
        double sum = 0.0;
        for (RegimeBelief belief : estimate.getBeliefs()) {
            assertThat(belief.getProbability()).isBetween(0.0, 1.0);
            sum += belief.getProbability();
        }
        assertThat(sum).isCloseTo(1.0, within(1e-6));
    }

    // ==============================
    // POSTERIOR INVARIANTS
    // ==============================

    @Nested
    @DisplayName("Posterior invariants")
    class PosteriorInvariants {

        @Test
        @DisplayName("Beliefs form a distribution on every tick of a mixed tape")
        void beliefsSumToOne_everyTick() {
            assertDistribution(detector.currentEstimate());

            for (int t = 0; t < 60; t++) {
                Observation observation;
                if (t % 17 == 5) {
                    observation = Observation.of(new double[] {Double.NaN, 0, 0, 0, 0, 0, 0});
                } else if (t % 3 == 0) {
                    observation = TestModels.turbulent(t);
                } else {
                    observation = TestModels.calm();
                }
                RegimeEstimate estimate = detector.update(observation);

                assertDistribution(estimate);
                assertThat(estimate.getUncertainty()).isFinite().isPositive();
                for (double component : estimate.getState().toArray()) {
                    assertThat(component).isFinite();
                }
            }
        }

        @Test
        @DisplayName("Extreme observations never throw and keep the belief valid")
        void extremeObservations() {
            RegimeEstimate estimate = detector.update(Observation.of(new double[] {1e6, -1e6, 1e6, 1e6, -1e6, 1e6, 1e6}));

            assertDistribution(estimate);
            assertThat(estimate.isDegraded()).isFalse();
        }
    }

    // ==============================
    // CONVERGENCE
    // ==============================

    @Nested
    @DisplayName("Convergence")
    class Convergence {

        @Test
        @DisplayName("Fifty calm ticks settle on the mean-reversion regime")
        void calmTape_convergesToRegimeZero() {
            RegimeEstimate estimate = null;
            for (int t = 0; t < 50; t++) {
                estimate = detector.update(TestModels.calm());
            }

            assertThat(estimate.getDominantRegime()).isZero();
            assertThat(estimate.dominantBelief().getName()).isEqualTo("low-volatility-mean-reversion");
            assertThat(estimate.probabilities()[0]).isGreaterThan(0.9);
        }

        @Test
        @DisplayName("Regime ranking under a repeated observation stabilizes and stays put")
        void repeatedObservation_rankingStabilizes() {
            detector.update(TestModels.calm());
            detector.update(TestModels.calm());
            double previous = detector.getPosterior()[0];

            for (int t = 2; t < 50; t++) {
                RegimeEstimate estimate = detector.update(TestModels.calm());
                double[] p = estimate.probabilities();

                assertThat(estimate.getDominantRegime()).isZero();
                assertThat(p[0]).isGreaterThan(p[1]);
                assertThat(p[1]).isGreaterThan(p[3]);
                assertThat(p[0]).isCloseTo(previous, within(0.1));
                previous = p[0];
            }
        }

        @Test
        @DisplayName("Large alternating swings are attributed to the stress regime")
        void turbulentTape_favoursStressRegime() {
            RegimeEstimate estimate = null;
            for (int t = 0; t < 10; t++) {
                estimate = detector.update(TestModels.turbulent(t));
                if (t >= 1) {
                    assertThat(estimate.getDominantRegime()).isEqualTo(3);
                }
            }

            assertThat(estimate.probabilities()[3]).isGreaterThan(0.9);
            assertThat(estimate.probabilities()[0]).isLessThan(0.01);
        }
    }

    // ==============================
    // DEGRADED INPUT
    // ==============================

    @Nested
    @DisplayName("Degraded input")
    class DegradedInput {

        @Test
        @DisplayName("Non-finite observation pulls the belief halfway to uniform and keeps the state")
        void nonFinite_degradesTowardUniform() {
            for (int t = 0; t < 10; t++) {
                detector.update(TestModels.calm());
            }
            double[] before = detector.getPosterior();
            double[] stateBefore = detector.currentEstimate().getState().toArray();

            RegimeEstimate estimate =
                    detector.update(Observation.of(new double[] {0, Double.POSITIVE_INFINITY, 0, 0, 0, 0, 0}));

            assertThat(estimate.isDegraded()).isTrue();
            for (int r = 0; r < before.length; r++) {
                assertThat(estimate.probabilities()[r]).isCloseTo(0.5 * before[r] + 0.125, within(1e-9));
            }
            assertThat(estimate.getState().toArray()).containsExactly(stateBefore);
            assertThat(detector.getUpdates()).isEqualTo(10);
        }

        @Test
        @DisplayName("Null observation is treated like a non-finite one")
        void nullObservation_degrades() {
            RegimeEstimate estimate = detector.update(null);

            assertThat(estimate.isDegraded()).isTrue();
            assertDistribution(estimate);
        }

        @Test
        @DisplayName("Zero-noise model survives singular covariances and likelihood underflow")
        void singularModel_fallsBackToUniform() {
            RegimeDetector singular = new RegimeDetector(TestModels.loader().load(TestModels.SINGULAR_MODEL), 0.0);

            RegimeEstimate exact = singular.update(Observation.of(new double[] {0, 0, 0, 0, 0, 0, 0}));
            assertDistribution(exact);

            RegimeEstimate far = singular.update(Observation.of(new double[] {1, 1, 1, 1, 1, 1, 1}));
            assertDistribution(far);
            assertThat(far.probabilities()).containsExactly(new double[] {0.5, 0.5}, within(1e-12));
            assertThat(far.isDegraded()).isFalse();
        }
    }

    // ==============================
    // EXTERNAL PRIOR
    // ==============================

    @Nested
    @DisplayName("External prior")
    class ExternalPrior {

        @Test
        @DisplayName("A hint toward a regime raises that regime's posterior")
        void hint_shiftsPosterior() {
            RegimeDetector hinted = new RegimeDetector(model, RegimeDetector.MAX_EXTERNAL_PRIOR_WEIGHT);
            double[] hint = {0.0, 0.0, 0.0, 1.0};

            double plain = detector.update(TestModels.calm()).probabilities()[3];
            double withHint = hinted.update(TestModels.calm(), hint).probabilities()[3];

            assertThat(withHint).isGreaterThan(plain);
        }

        @Test
        @DisplayName("Malformed hints are ignored")
        void malformedHint_ignored() {
            RegimeDetector hinted = new RegimeDetector(model, 0.1);
            RegimeDetector other = new RegimeDetector(model, 0.1);

            double[] expected = detector.update(TestModels.calm()).probabilities();
            double[] wrongLength = hinted.update(TestModels.calm(), new double[] {1.0, 0.0}).probabilities();
            double[] negative = other.update(TestModels.calm(), new double[] {-1.0, 1.0, 0.5, 0.5}).probabilities();

            assertThat(wrongLength).containsExactly(expected, within(1e-12));
            assertThat(negative).containsExactly(expected, within(1e-12));
        }

        @Test
        @DisplayName("Weight above the cap is a configuration error")
        void weightAboveCap_throws() {
            assertThatThrownBy(() -> new RegimeDetector(model, 0.2)).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> new RegimeDetector(model, -0.01)).isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    @DisplayName("Missing model is a configuration error")
    void nullModel_throws() {
        assertThatThrownBy(() -> new RegimeDetector(null, 0.0)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Reset restores the initial prior and clears the tick count")
    void reset_restoresInitialPrior() {
        for (int t = 0; t < 5; t++) {
            detector.update(TestModels.turbulent(t));
        }

        detector.reset();

        assertThat(detector.getUpdates()).isZero();
        assertThat(detector.getPosterior()).containsExactly(model.getInitialRegimePrior(), within(1e-12));
        assertThat(detector.currentEstimate().isDegraded()).isFalse();
    }
}
