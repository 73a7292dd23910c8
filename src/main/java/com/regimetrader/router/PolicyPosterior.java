package com.regimetrader.router;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Reward belief and contextual weights of one policy. Owned and mutated only by its
 * {@link StrategyRouter}.
 */
class PolicyPosterior {

    static final double BETA_PRIOR_VARIANCE = 1.0 / 12.0;
    static final double NORMAL_PRIOR_MEAN = 0.0;
    static final double NORMAL_PRIOR_VARIANCE = 1.0;

    private final String policyId;
    private final RewardModel rewardModel;
    private final double observationVariance;
    private final double[] weights;

    private double alpha = 1.0;
    private double beta = 1.0;
    private double mean = NORMAL_PRIOR_MEAN;
    private double variance = NORMAL_PRIOR_VARIANCE;
    private long timesChosen;
    private long rewardUpdates;

    PolicyPosterior(String policyId, RewardModel rewardModel, double observationVariance, int featureCount) {
        this.policyId = policyId;
        this.rewardModel = rewardModel;
        this.observationVariance = observationVariance;
        this.weights = new double[featureCount];
    }

    double sample(RandomGenerator random) {
        if (rewardModel == RewardModel.BETA) {
            return new BetaDistribution(random, alpha, beta).sample();
        }
        return mean + Math.sqrt(variance) * random.nextGaussian();
    }

    double contextualAdjustment(double[] features) {
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i] * features[i];
        }
        return sum;
    }

    /**
     * Beta: positive reward adds min(reward, 1) to α, anything else adds min(|reward|, 1) to β.
     * Normal: conjugate update of the mean with known observation variance.
     */
    void observeReward(double reward) {
        if (rewardModel == RewardModel.BETA) {
            double step = Math.min(Math.abs(reward), 1.0);
            if (reward > 0) {
                alpha += step;
            } else {
                beta += step;
            }
        } else {
            double precision = 1.0 / variance + 1.0 / observationVariance;
            mean = (mean / variance + reward / observationVariance) / precision;
            variance = 1.0 / precision;
        }
        rewardUpdates++;
    }

    /** One online-gradient step: w += learningRate · reward · x, clamped to ±maxWeight. */
    void stepWeights(double reward, double[] features, double learningRate, double maxWeight) {
        for (int i = 0; i < weights.length; i++) {
            double updated = weights[i] + learningRate * reward * features[i];
            weights[i] = Math.max(-maxWeight, Math.min(maxWeight, updated));
        }
    }

    void markChosen() {
        timesChosen++;
    }

    double expectedReward() {
        return rewardModel == RewardModel.BETA ? alpha / (alpha + beta) : mean;
    }

    double posteriorVariance() {
        if (rewardModel == RewardModel.BETA) {
            double total = alpha + beta;
            return alpha * beta / (total * total * (total + 1.0));
        }
        return variance;
    }

    double confidence() {
        double prior = rewardModel == RewardModel.BETA ? BETA_PRIOR_VARIANCE : NORMAL_PRIOR_VARIANCE;
        return Math.max(0.0, Math.min(1.0, 1.0 - posteriorVariance() / prior));
    }

    PolicySnapshot snapshot() {
        return PolicySnapshot.builder()
                .policyId(policyId)
                .rewardModel(rewardModel)
                .alpha(alpha)
                .beta(beta)
                .mean(mean)
                .variance(variance)
                .timesChosen(timesChosen)
                .rewardUpdates(rewardUpdates)
                .expectedReward(expectedReward())
                .confidence(confidence())
                .weights(weights.clone())
                .build();
    }

    String getPolicyId() {
        return policyId;
    }

    long getTimesChosen() {
        return timesChosen;
    }
}
