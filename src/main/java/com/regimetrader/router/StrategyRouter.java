package com.regimetrader.router;

import com.regimetrader.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contextual Thompson-sampling router over a fixed policy catalog.
 *
 * <p>{@link #choose} scores every policy as
 * <pre>
 *   sample(posterior) + w_policy · x(context) + explorationWeight / √(timesChosen + 1)
 * </pre>
 * and returns the arg-max (ties go to the earlier policy in catalog order).
 * {@link #update} feeds a realized reward back into the chosen policy's posterior and takes
 * one gradient step on its weight vector. Priors are uninformative, so early choices are
 * close to uniform.
 *
 * <p>Not thread-safe; owned by one pipeline and called under its lock.
 */
public class StrategyRouter {

    private static final Logger log = LoggerFactory.getLogger(StrategyRouter.class);

    private final Map<String, PolicyPosterior> posteriors = new LinkedHashMap<>();
    private final RouterProperties properties;
    private final RandomGenerator random;
    private final int regimeCount;
    private final int featureCount;

    public StrategyRouter(
            Collection<String> policyIds, int regimeCount, RouterProperties properties, RandomGenerator random) {
        if (policyIds == null || policyIds.isEmpty()) {
            throw new ConfigurationException("Strategy router needs at least one policy");
        }
        this.properties = properties;
        this.random = random;
        this.regimeCount = regimeCount;
        this.featureCount = FeatureKeys.MARKET_FEATURES.size() + regimeCount;

        for (String policyId : policyIds) {
            PolicyPosterior previous = posteriors.put(
                    policyId,
                    new PolicyPosterior(
                            policyId,
                            properties.getRewardModel(),
                            properties.getNormalObservationVariance(),
                            featureCount));
            if (previous != null) {
                throw new ConfigurationException("Duplicate policy id in catalog: " + policyId);
            }
        }
    }

    public PolicyChoice choose(RouterContext context) {
        double[] features = (context != null ? context : RouterContext.empty()).toVector(regimeCount);

        PolicyPosterior best = null;
        PolicyChoice bestChoice = null;
        for (PolicyPosterior posterior : posteriors.values()) {
            double sampled = posterior.sample(random);
            double adjustment = posterior.contextualAdjustment(features);
            double bonus = properties.getExplorationWeight() / Math.sqrt(posterior.getTimesChosen() + 1.0);
            double score = sampled + adjustment + bonus;
            if (!Double.isFinite(score)) {
                log.debug("Non-finite score for policy {}, skipping", posterior.getPolicyId());
                continue;
            }
            if (bestChoice == null || score > bestChoice.getScore()) {
                best = posterior;
                bestChoice = PolicyChoice.builder()
                        .policyId(posterior.getPolicyId())
                        .score(score)
                        .sampledReward(sampled)
                        .contextualAdjustment(adjustment)
                        .explorationBonus(bonus)
                        .build();
            }
        }

        if (best == null) {
            // Every score degenerate: fall back to the least explored policy
            best = posteriors.values().stream()
                    .min((a, b) -> Long.compare(a.getTimesChosen(), b.getTimesChosen()))
                    .orElseThrow();
            bestChoice = PolicyChoice.builder()
                    .policyId(best.getPolicyId())
                    .score(0.0)
                    .build();
        }

        best.markChosen();
        return bestChoice;
    }

    /**
     * Feeds a realized reward back to a policy.
     *
     * @throws ConfigurationException when the policy id is not in this router's catalog
     */
    public void update(String policyId, double reward, RouterContext context) {
        PolicyPosterior posterior = posteriors.get(policyId);
        if (posterior == null) {
            throw ConfigurationException.unknownPolicy(policyId);
        }
        if (!Double.isFinite(reward)) {
            log.warn("Ignoring non-finite reward {} for policy {}", reward, policyId);
            return;
        }

        double[] features = (context != null ? context : RouterContext.empty()).toVector(regimeCount);
        posterior.observeReward(reward);
        posterior.stepWeights(reward, features, properties.getLearningRate(), properties.getMaxWeight());
        log.debug("Policy {} updated with reward {}: expected={}", policyId, reward, posterior.expectedReward());
    }

    public List<PolicySnapshot> snapshot() {
        List<PolicySnapshot> snapshots = new ArrayList<>(posteriors.size());
        for (PolicyPosterior posterior : posteriors.values()) {
            snapshots.add(posterior.snapshot());
        }
        return snapshots;
    }

    public PolicySnapshot snapshot(String policyId) {
        PolicyPosterior posterior = posteriors.get(policyId);
        if (posterior == null) {
            throw ConfigurationException.unknownPolicy(policyId);
        }
        return posterior.snapshot();
    }

    public List<String> getPolicyIds() {
        return List.copyOf(posteriors.keySet());
    }

    public int getFeatureCount() {
        return featureCount;
    }
}
