package com.regimetrader.router;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Numeric feature bag the router scores policies against. Every feature is optional:
 * missing or non-finite values read as 0.
 */
public class RouterContext {

    private final Map<String, Double> features;

    private RouterContext(Map<String, Double> features) {
        this.features = features;
    }

    public static RouterContext empty() {
        return new RouterContext(Collections.emptyMap());
    }

    /**
     * Builds a context from market features plus the regime posterior, stored under
     * {@code regime_0 .. regime_{n-1}}.
     */
    public static RouterContext of(Map<String, Double> marketFeatures, double[] regimeProbabilities) {
        Map<String, Double> merged = new HashMap<>();
        if (marketFeatures != null) {
            merged.putAll(marketFeatures);
        }
        if (regimeProbabilities != null) {
            for (int i = 0; i < regimeProbabilities.length; i++) {
                merged.put(FeatureKeys.regime(i), regimeProbabilities[i]);
            }
        }
        return new RouterContext(Collections.unmodifiableMap(merged));
    }

    public double feature(String key) {
        Double value = features.get(key);
        return value != null && Double.isFinite(value) ? value : 0.0;
    }

    /** Market features in {@link FeatureKeys#MARKET_FEATURES} order followed by regime probabilities. */
    double[] toVector(int regimeCount) {
        int marketCount = FeatureKeys.MARKET_FEATURES.size();
        double[] vector = new double[marketCount + regimeCount];
        for (int i = 0; i < marketCount; i++) {
            vector[i] = feature(FeatureKeys.MARKET_FEATURES.get(i));
        }
        for (int r = 0; r < regimeCount; r++) {
            vector[marketCount + r] = feature(FeatureKeys.regime(r));
        }
        return vector;
    }

    public Map<String, Double> asMap() {
        return features;
    }
}
