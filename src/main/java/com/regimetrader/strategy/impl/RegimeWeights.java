package com.regimetrader.strategy.impl;

import com.regimetrader.domain.vo.RegimeBelief;
import java.util.List;
import java.util.Map;

/**
 * Belief-weighted regime descriptors shared by the built-in policies.
 */
final class RegimeWeights {

    private RegimeWeights() {}

    static double meanReversion(List<RegimeBelief> belief) {
        double sum = 0.0;
        for (RegimeBelief b : belief) {
            sum += b.getProbability() * b.getMeanReversionStrength();
        }
        return sum;
    }

    static double momentum(List<RegimeBelief> belief) {
        double sum = 0.0;
        for (RegimeBelief b : belief) {
            sum += b.getProbability() * b.getMomentum();
        }
        return sum;
    }

    static double volatility(List<RegimeBelief> belief) {
        double sum = 0.0;
        for (RegimeBelief b : belief) {
            sum += b.getProbability() * b.getVolatility();
        }
        return sum;
    }

    static double feature(Map<String, Double> features, String key, double fallback) {
        if (features == null) {
            return fallback;
        }
        Double value = features.get(key);
        return value != null && Double.isFinite(value) ? value : fallback;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
