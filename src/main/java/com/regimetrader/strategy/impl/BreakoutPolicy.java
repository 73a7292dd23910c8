package com.regimetrader.strategy.impl;

import static com.regimetrader.strategy.impl.RegimeWeights.clamp;

import com.regimetrader.domain.enums.SignalDirection;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.domain.vo.LatentState;
import com.regimetrader.domain.vo.RegimeBelief;
import com.regimetrader.router.FeatureKeys;
import com.regimetrader.strategy.PolicyType;
import com.regimetrader.strategy.TradingPolicy;
import java.util.List;
import java.util.Map;

/**
 * Trades a price excursion larger than a multiple of the current volatility when the
 * momentum component agrees with it.
 */
public class BreakoutPolicy implements TradingPolicy {

    private static final double BREAKOUT_MULTIPLE = 2.0;

    @Override
    public String getId() {
        return PolicyType.BREAKOUT.getPolicyId();
    }

    @Override
    public TradeSignal decide(LatentState state, List<RegimeBelief> belief, Map<String, Double> features) {
        double volatility = Math.max(
                Math.abs(RegimeWeights.feature(features, FeatureKeys.SIGMA_HAR, state.getVolatility())), 0.005);
        double excursion = state.getMicroprice();
        double threshold = BREAKOUT_MULTIPLE * volatility;

        if (Math.abs(excursion) < threshold) {
            return TradeSignal.flat(getId(), String.format("no breakout: |%.4f| < %.4f", excursion, threshold));
        }
        if (Math.signum(excursion) != Math.signum(state.getMomentum())) {
            return TradeSignal.flat(getId(), "momentum does not confirm the excursion");
        }

        double overshoot = clamp(Math.abs(excursion) / threshold - 1.0, 0.0, 1.0);
        double regimeVolatility = RegimeWeights.volatility(belief);
        double whales = RegimeWeights.feature(features, FeatureKeys.WHALE_ACTIVITY, 0.0);

        return TradeSignal.builder()
                .policyId(getId())
                .direction(excursion > 0 ? SignalDirection.LONG : SignalDirection.SHORT)
                .confidence(clamp(0.5 + 0.3 * overshoot + 0.1 * clamp(whales, 0.0, 1.0), 0.0, 1.0))
                .expectedReturn(Math.abs(excursion) * 0.5)
                .winProbability(clamp(0.45 + 0.15 * overshoot + 0.1 * regimeVolatility, 0.05, 0.95))
                .avgWin(volatility * 2.0)
                .avgLoss(volatility)
                .volatility(volatility)
                .rationale(String.format("excursion=%.4f threshold=%.4f", excursion, threshold))
                .build();
    }
}
