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
 * Trend follower: requires momentum and order-book imbalance to point the same way.
 */
public class TrendFollowingPolicy implements TradingPolicy {

    private static final double MIN_TREND = 0.002;

    @Override
    public String getId() {
        return PolicyType.TREND_FOLLOWING.getPolicyId();
    }

    @Override
    public TradeSignal decide(LatentState state, List<RegimeBelief> belief, Map<String, Double> features) {
        double momentum = state.getMomentum();
        double imbalance = RegimeWeights.feature(features, FeatureKeys.ORDER_BOOK_IMBALANCE, state.getImbalance());

        if (Math.abs(momentum) < MIN_TREND || Math.signum(momentum) != Math.signum(imbalance)) {
            return TradeSignal.flat(
                    getId(), String.format("no aligned trend (momentum=%.4f, imbalance=%.4f)", momentum, imbalance));
        }

        double regimeMomentum = RegimeWeights.momentum(belief);
        double agreement = clamp(Math.abs(imbalance), 0.0, 1.0);
        double volatility = Math.max(
                Math.abs(RegimeWeights.feature(features, FeatureKeys.SIGMA_GARCH, state.getVolatility())), 0.005);

        return TradeSignal.builder()
                .policyId(getId())
                .direction(momentum > 0 ? SignalDirection.LONG : SignalDirection.SHORT)
                .confidence(clamp(0.5 + 0.25 * agreement + 0.2 * regimeMomentum, 0.0, 1.0))
                .expectedReturn(Math.abs(momentum))
                .winProbability(clamp(0.5 + 0.1 * agreement + 0.1 * regimeMomentum, 0.05, 0.95))
                .avgWin(volatility * 1.8)
                .avgLoss(volatility)
                .volatility(volatility)
                .rationale(String.format("momentum=%.4f imbalance=%.4f", momentum, imbalance))
                .build();
    }
}
