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
 * Follows the filtered momentum component. Confidence grows with the size of the move
 * and with the belief mass on momentum-heavy regimes.
 */
public class MomentumPolicy implements TradingPolicy {

    private static final double MIN_MOMENTUM = 0.005;
    private static final double FULL_STRENGTH_MOMENTUM = 0.05;

    @Override
    public String getId() {
        return PolicyType.MOMENTUM.getPolicyId();
    }

    @Override
    public TradeSignal decide(LatentState state, List<RegimeBelief> belief, Map<String, Double> features) {
        double momentum = state.getMomentum();
        if (Math.abs(momentum) < MIN_MOMENTUM) {
            return TradeSignal.flat(getId(), "momentum " + momentum + " below threshold " + MIN_MOMENTUM);
        }

        double regimeMomentum = RegimeWeights.momentum(belief);
        double strength = clamp(Math.abs(momentum) / FULL_STRENGTH_MOMENTUM, 0.0, 1.0);
        double volatility = Math.max(
                Math.abs(RegimeWeights.feature(features, FeatureKeys.SIGMA_HAR, state.getVolatility())), 0.005);

        return TradeSignal.builder()
                .policyId(getId())
                .direction(momentum > 0 ? SignalDirection.LONG : SignalDirection.SHORT)
                .confidence(clamp(0.45 + 0.3 * strength + 0.25 * regimeMomentum, 0.0, 1.0))
                .expectedReturn(Math.abs(momentum) * (0.5 + regimeMomentum))
                .winProbability(clamp(0.5 + 0.15 * regimeMomentum + 0.05 * strength, 0.05, 0.95))
                .avgWin(volatility * 1.5)
                .avgLoss(volatility)
                .volatility(volatility)
                .rationale(String.format("momentum=%.4f regimeMomentum=%.3f", momentum, regimeMomentum))
                .build();
    }
}
