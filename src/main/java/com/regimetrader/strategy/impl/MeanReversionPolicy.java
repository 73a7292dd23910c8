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
 * Fades deviations of the filtered microprice from its (zero) anchor. Only trades when
 * the belief leans toward mean-reverting regimes.
 */
public class MeanReversionPolicy implements TradingPolicy {

    private static final double MIN_DEVIATION = 0.01;
    private static final double MIN_REVERSION_STRENGTH = 0.4;

    @Override
    public String getId() {
        return PolicyType.MEAN_REVERSION.getPolicyId();
    }

    @Override
    public TradeSignal decide(LatentState state, List<RegimeBelief> belief, Map<String, Double> features) {
        double deviation = state.getMicroprice();
        double reversion = RegimeWeights.meanReversion(belief);
        if (Math.abs(deviation) < MIN_DEVIATION) {
            return TradeSignal.flat(getId(), "deviation " + deviation + " inside band " + MIN_DEVIATION);
        }
        if (reversion < MIN_REVERSION_STRENGTH) {
            return TradeSignal.flat(getId(), "belief not mean-reverting (" + reversion + ")");
        }

        double volatility = Math.max(
                Math.abs(RegimeWeights.feature(features, FeatureKeys.SIGMA_HAR, state.getVolatility())), 0.005);
        double stretch = clamp(Math.abs(deviation) / (3.0 * volatility), 0.0, 1.0);

        return TradeSignal.builder()
                .policyId(getId())
                .direction(deviation > 0 ? SignalDirection.SHORT : SignalDirection.LONG)
                .confidence(clamp(0.4 + 0.35 * reversion + 0.25 * stretch, 0.0, 1.0))
                .expectedReturn(Math.abs(deviation) * reversion)
                .winProbability(clamp(0.5 + 0.2 * reversion * stretch, 0.05, 0.95))
                .avgWin(Math.abs(deviation) * reversion)
                .avgLoss(volatility)
                .volatility(volatility)
                .rationale(String.format("deviation=%.4f reversion=%.3f", deviation, reversion))
                .build();
    }
}
