package com.regimetrader.risk;

import com.regimetrader.domain.model.PortfolioSnapshot;
import com.regimetrader.domain.model.PositionExposure;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

/**
 * Computes {@link PortfolioRiskMetrics} from a portfolio's daily return series and
 * position weights.
 *
 * <p>Formulas:
 * <ul>
 *   <li>annualized volatility = √(sample variance · 252)</li>
 *   <li>Sharpe = (mean · 252 − riskFreeRate) / annualized volatility</li>
 *   <li>max drawdown over the compounded path Π(1 + rᵢ)</li>
 *   <li>VaR95 = −sorted[⌊n · 0.05⌋], ES95 = −mean(sorted[0..⌊n · 0.05⌋])</li>
 *   <li>Herfindahl = Σ wᵢ² with wᵢ = notionalᵢ / portfolio value</li>
 * </ul>
 * Stateless and safe to share.
 */
@Component
public class PortfolioRiskCalculator {

    static final int TRADING_DAYS = 252;
    static final double TAIL_PROBABILITY = 0.05;

    public PortfolioRiskMetrics compute(PortfolioSnapshot portfolio, double riskFreeRate) {
        if (portfolio == null) {
            return PortfolioRiskMetrics.empty();
        }
        double[] returns = finiteReturns(portfolio.getDailyReturns());
        double herfindahl = herfindahl(portfolio);
        double totalExposure = portfolio.totalExposure();

        if (returns.length < 2) {
            return PortfolioRiskMetrics.builder()
                    .observations(returns.length)
                    .herfindahlIndex(herfindahl)
                    .totalExposure(totalExposure)
                    .build();
        }

        double mean = StatUtils.mean(returns);
        double annualizedVolatility = Math.sqrt(StatUtils.variance(returns) * TRADING_DAYS);
        double sharpe = annualizedVolatility > 0.0 ? (mean * TRADING_DAYS - riskFreeRate) / annualizedVolatility : 0.0;

        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        int tailIndex = (int) Math.floor(sorted.length * TAIL_PROBABILITY);
        double valueAtRisk = Math.max(0.0, -sorted[tailIndex]);
        double expectedShortfall = Math.max(0.0, -StatUtils.mean(sorted, 0, tailIndex + 1));

        return PortfolioRiskMetrics.builder()
                .observations(returns.length)
                .annualizedVolatility(annualizedVolatility)
                .sharpeRatio(sharpe)
                .maxDrawdown(maxDrawdown(returns))
                .valueAtRisk95(valueAtRisk)
                .expectedShortfall95(expectedShortfall)
                .herfindahlIndex(herfindahl)
                .totalExposure(totalExposure)
                .build();
    }

    static double maxDrawdown(double[] returns) {
        double value = 1.0;
        double peak = 1.0;
        double maxDrawdown = 0.0;
        for (double r : returns) {
            value *= 1.0 + r;
            peak = Math.max(peak, value);
            if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
            }
        }
        return maxDrawdown;
    }

    private static double herfindahl(PortfolioSnapshot portfolio) {
        if (portfolio.getPortfolioValue() <= 0.0) {
            return 0.0;
        }
        double sum = 0.0;
        for (PositionExposure position : portfolio.getPositions().values()) {
            double weight = position.marketValue() / portfolio.getPortfolioValue();
            sum += weight * weight;
        }
        return sum;
    }

    private static double[] finiteReturns(List<Double> returns) {
        return returns.stream()
                .filter(r -> r != null && Double.isFinite(r))
                .mapToDouble(Double::doubleValue)
                .toArray();
    }
}
