package com.regimetrader.risk;

import com.regimetrader.domain.enums.SignalDirection;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one sizing call. Sizes are fractions of portfolio value.
 *
 * <p>Always carries a reasoning string and an alert list, including for no-trade results,
 * so an operator can see what drove the number. Invariant:
 * {@code 0 ≤ recommendedSize ≤ maxAllowedSize ≤ maxSinglePosition}.
 */
@Getter
@Builder
@ToString
public class SizingResult {

    private final String symbol;
    private final SignalDirection direction;
    private final double recommendedSize;
    private final double maxAllowedSize;
    private final double kellyFraction;
    private final double notional;
    private final double units;

    /** units × price × stop-loss percent */
    private final double riskAmount;

    private final double stopLossPrice;
    private final double takeProfitPrice;

    /** The factor that determined the final size (e.g. "kelly", "max single position"). */
    private final String drivingFactor;

    private final String reasoning;
    private final List<RiskAlert> alerts;
    private final PortfolioRiskMetrics metrics;

    public boolean isTrade() {
        return recommendedSize > 0.0;
    }

    public boolean hasAlert(AlertLevel level) {
        return alerts.stream().anyMatch(a -> a.getLevel() == level);
    }

    static SizingResult noTrade(
            String symbol,
            double maxAllowedSize,
            String drivingFactor,
            String reasoning,
            List<RiskAlert> alerts,
            PortfolioRiskMetrics metrics) {
        return SizingResult.builder()
                .symbol(symbol)
                .direction(SignalDirection.FLAT)
                .recommendedSize(0.0)
                .maxAllowedSize(maxAllowedSize)
                .drivingFactor(drivingFactor)
                .reasoning(reasoning)
                .alerts(List.copyOf(alerts))
                .metrics(metrics)
                .build();
    }
}
