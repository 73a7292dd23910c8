package com.regimetrader.risk;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Reported (non-gating) portfolio statistics. VaR and expected shortfall are positive
 * loss magnitudes at the 95% level; all values are 0 when there is not enough history.
 */
@Getter
@Builder
@ToString
public class PortfolioRiskMetrics {

    private final int observations;
    private final double annualizedVolatility;
    private final double sharpeRatio;
    private final double maxDrawdown;
    private final double valueAtRisk95;
    private final double expectedShortfall95;
    private final double herfindahlIndex;
    private final double totalExposure;

    public static PortfolioRiskMetrics empty() {
        return PortfolioRiskMetrics.builder().build();
    }
}
