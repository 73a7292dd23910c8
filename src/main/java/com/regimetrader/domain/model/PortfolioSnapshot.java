package com.regimetrader.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Read-only view of the portfolio the sizer works against.
 *
 * <p>Written only by the external execution/fill reporter: the decision pipeline never
 * mutates it. {@code dailyReturns} is the portfolio's daily return history (oldest first),
 * {@code symbolReturns} holds per-symbol price-return series used for correlation.
 */
@Getter
@Builder(toBuilder = true)
public class PortfolioSnapshot {

    @Singular
    private final Map<String, PositionExposure> positions;

    private final double portfolioValue;
    private final double dailyPnl;
    private final int consecutiveLosses;

    @Singular
    private final List<Double> dailyReturns;

    @Singular("symbolReturnSeries")
    private final Map<String, List<Double>> symbolReturns;

    public static PortfolioSnapshot empty(double portfolioValue) {
        return PortfolioSnapshot.builder().portfolioValue(portfolioValue).build();
    }

    /** Position weight (notional / portfolio value), 0 when absent or the portfolio is empty. */
    public double weightOf(String symbol) {
        PositionExposure position = positions.get(symbol);
        if (position == null || portfolioValue <= 0.0) {
            return 0.0;
        }
        return position.marketValue() / portfolioValue;
    }

    /** Sum of all position weights. */
    public double totalExposure() {
        if (portfolioValue <= 0.0) {
            return 0.0;
        }
        double total = 0.0;
        for (PositionExposure position : positions.values()) {
            total += position.marketValue();
        }
        return total / portfolioValue;
    }

    public List<Double> returnsOf(String symbol) {
        List<Double> series = symbolReturns.get(symbol);
        return series != null ? series : Collections.emptyList();
    }
}
