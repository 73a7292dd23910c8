package com.regimetrader.risk;

import com.regimetrader.domain.model.PortfolioSnapshot;
import com.regimetrader.domain.model.TradeSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a policy signal into a bounded position size (fraction of portfolio value).
 *
 * <p>Gate sequence (any failure returns a no-trade result, never an exception):
 * <ol>
 *   <li>Emergency latch not set</li>
 *   <li>Portfolio value and daily P&L usable</li>
 *   <li>Daily P&L above −dailyLossLimit × portfolio value (breach latches EMERGENCY)</li>
 *   <li>Every open position valued finitely, price usable</li>
 *   <li>Consecutive losses below the limit</li>
 *   <li>Signal finite, not flat, confidence ≥ floor</li>
 *   <li>Kelly fraction &gt; 0</li>
 * </ol>
 *
 * <p>Sizing: Kelly f = (b·p − q)/b with b = avgWin/avgLoss, times the fractional cap,
 * times the stepped {@link VolatilityBand} multiplier, times the correlation discount
 * max(0.1, 1 − 2·(ρ − threshold)) when ρ exceeds the threshold. The result is then clamped,
 * in this order, to the per-symbol headroom, the max single position (configured, then
 * absolute) and finally the total-portfolio headroom, which always wins.
 *
 * <p>Not thread-safe; one sizer per pipeline, called under the pipeline's lock.
 */
public class RiskAwarePositionSizer {

    private static final Logger log = LoggerFactory.getLogger(RiskAwarePositionSizer.class);

    private static final double MIN_CORRELATION_FACTOR = 0.1;
    private static final double CORRELATION_PENALTY_SLOPE = 2.0;
    private static final double MIN_TRADABLE_SIZE = 1e-9;

    private final SizingLimits limits;
    private final PortfolioRiskCalculator riskCalculator;
    private final CorrelationEstimator correlationEstimator;

    private boolean emergencyLatched;
    private String emergencyReason;

    public RiskAwarePositionSizer(
            SizingLimits limits, PortfolioRiskCalculator riskCalculator, CorrelationEstimator correlationEstimator) {
        this.limits = limits;
        this.riskCalculator = riskCalculator;
        this.correlationEstimator = correlationEstimator;
    }

    // ========================
    // SIZING
    // ========================

    public SizingResult size(String symbol, TradeSignal signal, PortfolioSnapshot portfolio, double price) {
        List<RiskAlert> alerts = new ArrayList<>();
        PortfolioRiskMetrics metrics = riskCalculator.compute(portfolio, limits.getRiskFreeRate());
        double maxAllowed = maxAllowedSize(symbol, portfolio);

        // 1. Emergency latch
        if (emergencyLatched) {
            alerts.add(RiskAlert.of(
                    AlertLevel.EMERGENCY,
                    AlertType.DAILY_LOSS,
                    "Sizing blocked by emergency latch: " + emergencyReason,
                    "Investigate and reset the emergency latch explicitly"));
            return SizingResult.noTrade(
                    symbol, maxAllowed, "emergency latch", "No trade: emergency latch active", alerts, metrics);
        }

        // 2. Portfolio
        if (portfolio == null
                || !Double.isFinite(portfolio.getPortfolioValue())
                || portfolio.getPortfolioValue() <= 0.0
                || !Double.isFinite(portfolio.getDailyPnl())) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.INVALID_SIGNAL,
                    "Unusable portfolio value or daily P&L",
                    "Check the portfolio snapshot"));
            return SizingResult.noTrade(
                    symbol, maxAllowed, "invalid input", "No trade: portfolio value unusable", alerts, metrics);
        }

        // 3. Portfolio-level limits (daily loss latches)
        alerts.addAll(checkRiskLimits(portfolio, metrics));
        if (alerts.stream().anyMatch(a -> a.getLevel() == AlertLevel.EMERGENCY)) {
            latchEmergency(String.format(
                    Locale.ROOT,
                    "daily P&L %.2f breached limit %.2f",
                    portfolio.getDailyPnl(),
                    -limits.getDailyLossLimit() * portfolio.getPortfolioValue()));
            return SizingResult.noTrade(
                    symbol, maxAllowed, "daily loss limit", "No trade: daily loss limit breached", alerts, metrics);
        }

        // 4. Positions and price
        if (hasNonFinitePosition(portfolio)) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.INVALID_SIGNAL,
                    "Position with non-finite quantity or price",
                    "Check the portfolio snapshot"));
            return SizingResult.noTrade(
                    symbol, maxAllowed, "invalid input", "No trade: open position value unusable", alerts, metrics);
        }
        if (!Double.isFinite(price) || price <= 0.0) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.INVALID_SIGNAL,
                    format("Unusable price %s", price),
                    "Check the price feed"));
            return SizingResult.noTrade(
                    symbol, maxAllowed, "invalid input", "No trade: price unusable", alerts, metrics);
        }

        // 5. Consecutive losses
        if (portfolio.getConsecutiveLosses() >= limits.getMaxConsecutiveLosses()) {
            alerts.add(RiskAlert.of(
                    AlertLevel.CRITICAL,
                    AlertType.CONSECUTIVE_LOSSES,
                    portfolio.getConsecutiveLosses() + " consecutive losses",
                    "Pause new entries until a winning trade or manual review",
                    portfolio.getConsecutiveLosses(),
                    limits.getMaxConsecutiveLosses()));
            return SizingResult.noTrade(
                    symbol,
                    maxAllowed,
                    "consecutive losses",
                    "No trade: consecutive loss limit " + limits.getMaxConsecutiveLosses() + " reached",
                    alerts,
                    metrics);
        }

        // 6. Signal validity and confidence
        if (signal == null || !signal.isFinite()) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.INVALID_SIGNAL,
                    "Signal missing or contains non-finite values",
                    "Inspect the emitting policy"));
            return SizingResult.noTrade(symbol, maxAllowed, "invalid signal", "No trade: invalid signal", alerts, metrics);
        }
        if (signal.isFlat()) {
            return SizingResult.noTrade(
                    symbol,
                    maxAllowed,
                    "flat signal",
                    "No trade: flat signal" + (signal.getRationale() != null ? " (" + signal.getRationale() + ")" : ""),
                    alerts,
                    metrics);
        }
        if (signal.getConfidence() < limits.getMinConfidence()) {
            return SizingResult.noTrade(
                    symbol,
                    maxAllowed,
                    "confidence floor",
                    format("No trade: confidence %.3f below floor %.3f", signal.getConfidence(), limits.getMinConfidence()),
                    alerts,
                    metrics);
        }

        // 7. Kelly
        double kelly = kellyFraction(signal.getWinProbability(), signal.getAvgWin(), signal.getAvgLoss());
        if (kelly <= 0.0) {
            return SizingResult.noTrade(
                    symbol,
                    maxAllowed,
                    "kelly",
                    format("No trade: non-positive Kelly fraction (p=%.3f, avgWin=%.4f, avgLoss=%.4f)",
                            signal.getWinProbability(), signal.getAvgWin(), signal.getAvgLoss()),
                    alerts,
                    metrics);
        }

        StringBuilder reasoning = new StringBuilder();
        double size = kelly * limits.getKellyFraction();
        reasoning.append(format("kelly %.4f x%.2f = %.4f", kelly, limits.getKellyFraction(), size));
        String drivingFactor = "kelly";

        // 8. Stepped volatility scaling
        VolatilityBand band = VolatilityBand.of(signal.getVolatility());
        size *= band.getMultiplier();
        reasoning.append(format("; volatility %.4f band %s x%.1f = %.4f",
                signal.getVolatility(), band, band.getMultiplier(), size));
        if (band == VolatilityBand.EXTREME) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.VOLATILITY,
                    format("Extreme volatility %.4f", signal.getVolatility()),
                    "Size reduced to the extreme-volatility band",
                    signal.getVolatility(),
                    VolatilityBand.EXTREME_THRESHOLD));
        }

        // 9. Correlation discount
        double correlation = correlationEstimator.maxCorrelation(symbol, portfolio);
        if (correlation > limits.getCorrelationThreshold()) {
            double factor = Math.max(
                    MIN_CORRELATION_FACTOR,
                    1.0 - (correlation - limits.getCorrelationThreshold()) * CORRELATION_PENALTY_SLOPE);
            size *= factor;
            drivingFactor = "correlation";
            reasoning.append(format("; correlation %.3f x%.3f = %.4f", correlation, factor, size));
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.CORRELATION,
                    format("Correlation %.3f with an open position", correlation),
                    "Size discounted for correlated exposure",
                    correlation,
                    limits.getCorrelationThreshold()));
        }

        // 10. Caps, fixed order; total-portfolio headroom last
        double symbolHeadroom = symbolHeadroom(symbol, portfolio);
        if (size > symbolHeadroom) {
            size = symbolHeadroom;
            drivingFactor = "symbol exposure cap";
            reasoning.append(format("; capped by symbol headroom %.4f", symbolHeadroom));
        }
        double singleCap = singlePositionCap();
        if (size > singleCap) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.POSITION_SIZE,
                    format("Raw size %.4f above single position cap %.4f", size, singleCap),
                    "Size capped",
                    size,
                    singleCap));
            size = singleCap;
            drivingFactor = "max single position";
            reasoning.append(format("; capped by max single position %.4f", singleCap));
        }
        double totalHeadroom = totalHeadroom(portfolio);
        if (size > totalHeadroom) {
            size = totalHeadroom;
            drivingFactor = "total exposure cap";
            reasoning.append(format("; capped by total exposure headroom %.4f", totalHeadroom));
        }

        if (size < MIN_TRADABLE_SIZE) {
            reasoning.append("; no headroom left");
            return SizingResult.noTrade(
                    symbol, maxAllowed, drivingFactor, "No trade: " + reasoning, alerts, metrics);
        }

        double notional = size * portfolio.getPortfolioValue();
        double units = notional / price;
        double riskAmount = units * price * limits.getStopLossPercent();
        int sign = signal.getDirection().sign();
        reasoning.append(format(" -> %.4f (%s)", size, drivingFactor));

        SizingResult result = SizingResult.builder()
                .symbol(symbol)
                .direction(signal.getDirection())
                .recommendedSize(size)
                .maxAllowedSize(maxAllowed)
                .kellyFraction(kelly)
                .notional(notional)
                .units(units)
                .riskAmount(riskAmount)
                .stopLossPrice(price * (1.0 - sign * limits.getStopLossPercent()))
                .takeProfitPrice(price * (1.0 + sign * limits.getTakeProfitPercent()))
                .drivingFactor(drivingFactor)
                .reasoning(reasoning.toString())
                .alerts(List.copyOf(alerts))
                .metrics(metrics)
                .build();

        log.debug("Sized {} {}: {}", symbol, signal.getDirection(), result.getReasoning());
        return result;
    }

    // ========================
    // PORTFOLIO LIMITS
    // ========================

    public List<RiskAlert> checkRiskLimits(PortfolioSnapshot portfolio) {
        return checkRiskLimits(portfolio, riskCalculator.compute(portfolio, limits.getRiskFreeRate()));
    }

    private List<RiskAlert> checkRiskLimits(PortfolioSnapshot portfolio, PortfolioRiskMetrics metrics) {
        List<RiskAlert> alerts = new ArrayList<>();
        if (portfolio == null || portfolio.getPortfolioValue() <= 0.0) {
            return alerts;
        }

        double lossLimit = -limits.getDailyLossLimit() * portfolio.getPortfolioValue();
        if (portfolio.getDailyPnl() <= lossLimit) {
            alerts.add(RiskAlert.of(
                    AlertLevel.EMERGENCY,
                    AlertType.DAILY_LOSS,
                    format("Daily P&L %.2f breached limit %.2f", portfolio.getDailyPnl(), lossLimit),
                    "Halt new entries; reset required after review",
                    portfolio.getDailyPnl(),
                    lossLimit));
        } else if (portfolio.getDailyPnl() <= lossLimit * limits.getDailyLossWarningThreshold()) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.DAILY_LOSS,
                    format("Daily P&L %.2f approaching limit %.2f", portfolio.getDailyPnl(), lossLimit),
                    "Reduce risk for the rest of the day",
                    portfolio.getDailyPnl(),
                    lossLimit));
        }

        if (metrics.getMaxDrawdown() > limits.getDrawdownAlertThreshold()) {
            alerts.add(RiskAlert.of(
                    AlertLevel.CRITICAL,
                    AlertType.DRAWDOWN,
                    format("Max drawdown %.2f%% above %.2f%%",
                            metrics.getMaxDrawdown() * 100, limits.getDrawdownAlertThreshold() * 100),
                    "Reduce overall exposure",
                    metrics.getMaxDrawdown(),
                    limits.getDrawdownAlertThreshold()));
        }

        if (metrics.getHerfindahlIndex() > limits.getConcentrationAlertThreshold()) {
            alerts.add(RiskAlert.of(
                    AlertLevel.WARNING,
                    AlertType.CONCENTRATION,
                    format("Concentration index %.3f above %.3f",
                            metrics.getHerfindahlIndex(), limits.getConcentrationAlertThreshold()),
                    "Diversify positions",
                    metrics.getHerfindahlIndex(),
                    limits.getConcentrationAlertThreshold()));
        }

        if (metrics.getTotalExposure() > limits.getMaxTotalExposure()) {
            alerts.add(RiskAlert.of(
                    AlertLevel.CRITICAL,
                    AlertType.POSITION_SIZE,
                    format("Total exposure %.3f above cap %.3f", metrics.getTotalExposure(), limits.getMaxTotalExposure()),
                    "Close or reduce positions",
                    metrics.getTotalExposure(),
                    limits.getMaxTotalExposure()));
        }
        return alerts;
    }

    // ========================
    // EMERGENCY LATCH
    // ========================

    public boolean isEmergencyLatched() {
        return emergencyLatched;
    }

    public String getEmergencyReason() {
        return emergencyReason;
    }

    /** Clears the emergency latch. Operator action only. */
    public void resetEmergency() {
        if (emergencyLatched) {
            log.info("Emergency latch reset (was: {})", emergencyReason);
        }
        emergencyLatched = false;
        emergencyReason = null;
    }

    private void latchEmergency(String reason) {
        if (!emergencyLatched) {
            log.warn("Emergency latch set: {}", reason);
        }
        emergencyLatched = true;
        emergencyReason = reason;
    }

    // ========================
    // HELPERS
    // ========================

    /** f = (b·p − q) / b with b = avgWin / avgLoss, clamped at 0. */
    static double kellyFraction(double winProbability, double avgWin, double avgLoss) {
        if (avgWin <= 0.0 || avgLoss == 0.0 || winProbability <= 0.0 || winProbability >= 1.0) {
            return 0.0;
        }
        double b = Math.abs(avgWin / avgLoss);
        double p = winProbability;
        double q = 1.0 - p;
        return Math.max(0.0, (b * p - q) / b);
    }

    private double maxAllowedSize(String symbol, PortfolioSnapshot portfolio) {
        return Math.min(Math.min(symbolHeadroom(symbol, portfolio), singlePositionCap()), totalHeadroom(portfolio));
    }

    private double singlePositionCap() {
        return Math.min(limits.getMaxSinglePosition(), limits.getAbsoluteMaxSinglePosition());
    }

    private double symbolHeadroom(String symbol, PortfolioSnapshot portfolio) {
        double current = portfolio != null ? portfolio.weightOf(symbol) : 0.0;
        if (!Double.isFinite(current)) {
            return 0.0;
        }
        return Math.max(0.0, limits.getMaxSymbolExposure() - current);
    }

    private double totalHeadroom(PortfolioSnapshot portfolio) {
        double current = portfolio != null ? portfolio.totalExposure() : 0.0;
        if (!Double.isFinite(current)) {
            return 0.0;
        }
        return Math.max(0.0, limits.getMaxTotalExposure() - current);
    }

    private static boolean hasNonFinitePosition(PortfolioSnapshot portfolio) {
        return portfolio.getPositions().values().stream()
                .anyMatch(position -> !Double.isFinite(position.marketValue()));
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    public SizingLimits getLimits() {
        return limits;
    }
}
