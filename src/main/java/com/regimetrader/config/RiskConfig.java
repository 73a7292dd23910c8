package com.regimetrader.config;

import com.regimetrader.exception.ConfigurationException;
import com.regimetrader.risk.SizingLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared {@link SizingLimits} bean from application.yml.
 *
 * <p>Every pipeline's sizer reads the same immutable limits. Limits that would make sizing
 * meaningless (non-positive caps, a single-position cap above the absolute ceiling) fail
 * startup.
 *
 * <p>Properties prefix: {@code regimetrader.sizing.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public SizingLimits sizingLimits(
            @Value("${regimetrader.sizing.daily-loss-limit:0.02}") double dailyLossLimit,
            @Value("${regimetrader.sizing.daily-loss-warning-threshold:0.8}") double dailyLossWarningThreshold,
            @Value("${regimetrader.sizing.max-consecutive-losses:5}") int maxConsecutiveLosses,
            @Value("${regimetrader.sizing.min-confidence:0.55}") double minConfidence,
            @Value("${regimetrader.sizing.kelly-fraction:0.25}") double kellyFraction,
            @Value("${regimetrader.sizing.max-single-position:0.05}") double maxSinglePosition,
            @Value("${regimetrader.sizing.absolute-max-single-position:0.10}") double absoluteMaxSinglePosition,
            @Value("${regimetrader.sizing.max-symbol-exposure:0.10}") double maxSymbolExposure,
            @Value("${regimetrader.sizing.max-total-exposure:0.80}") double maxTotalExposure,
            @Value("${regimetrader.sizing.correlation-threshold:0.7}") double correlationThreshold,
            @Value("${regimetrader.sizing.stop-loss-percent:0.03}") double stopLossPercent,
            @Value("${regimetrader.sizing.take-profit-percent:0.06}") double takeProfitPercent,
            @Value("${regimetrader.sizing.risk-free-rate:0.02}") double riskFreeRate,
            @Value("${regimetrader.sizing.drawdown-alert-threshold:0.10}") double drawdownAlertThreshold,
            @Value("${regimetrader.sizing.concentration-alert-threshold:0.25}") double concentrationAlertThreshold) {
        SizingLimits limits = SizingLimits.builder()
                .dailyLossLimit(dailyLossLimit)
                .dailyLossWarningThreshold(dailyLossWarningThreshold)
                .maxConsecutiveLosses(maxConsecutiveLosses)
                .minConfidence(minConfidence)
                .kellyFraction(kellyFraction)
                .maxSinglePosition(maxSinglePosition)
                .absoluteMaxSinglePosition(absoluteMaxSinglePosition)
                .maxSymbolExposure(maxSymbolExposure)
                .maxTotalExposure(maxTotalExposure)
                .correlationThreshold(correlationThreshold)
                .stopLossPercent(stopLossPercent)
                .takeProfitPercent(takeProfitPercent)
                .riskFreeRate(riskFreeRate)
                .drawdownAlertThreshold(drawdownAlertThreshold)
                .concentrationAlertThreshold(concentrationAlertThreshold)
                .build();
        validate(limits);
        return limits;
    }

    static void validate(SizingLimits limits) {
        requireFraction("daily-loss-limit", limits.getDailyLossLimit());
        requireFraction("daily-loss-warning-threshold", limits.getDailyLossWarningThreshold());
        requireFraction("kelly-fraction", limits.getKellyFraction());
        requireFraction("max-single-position", limits.getMaxSinglePosition());
        requireFraction("absolute-max-single-position", limits.getAbsoluteMaxSinglePosition());
        requireFraction("max-symbol-exposure", limits.getMaxSymbolExposure());
        requireFraction("max-total-exposure", limits.getMaxTotalExposure());
        requireFraction("stop-loss-percent", limits.getStopLossPercent());
        if (limits.getMaxConsecutiveLosses() < 1) {
            throw new ConfigurationException("regimetrader.sizing.max-consecutive-losses must be at least 1");
        }
        if (!(limits.getMinConfidence() >= 0.0 && limits.getMinConfidence() <= 1.0)) {
            throw new ConfigurationException("regimetrader.sizing.min-confidence must be within [0, 1]");
        }
        if (limits.getMaxSinglePosition() > limits.getAbsoluteMaxSinglePosition()) {
            throw new ConfigurationException(
                    "regimetrader.sizing.max-single-position exceeds absolute-max-single-position");
        }
    }

    private static void requireFraction(String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new ConfigurationException("regimetrader.sizing." + name + " must be within (0, 1] but was " + value);
        }
    }
}
