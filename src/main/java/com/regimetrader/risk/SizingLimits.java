package com.regimetrader.risk;

import lombok.Builder;
import lombok.Data;

/**
 * Hard limits and parameters of the position sizer. All sizes and exposures are
 * fractions of portfolio value.
 *
 * <p>Built from {@code regimetrader.sizing.*} by {@link com.regimetrader.config.RiskConfig}.
 */
@Data
@Builder
public class SizingLimits {

    /** Daily loss, as a fraction of portfolio value, that trips the emergency latch. */
    @Builder.Default
    private double dailyLossLimit = 0.02;

    /** Fraction of the daily loss limit at which a warning is raised. */
    @Builder.Default
    private double dailyLossWarningThreshold = 0.8;

    @Builder.Default
    private int maxConsecutiveLosses = 5;

    @Builder.Default
    private double minConfidence = 0.55;

    /** Fractional Kelly multiplier (quarter-Kelly by default). */
    @Builder.Default
    private double kellyFraction = 0.25;

    @Builder.Default
    private double maxSinglePosition = 0.05;

    /** Absolute ceiling on any single position, regardless of configuration above. */
    @Builder.Default
    private double absoluteMaxSinglePosition = 0.10;

    @Builder.Default
    private double maxSymbolExposure = 0.10;

    @Builder.Default
    private double maxTotalExposure = 0.80;

    @Builder.Default
    private double correlationThreshold = 0.7;

    @Builder.Default
    private double stopLossPercent = 0.03;

    @Builder.Default
    private double takeProfitPercent = 0.06;

    @Builder.Default
    private double riskFreeRate = 0.02;

    @Builder.Default
    private double drawdownAlertThreshold = 0.10;

    @Builder.Default
    private double concentrationAlertThreshold = 0.25;
}
