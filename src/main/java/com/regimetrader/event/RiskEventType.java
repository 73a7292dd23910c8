package com.regimetrader.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Daily loss has reached the warning fraction of its limit. */
    DAILY_LOSS_LIMIT_APPROACH,

    /** Daily loss has reached the limit; the sizer latches. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Consecutive losing trades reached the configured limit. */
    CONSECUTIVE_LOSS_LIMIT,

    /** Portfolio drawdown or total exposure is beyond its alert threshold. */
    PORTFOLIO_LIMIT_BREACH,

    /** A soft sizing adjustment (volatility, correlation, concentration, cap) was applied. */
    SIZING_ADJUSTED,

    /** The sizer's emergency latch was cleared by an operator. */
    EMERGENCY_RESET
}
