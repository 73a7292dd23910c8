package com.regimetrader.domain.enums;

/**
 * Identifies which pipeline stage produced a decision log entry.
 *
 * <p>Every automated decision is tagged with its source so an operator can filter
 * the decision log by stage (e.g., only POSITION_SIZER to review why a signal
 * was sized to zero, or only CANARY to trace promotions and rollbacks).
 */
public enum DecisionSource {
    REGIME_DETECTOR,
    STRATEGY_ROUTER,
    POSITION_SIZER,
    EXECUTION_ROUTER,
    CANARY,
    PIPELINE_ENGINE,
    SYSTEM
}
