package com.regimetrader.domain.enums;

/**
 * Classifies the specific kind of pipeline decision that was made.
 *
 * <p>Grouped by stage:
 * <ul>
 *   <li>REGIME_* -- filter updates and dominant-regime changes</li>
 *   <li>POLICY_* -- bandit selection and reward updates</li>
 *   <li>SIZING_* -- position sizer outcomes and emergency latch handling</li>
 *   <li>EXECUTION_* -- execution style selection</li>
 *   <li>CANARY_* -- rollout state machine transitions</li>
 * </ul>
 */
public enum DecisionType {
    // Regime detector
    REGIME_UPDATED,
    REGIME_SHIFT,
    REGIME_DEGRADED,
    REGIME_RESET,

    // Strategy router
    POLICY_CHOSEN,
    POLICY_UPDATED,

    // Position sizer
    SIZING_APPROVED,
    SIZING_REJECTED,
    SIZING_EMERGENCY_RESET,

    // Execution router
    EXECUTION_ROUTED,
    EXECUTION_HALTED,

    // Canary
    CANARY_ENABLED,
    CANARY_PROMOTED,
    CANARY_ROLLED_BACK,
    CANARY_CIRCUIT_BREAKER,

    // Engine
    PIPELINE_REGISTERED
}
