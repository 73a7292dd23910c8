package com.regimetrader.domain.enums;

/**
 * The result of a decision evaluation.
 *
 * <ul>
 *   <li>TRIGGERED -- action was taken (order sized, plan routed, state promoted)</li>
 *   <li>SKIPPED -- evaluated, nothing to do (flat signal, disabled canary)</li>
 *   <li>REJECTED -- blocked by a gate (risk limit, halt, emergency latch)</li>
 *   <li>FAILED -- attempted but failed (external hand-off error)</li>
 *   <li>INFO -- informational, no action involved</li>
 * </ul>
 */
public enum DecisionOutcome {
    TRIGGERED,
    SKIPPED,
    REJECTED,
    FAILED,
    INFO
}
