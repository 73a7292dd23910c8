package com.regimetrader.domain.enums;

/**
 * Severity level for decision log entries. DEBUG is used for routine per-tick
 * evaluations, CRITICAL for halts and emergency latches.
 */
public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING,
    CRITICAL
}
