package com.regimetrader.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for state changes that need no action (e.g. an emergency reset), WARNING for
 * thresholds being approached or soft caps applied, CRITICAL for breaches that block sizing.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
