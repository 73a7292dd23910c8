package com.regimetrader.risk;

/**
 * Severity of a {@link RiskAlert}.
 *
 * <p>WARNING and CRITICAL are reported alongside a sizing decision. EMERGENCY additionally
 * latches the sizer: no further sizing until an explicit reset.
 */
public enum AlertLevel {
    WARNING,
    CRITICAL,
    EMERGENCY
}
