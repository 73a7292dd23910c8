package com.regimetrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * Structured risk alert attached to sizing results and portfolio checks.
 * {@code action} is the recommended operator response.
 */
@Getter
@Builder
public class RiskAlert {

    private final AlertLevel level;
    private final AlertType type;
    private final String message;
    private final String action;
    private final double value;
    private final double threshold;

    public static RiskAlert of(AlertLevel level, AlertType type, String message, String action) {
        return RiskAlert.builder()
                .level(level)
                .type(type)
                .message(message)
                .action(action)
                .build();
    }

    public static RiskAlert of(
            AlertLevel level, AlertType type, String message, String action, double value, double threshold) {
        return RiskAlert.builder()
                .level(level)
                .type(type)
                .message(message)
                .action(action)
                .value(value)
                .threshold(threshold)
                .build();
    }

    @Override
    public String toString() {
        return level + "/" + type + ": " + message;
    }
}
