package com.regimetrader.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the position sizer raises an alert or its emergency latch changes.
 *
 * <p>Carries the pipeline symbol, the condition type, a severity level, a human-readable
 * message and a details map (e.g. current value and configured threshold).
 */
public class RiskEvent extends ApplicationEvent {

    private final String symbol;
    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, String symbol, RiskEventType eventType, RiskLevel level, String message) {
        this(source, symbol, eventType, level, message, null);
    }

    public RiskEvent(
            Object source,
            String symbol,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        super(source);
        this.symbol = symbol;
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public String getSymbol() {
        return symbol;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
