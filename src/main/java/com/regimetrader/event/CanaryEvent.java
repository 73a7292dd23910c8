package com.regimetrader.event;

import com.regimetrader.canary.CanaryState;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every canary state transition and circuit-breaker change.
 * For circuit-breaker events the previous and new state are equal.
 */
public class CanaryEvent extends ApplicationEvent {

    private final String symbol;
    private final CanaryEventType eventType;
    private final CanaryState previousState;
    private final CanaryState newState;
    private final String reason;

    public CanaryEvent(
            Object source,
            String symbol,
            CanaryEventType eventType,
            CanaryState previousState,
            CanaryState newState,
            String reason) {
        super(source);
        this.symbol = symbol;
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.reason = reason;
    }

    public String getSymbol() {
        return symbol;
    }

    public CanaryEventType getEventType() {
        return eventType;
    }

    public CanaryState getPreviousState() {
        return previousState;
    }

    public CanaryState getNewState() {
        return newState;
    }

    public String getReason() {
        return reason;
    }
}
