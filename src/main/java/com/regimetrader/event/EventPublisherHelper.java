package com.regimetrader.event;

import com.regimetrader.canary.CanaryState;
import com.regimetrader.execution.ExecutionPlan;
import com.regimetrader.execution.OrderIntent;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the pipeline's
 * events.
 *
 * <p>All methods are non-blocking. Delivery depends on the listener: synchronous
 * {@code @EventListener} or {@code @Async @EventListener}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source,
            String symbol,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, symbol, eventType, level, message, details));
    }

    public void publishEmergencyReset(Object source, String symbol, String previousReason) {
        applicationEventPublisher.publishEvent(new RiskEvent(
                source,
                symbol,
                RiskEventType.EMERGENCY_RESET,
                RiskLevel.INFO,
                "Emergency latch cleared",
                previousReason != null ? Map.of("previousReason", previousReason) : null));
    }

    // ---- Canary ----

    public void publishCanaryEvent(
            Object source,
            String symbol,
            CanaryEventType eventType,
            CanaryState previousState,
            CanaryState newState,
            String reason) {
        applicationEventPublisher.publishEvent(
                new CanaryEvent(source, symbol, eventType, previousState, newState, reason));
    }

    // ---- Regime ----

    public void publishRegimeShift(
            Object source, String symbol, int previousRegime, int newRegime, String newRegimeName, double probability) {
        applicationEventPublisher.publishEvent(
                new RegimeShiftEvent(source, symbol, previousRegime, newRegime, newRegimeName, probability));
    }

    // ---- Execution ----

    public void publishExecutionPlan(Object source, OrderIntent order, ExecutionPlan plan) {
        applicationEventPublisher.publishEvent(new ExecutionPlanEvent(source, order, plan));
    }
}
