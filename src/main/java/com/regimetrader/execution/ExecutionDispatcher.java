package com.regimetrader.execution;

import com.regimetrader.event.ExecutionPlanEvent;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards execution plans to the {@link OrderGateway} off the tick thread.
 *
 * <p>Runs on the {@code eventExecutor} pool and waits at most the configured submit timeout
 * for the gateway's acknowledgement. Failures and timeouts are logged; they never reach the
 * pipeline that produced the plan.
 */
@Component
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final OrderGateway orderGateway;
    private final long submitTimeoutMs;

    public ExecutionDispatcher(
            OrderGateway orderGateway,
            @Value("${regimetrader.execution.submit-timeout-ms:2000}") long submitTimeoutMs) {
        this.orderGateway = orderGateway;
        this.submitTimeoutMs = submitTimeoutMs;
    }

    @Async("eventExecutor")
    @EventListener
    public void onExecutionPlan(ExecutionPlanEvent event) {
        dispatch(event.getOrder(), event.getPlan());
    }

    /**
     * Submits and waits for the acknowledgement.
     *
     * @return the venue order id, or null when the plan halts or the submission failed
     */
    public String dispatch(OrderIntent order, ExecutionPlan plan) {
        if (plan.isHalt()) {
            log.debug("Not dispatching halted plan for {}: {}", order.getSymbol(), plan.getReason());
            return null;
        }

        CompletableFuture<String> future;
        try {
            future = orderGateway.submit(order, plan);
        } catch (RuntimeException e) {
            log.error("Order gateway rejected {} {}: {}", order.getSide(), order.getSymbol(), e.getMessage(), e);
            return null;
        }

        try {
            String orderId = future.get(submitTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Order for {} acknowledged as {}", order.getSymbol(), orderId);
            return orderId;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Order submission for {} timed out after {}ms", order.getSymbol(), submitTimeoutMs);
        } catch (ExecutionException e) {
            log.error("Order submission for {} failed: {}", order.getSymbol(), e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while submitting order for {}", order.getSymbol());
        }
        return null;
    }
}
