package com.regimetrader.execution;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link OrderGateway}: records the plan in the log and acknowledges immediately.
 * Used for shadow runs and whenever no exchange adapter is wired.
 */
@Component
public class LoggingOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingOrderGateway.class);

    @Override
    public CompletableFuture<String> submit(OrderIntent order, ExecutionPlan plan) {
        String orderId = "log-" + UUID.randomUUID();
        log.info(
                "Order {} {} {} size={} via {} (fallback {}): {}",
                orderId,
                order.getSide(),
                order.getSymbol(),
                order.getSizePct(),
                plan.getPrimary().getType(),
                plan.getFallback() != null ? plan.getFallback().getType() : "none",
                plan.getReason());
        return CompletableFuture.completedFuture(orderId);
    }
}
