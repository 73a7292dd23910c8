package com.regimetrader.execution;

import java.util.concurrent.CompletableFuture;

/**
 * Hand-off point to the exchange side. Implementations must not block the caller; the
 * returned future completes with the venue-assigned order id.
 *
 * <p>Only {@link LoggingOrderGateway} ships here. Exchange connectivity lives outside this
 * service and plugs in as a {@code @Primary} bean of this type.
 */
public interface OrderGateway {

    /**
     * Submits an order to be worked according to the plan.
     *
     * @param order the canary-weighted order
     * @param plan  a non-halted execution plan
     * @return future of the venue order id
     */
    CompletableFuture<String> submit(OrderIntent order, ExecutionPlan plan);
}
