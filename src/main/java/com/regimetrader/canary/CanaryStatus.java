package com.regimetrader.canary;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Operator-facing view of a canary controller.
 *
 * <p>{@code requirements} lists what still blocks the next promotion, in a fixed order:
 * trade count, win rate, drawdown, P&L, CVaR, circuit breaker.
 */
@Value
@Builder
public class CanaryStatus {

    CanaryState state;
    double weight;
    CanaryMetrics metrics;

    /** Criteria for leaving the current state; null for DISABLED and LIVE. */
    CanaryCriteria criteria;

    boolean promotionEligible;
    List<String> requirements;
    boolean circuitBreakerActive;
    String circuitBreakerReason;
    Instant lastStateChange;
    List<CanaryTransition> history;
}
