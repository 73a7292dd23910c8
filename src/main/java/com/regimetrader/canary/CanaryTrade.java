package com.regimetrader.canary;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A realized trade reported by the fill subsystem. A trade with {@code pnl > 0} counts as a win.
 *
 * <p>{@code policyId} names the policy whose signal opened the trade, when known; the
 * pipeline uses it to credit the reward to that policy.
 */
@Value
@Builder
public class CanaryTrade {

    String tradeId;
    String symbol;
    String policyId;
    double pnl;
    Instant closedAt;

    public boolean isWin() {
        return pnl > 0.0;
    }
}
