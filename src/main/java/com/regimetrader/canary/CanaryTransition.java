package com.regimetrader.canary;

import java.time.Instant;
import lombok.Value;

/**
 * One entry of the rollout history. {@code automatic} is true only for criteria-driven promotions.
 */
@Value
public class CanaryTransition {

    CanaryState from;
    CanaryState to;
    String reason;
    boolean automatic;
    Instant at;
}
