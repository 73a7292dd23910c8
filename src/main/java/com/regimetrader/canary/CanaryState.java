package com.regimetrader.canary;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Rollout stages and the fraction of live capital each one lets through.
 *
 * <p>Stages are ordered: DISABLED → CANARY → PARTIAL → LIVE. LIVE is terminal.
 */
@Getter
@RequiredArgsConstructor
public enum CanaryState {
    DISABLED(0.0),
    CANARY(0.01),
    PARTIAL(0.10),
    LIVE(1.0);

    private final double weight;

    /** The stage an automatic promotion moves to, or null at LIVE. */
    public CanaryState next() {
        return switch (this) {
            case DISABLED -> CANARY;
            case CANARY -> PARTIAL;
            case PARTIAL -> LIVE;
            case LIVE -> null;
        };
    }

    public boolean isTerminal() {
        return this == LIVE;
    }

    public boolean isBelow(CanaryState other) {
        return ordinal() < other.ordinal();
    }
}
