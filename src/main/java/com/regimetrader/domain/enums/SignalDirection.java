package com.regimetrader.domain.enums;

/**
 * Direction of a trading signal emitted by a policy.
 */
public enum SignalDirection {
    LONG,
    SHORT,
    FLAT;

    /** +1 for LONG, -1 for SHORT, 0 for FLAT. */
    public int sign() {
        return switch (this) {
            case LONG -> 1;
            case SHORT -> -1;
            case FLAT -> 0;
        };
    }
}
