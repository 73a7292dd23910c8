package com.regimetrader.event;

public enum CanaryEventType {
    ENABLED,
    PROMOTED,
    ROLLED_BACK,
    CIRCUIT_BREAKER_TRIPPED,
    CIRCUIT_BREAKER_CLEARED
}
