package com.regimetrader.execution;

/**
 * The closed set of execution styles. HALT is a refusal to trade, not a smaller order.
 */
public enum ExecutionType {
    LIMIT,
    TWAP,
    VWAP,
    ICEBERG,
    HALT
}
