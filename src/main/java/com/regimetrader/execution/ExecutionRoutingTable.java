package com.regimetrader.execution;

import static com.regimetrader.execution.ExecutionType.HALT;
import static com.regimetrader.execution.ExecutionType.ICEBERG;
import static com.regimetrader.execution.ExecutionType.LIMIT;
import static com.regimetrader.execution.ExecutionType.TWAP;
import static com.regimetrader.execution.ExecutionType.VWAP;

import java.util.EnumMap;
import java.util.Map;

/**
 * Deterministic execution-style table keyed by uncertainty bucket, liquidity tier and
 * volatility bucket.
 *
 * <p>Rows are liquidity tiers 1..3, columns are CALM, NORMAL, ELEVATED, EXTREME volatility.
 * Styles only get more conservative moving down or right, and every EXTREME-uncertainty cell
 * on tier 3 is HALT.
 */
public final class ExecutionRoutingTable {

    private static final Map<UncertaintyBucket, ExecutionType[][]> TABLE = new EnumMap<>(UncertaintyBucket.class);

    static {
        TABLE.put(UncertaintyBucket.LOW, new ExecutionType[][] {
            {LIMIT, LIMIT, TWAP, TWAP},
            {LIMIT, TWAP, TWAP, VWAP},
            {TWAP, TWAP, ICEBERG, ICEBERG}
        });
        TABLE.put(UncertaintyBucket.MEDIUM, new ExecutionType[][] {
            {LIMIT, TWAP, VWAP, VWAP},
            {TWAP, TWAP, VWAP, ICEBERG},
            {TWAP, ICEBERG, ICEBERG, HALT}
        });
        TABLE.put(UncertaintyBucket.HIGH, new ExecutionType[][] {
            {TWAP, VWAP, VWAP, ICEBERG},
            {VWAP, VWAP, ICEBERG, ICEBERG},
            {ICEBERG, ICEBERG, ICEBERG, HALT}
        });
        TABLE.put(UncertaintyBucket.EXTREME, new ExecutionType[][] {
            {VWAP, ICEBERG, ICEBERG, HALT},
            {ICEBERG, ICEBERG, HALT, HALT},
            {HALT, HALT, HALT, HALT}
        });
    }

    private ExecutionRoutingTable() {}

    /**
     * @param liquidityTier 1..3; callers normalize out-of-range tiers before looking up
     */
    public static ExecutionType lookup(UncertaintyBucket uncertainty, int liquidityTier, VolatilityBucket volatility) {
        return TABLE.get(uncertainty)[liquidityTier - 1][volatility.ordinal()];
    }
}
