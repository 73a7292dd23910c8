package com.regimetrader.execution;

import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Chooses an execution style for a sized order.
 *
 * <p>{@link #routeOrder} is a pure function of its arguments: it reads nothing but the
 * static {@link ExecutionRoutingTable}, so identical inputs always give an equal plan and a
 * single instance is shared by every pipeline.
 *
 * <p>Routing steps:
 * <ol>
 *   <li>Refuse (HALT) unusable input: non-positive size, non-finite spread, uncertainty or
 *       volatility, a tier outside 1..3</li>
 *   <li>Effective tier = worse of the reported tier and the tier implied by book depth</li>
 *   <li>Table lookup on (uncertainty bucket, effective tier, volatility bucket)</li>
 *   <li>LIMIT with a wide spread is worked as TWAP instead</li>
 *   <li>Attach the child schedule, slippage estimate and fallback</li>
 * </ol>
 */
@Component
public class ExecutionRouter {

    static final double WIDE_SPREAD_BPS = 20.0;
    static final double THIN_DEPTH_USD = 50_000.0;
    static final double NORMAL_DEPTH_USD = 500_000.0;

    public ExecutionPlan routeOrder(OrderIntent order, MarketConditions conditions, double uncertainty) {
        String symbol = order != null ? order.getSymbol() : null;
        UncertaintyBucket uncertaintyBucket = UncertaintyBucket.of(uncertainty);
        VolatilityBucket volatilityBucket =
                VolatilityBucket.of(conditions != null ? conditions.getVolatilityPct() : Double.NaN);

        // 1. Refusals
        if (order == null || !Double.isFinite(order.getSizePct()) || order.getSizePct() <= 0.0) {
            return halt(symbol, uncertaintyBucket, volatilityBucket, 3, "nothing to execute: non-positive size");
        }
        if (conditions == null || !Double.isFinite(conditions.getSpreadBps()) || conditions.getSpreadBps() < 0.0) {
            return halt(symbol, uncertaintyBucket, volatilityBucket, 3, "market conditions unusable");
        }
        if (!Double.isFinite(uncertainty) || !Double.isFinite(conditions.getVolatilityPct())) {
            return halt(symbol, uncertaintyBucket, volatilityBucket, 3, "non-finite uncertainty or volatility");
        }
        if (conditions.getLiquidityTier() < 1 || conditions.getLiquidityTier() > 3) {
            return halt(
                    symbol,
                    uncertaintyBucket,
                    volatilityBucket,
                    3,
                    "unknown liquidity tier " + conditions.getLiquidityTier());
        }

        // 2. Effective liquidity tier
        int tier = effectiveTier(conditions);

        // 3. Table lookup
        ExecutionType type = ExecutionRoutingTable.lookup(uncertaintyBucket, tier, volatilityBucket);
        String reason = String.format(
                Locale.ROOT,
                "uncertainty %s (%.3f), tier %d, volatility %s (%.2f%%) -> %s",
                uncertaintyBucket,
                uncertainty,
                tier,
                volatilityBucket,
                conditions.getVolatilityPct(),
                type);

        if (type == ExecutionType.HALT) {
            return halt(symbol, uncertaintyBucket, volatilityBucket, tier, "circuit breaker: " + reason);
        }

        // 4. Wide spread
        if (type == ExecutionType.LIMIT && conditions.getSpreadBps() > WIDE_SPREAD_BPS) {
            type = ExecutionType.TWAP;
            reason += String.format(Locale.ROOT, ", spread %.1fbps too wide for LIMIT -> TWAP", conditions.getSpreadBps());
        }

        // 5. Schedule and fallback
        ExecutionInstruction primary = instruction(type, order.getSizePct(), tier, volatilityBucket, conditions);
        ExecutionInstruction fallback = fallbackFor(type)
                .map(t -> instruction(t, order.getSizePct(), tier, volatilityBucket, conditions))
                .orElse(null);

        return ExecutionPlan.builder()
                .symbol(symbol)
                .primary(primary)
                .fallback(fallback)
                .uncertaintyBucket(uncertaintyBucket)
                .volatilityBucket(volatilityBucket)
                .effectiveLiquidityTier(tier)
                .reason(reason)
                .build();
    }

    // ---- Helpers ----

    static int effectiveTier(MarketConditions conditions) {
        int reported = Math.min(3, Math.max(1, conditions.getLiquidityTier()));
        double depth = conditions.getDepthUsd();
        int depthTier;
        if (!Double.isFinite(depth) || depth < THIN_DEPTH_USD) {
            depthTier = 3;
        } else if (depth < NORMAL_DEPTH_USD) {
            depthTier = 2;
        } else {
            depthTier = 1;
        }
        return Math.max(reported, depthTier);
    }

    private static Optional<ExecutionType> fallbackFor(ExecutionType type) {
        return switch (type) {
            case LIMIT, VWAP, ICEBERG -> Optional.of(ExecutionType.TWAP);
            case TWAP, HALT -> Optional.empty();
        };
    }

    private static ExecutionInstruction instruction(
            ExecutionType type, double sizePct, int tier, VolatilityBucket volatility, MarketConditions conditions) {
        return ExecutionInstruction.builder()
                .type(type)
                .schedule(schedule(type, sizePct, tier, volatility))
                .expectedSlippageBps(expectedSlippageBps(type, conditions))
                .build();
    }

    static ChildSchedule schedule(ExecutionType type, double sizePct, int tier, VolatilityBucket volatility) {
        int liquidityMultiplier = tier == 3 ? 2 : 1;
        return switch (type) {
            case TWAP -> {
                boolean calm = volatility == VolatilityBucket.CALM || volatility == VolatilityBucket.NORMAL;
                int slices = (calm ? 5 : 10) * liquidityMultiplier;
                yield ChildSchedule.builder()
                        .slices(slices)
                        .durationMinutes(calm ? 15 : 30)
                        .sliceSizePct(sizePct / slices)
                        .build();
            }
            case VWAP -> {
                int slices = 8 * liquidityMultiplier;
                yield ChildSchedule.builder()
                        .slices(slices)
                        .durationMinutes(20)
                        .sliceSizePct(sizePct / slices)
                        .build();
            }
            case ICEBERG -> {
                double visible = tier == 3 ? 0.1 : 0.2;
                int slices = (int) Math.round(1.0 / visible);
                yield ChildSchedule.builder()
                        .slices(slices)
                        .durationMinutes(30)
                        .sliceSizePct(sizePct * visible)
                        .visibleFraction(visible)
                        .build();
            }
            case LIMIT, HALT -> null;
        };
    }

    /** Half the spread plus a style-dependent share of volatility (in bps). */
    static double expectedSlippageBps(ExecutionType type, MarketConditions conditions) {
        double volatilityBps = Double.isFinite(conditions.getVolatilityPct()) ? conditions.getVolatilityPct() : 0.0;
        double factor =
                switch (type) {
                    case LIMIT -> 0.5;
                    case TWAP -> 1.0;
                    case VWAP -> 0.8;
                    case ICEBERG -> 1.2;
                    case HALT -> 0.0;
                };
        return type == ExecutionType.HALT ? 0.0 : conditions.getSpreadBps() * 0.5 + volatilityBps * factor;
    }

    private static ExecutionPlan halt(
            String symbol, UncertaintyBucket uncertainty, VolatilityBucket volatility, int tier, String reason) {
        return ExecutionPlan.builder()
                .symbol(symbol)
                .primary(ExecutionInstruction.builder()
                        .type(ExecutionType.HALT)
                        .build())
                .uncertaintyBucket(uncertainty)
                .volatilityBucket(volatility)
                .effectiveLiquidityTier(tier)
                .reason(reason)
                .build();
    }
}
