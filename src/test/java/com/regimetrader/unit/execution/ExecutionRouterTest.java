package com.regimetrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.execution.ChildSchedule;
import com.regimetrader.execution.ExecutionPlan;
import com.regimetrader.execution.ExecutionRouter;
import com.regimetrader.execution.ExecutionRoutingTable;
import com.regimetrader.execution.ExecutionType;
import com.regimetrader.execution.MarketConditions;
import com.regimetrader.execution.OrderIntent;
import com.regimetrader.execution.RequestedOrderType;
import com.regimetrader.execution.UncertaintyBucket;
import com.regimetrader.execution.VolatilityBucket;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionRouterTest {

    private final ExecutionRouter router = new ExecutionRouter();

    private static OrderIntent order(double sizePct) {
        return OrderIntent.builder()
                .symbol("BTC-USD")
                .side(OrderSide.BUY)
                .sizePct(sizePct)
                .type(RequestedOrderType.MARKET)
                .build();
    }

    private static MarketConditions conditions(double spreadBps, double depthUsd, double volatilityPct, int tier) {
        return MarketConditions.builder()
                .spreadBps(spreadBps)
                .depthUsd(depthUsd)
                .volatilityPct(volatilityPct)
                .liquidityTier(tier)
                .build();
    }

    private static MarketConditions deepCalm() {
        return conditions(5.0, 2_000_000.0, 1.0, 1);
    }

    // ==============================
    // CIRCUIT BREAKER
    // ==============================

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreaker {

        @Test
        @DisplayName("Extreme uncertainty on a thin, volatile market halts")
        void extremeUncertaintyThinMarket_halts() {
            ExecutionPlan plan = router.routeOrder(order(0.05), conditions(15.0, 20_000.0, 25.0, 3), 0.9);

            assertThat(plan.getPrimary().getType()).isEqualTo(ExecutionType.HALT);
            assertThat(plan.isHalt()).isTrue();
            assertThat(plan.getFallback()).isNull();
            assertThat(plan.getPrimary().getSchedule()).isNull();
            assertThat(plan.getReason()).startsWith("circuit breaker");
        }

        @Test
        @DisplayName("Unusable inputs are refused with HALT instead of throwing")
        void unusableInputs_halt() {
            assertThat(router.routeOrder(order(0.0), deepCalm(), 0.1).isHalt()).isTrue();
            assertThat(router.routeOrder(order(Double.NaN), deepCalm(), 0.1).isHalt()).isTrue();
            assertThat(router.routeOrder(null, deepCalm(), 0.1).isHalt()).isTrue();
            assertThat(router.routeOrder(order(0.05), null, 0.1).isHalt()).isTrue();
            assertThat(router.routeOrder(order(0.05), deepCalm(), Double.NaN).isHalt()).isTrue();
            assertThat(router.routeOrder(order(0.05), conditions(-1.0, 2_000_000.0, 1.0, 1), 0.1).isHalt())
                    .isTrue();
            assertThat(router.routeOrder(order(0.05), conditions(5.0, 2_000_000.0, Double.NaN, 1), 0.1).isHalt())
                    .isTrue();
            assertThat(router.routeOrder(order(0.05), conditions(5.0, 2_000_000.0, 1.0, 4), 0.1).getReason())
                    .contains("unknown liquidity tier 4");
        }
    }

    // ==============================
    // ROUTING
    // ==============================

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("Calm deep market with low uncertainty gets a LIMIT order with TWAP fallback")
        void calmDeep_limit() {
            ExecutionPlan plan = router.routeOrder(order(0.05), deepCalm(), 0.1);

            assertThat(plan.getPrimary().getType()).isEqualTo(ExecutionType.LIMIT);
            assertThat(plan.getPrimary().getSchedule()).isNull();
            assertThat(plan.getPrimary().getExpectedSlippageBps()).isCloseTo(3.0, within(1e-12));
            assertThat(plan.getFallback().getType()).isEqualTo(ExecutionType.TWAP);
            assertThat(plan.getFallback().getSchedule().getSlices()).isEqualTo(5);
            assertThat(plan.getUncertaintyBucket()).isEqualTo(UncertaintyBucket.LOW);
            assertThat(plan.getVolatilityBucket()).isEqualTo(VolatilityBucket.CALM);
            assertThat(plan.getEffectiveLiquidityTier()).isEqualTo(1);
        }

        @Test
        @DisplayName("Wide spread turns LIMIT into TWAP")
        void wideSpread_twap() {
            ExecutionPlan plan = router.routeOrder(order(0.05), conditions(30.0, 2_000_000.0, 1.0, 1), 0.1);

            assertThat(plan.getPrimary().getType()).isEqualTo(ExecutionType.TWAP);
            assertThat(plan.getFallback()).isNull();
            assertThat(plan.getReason()).contains("too wide for LIMIT");
        }

        @Test
        @DisplayName("Thin book depth downgrades a reported tier-1 market")
        void thinDepth_downgradesTier() {
            ExecutionPlan normalDepth = router.routeOrder(order(0.05), conditions(5.0, 100_000.0, 3.0, 1), 0.1);
            ExecutionPlan thinDepth = router.routeOrder(order(0.05), conditions(5.0, 10_000.0, 3.0, 1), 0.1);

            assertThat(normalDepth.getEffectiveLiquidityTier()).isEqualTo(2);
            assertThat(normalDepth.getPrimary().getType()).isEqualTo(ExecutionType.TWAP);
            assertThat(thinDepth.getEffectiveLiquidityTier()).isEqualTo(3);
            assertThat(thinDepth.getPrimary().getSchedule().getSlices()).isEqualTo(10);
            assertThat(thinDepth.getPrimary().getSchedule().getDurationMinutes()).isEqualTo(15);
        }

        @Test
        @DisplayName("Iceberg on thin markets shows a tenth at a time and falls back to a slow TWAP")
        void iceberg_schedule() {
            ExecutionPlan plan = router.routeOrder(order(0.05), conditions(10.0, 10_000.0, 10.0, 3), 0.1);

            assertThat(plan.getPrimary().getType()).isEqualTo(ExecutionType.ICEBERG);
            ChildSchedule schedule = plan.getPrimary().getSchedule();
            assertThat(schedule.getVisibleFraction()).isEqualTo(0.1);
            assertThat(schedule.getSlices()).isEqualTo(10);
            assertThat(schedule.getSliceSizePct()).isCloseTo(0.005, within(1e-12));

            ChildSchedule fallback = plan.getFallback().getSchedule();
            assertThat(plan.getFallback().getType()).isEqualTo(ExecutionType.TWAP);
            assertThat(fallback.getSlices()).isEqualTo(20);
            assertThat(fallback.getDurationMinutes()).isEqualTo(30);
        }

        @Test
        @DisplayName("VWAP splits into eight slices over twenty minutes")
        void vwap_schedule() {
            ExecutionPlan plan = router.routeOrder(order(0.04), conditions(10.0, 200_000.0, 20.0, 2), 0.1);

            assertThat(plan.getPrimary().getType()).isEqualTo(ExecutionType.VWAP);
            assertThat(plan.getPrimary().getSchedule().getSlices()).isEqualTo(8);
            assertThat(plan.getPrimary().getSchedule().getDurationMinutes()).isEqualTo(20);
            assertThat(plan.getPrimary().getSchedule().getSliceSizePct()).isCloseTo(0.005, within(1e-12));
        }

        @Test
        @DisplayName("Identical inputs always produce an equal plan")
        void routeOrder_isPure() {
            Well19937c random = new Well19937c(99L);
            for (int i = 0; i < 200; i++) {
                OrderIntent order = order(random.nextDouble() * 0.1);
                MarketConditions conditions = conditions(
                        random.nextDouble() * 40.0,
                        random.nextDouble() * 1_000_000.0,
                        random.nextDouble() * 30.0,
                        1 + random.nextInt(3));
                double uncertainty = random.nextDouble();

                ExecutionPlan first = router.routeOrder(order, conditions, uncertainty);
                ExecutionPlan second = new ExecutionRouter().routeOrder(order, conditions, uncertainty);

                assertThat(second).isEqualTo(first);
            }
        }
    }

    // ==============================
    // TABLE
    // ==============================

    @Nested
    @DisplayName("Routing table")
    class Table {

        @Test
        @DisplayName("Styles never get less conservative with more uncertainty, thinner books or more volatility")
        void table_isMonotonic() {
            for (UncertaintyBucket u : UncertaintyBucket.values()) {
                for (int tier = 1; tier <= 3; tier++) {
                    for (VolatilityBucket v : VolatilityBucket.values()) {
                        int cell = ExecutionRoutingTable.lookup(u, tier, v).ordinal();
                        if (tier < 3) {
                            assertThat(ExecutionRoutingTable.lookup(u, tier + 1, v).ordinal())
                                    .isGreaterThanOrEqualTo(cell);
                        }
                        if (v.ordinal() < 3) {
                            VolatilityBucket higher = VolatilityBucket.values()[v.ordinal() + 1];
                            assertThat(ExecutionRoutingTable.lookup(u, tier, higher).ordinal())
                                    .isGreaterThanOrEqualTo(cell);
                        }
                        if (u.ordinal() < 3) {
                            UncertaintyBucket higher = UncertaintyBucket.values()[u.ordinal() + 1];
                            assertThat(ExecutionRoutingTable.lookup(higher, tier, v).ordinal())
                                    .isGreaterThanOrEqualTo(cell);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Every extreme-uncertainty cell on tier 3 halts")
        void extremeUncertaintyTierThree_allHalt() {
            for (VolatilityBucket v : VolatilityBucket.values()) {
                assertThat(ExecutionRoutingTable.lookup(UncertaintyBucket.EXTREME, 3, v)).isEqualTo(ExecutionType.HALT);
            }
        }

        @Test
        @DisplayName("Bucket bounds are exclusive and non-finite input is extreme")
        void bucketBounds() {
            assertThat(UncertaintyBucket.of(0.29)).isEqualTo(UncertaintyBucket.LOW);
            assertThat(UncertaintyBucket.of(0.3)).isEqualTo(UncertaintyBucket.MEDIUM);
            assertThat(UncertaintyBucket.of(0.85)).isEqualTo(UncertaintyBucket.EXTREME);
            assertThat(UncertaintyBucket.of(Double.NaN)).isEqualTo(UncertaintyBucket.EXTREME);
            assertThat(VolatilityBucket.of(2.0)).isEqualTo(VolatilityBucket.NORMAL);
            assertThat(VolatilityBucket.of(15.0)).isEqualTo(VolatilityBucket.EXTREME);
            assertThat(VolatilityBucket.of(-1.0)).isEqualTo(VolatilityBucket.EXTREME);
        }
    }
}
