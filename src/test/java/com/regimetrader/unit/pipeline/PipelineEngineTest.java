package com.regimetrader.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.regimetrader.canary.CanaryProperties;
import com.regimetrader.canary.CanaryState;
import com.regimetrader.canary.CanaryStatus;
import com.regimetrader.canary.CanaryTrade;
import com.regimetrader.config.PipelineProperties;
import com.regimetrader.config.RegimeProperties;
import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.enums.SignalDirection;
import com.regimetrader.domain.model.PortfolioSnapshot;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.domain.vo.LatentState;
import com.regimetrader.domain.vo.RegimeBelief;
import com.regimetrader.event.CanaryEventType;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import com.regimetrader.exception.ConfigurationException;
import com.regimetrader.exception.ErrorCode;
import com.regimetrader.execution.ExecutionRouter;
import com.regimetrader.execution.MarketConditions;
import com.regimetrader.observability.DecisionLogger;
import com.regimetrader.pipeline.MarketTick;
import com.regimetrader.pipeline.PipelineDecision;
import com.regimetrader.pipeline.PipelineEngine;
import com.regimetrader.pipeline.PipelineFactory;
import com.regimetrader.pipeline.PipelineStatus;
import com.regimetrader.pipeline.TradingPipeline;
import com.regimetrader.risk.CorrelationEstimator;
import com.regimetrader.risk.PortfolioRiskCalculator;
import com.regimetrader.risk.SizingLimits;
import com.regimetrader.router.PolicySnapshot;
import com.regimetrader.router.RouterProperties;
import com.regimetrader.strategy.PolicyCatalogFactory;
import com.regimetrader.strategy.TradingPolicy;
import com.regimetrader.support.TestModels;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineEngineTest {

    private static final String SYMBOL = "BTC-USD";
    private static final String POLICY_ID = "p_fixed";
    private static final double PORTFOLIO_VALUE = 100_000.0;
    private static final Instant NOW = Instant.parse("2026-01-05T09:30:00Z");

    @Mock
    private PolicyCatalogFactory policyCatalogFactory;

    @Mock
    private DecisionLogger decisionLogger;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PipelineProperties pipelineProperties;
    private PipelineEngine engine;

    @BeforeEach
    void setUp() {
        when(policyCatalogFactory.createCatalog(any())).thenReturn(List.of(new FixedLongPolicy()));

        pipelineProperties = new PipelineProperties();
        pipelineProperties.setSymbols(List.of(SYMBOL));
        pipelineProperties.setRandomSeed(42L);

        PipelineFactory factory = new PipelineFactory(
                TestModels.defaultModel(),
                new RegimeProperties(),
                new RouterProperties(),
                pipelineProperties,
                policyCatalogFactory,
                SizingLimits.builder().build(),
                new PortfolioRiskCalculator(),
                new CorrelationEstimator(),
                new ExecutionRouter(),
                new CanaryProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        engine = new PipelineEngine(factory, pipelineProperties, decisionLogger, eventPublisherHelper);
        engine.registerConfiguredSymbols();
    }

    /** Always long with p=0.6, avgWin=0.03, avgLoss=0.02, confidence 0.9: sizes to the 5% cap. */
    private static final class FixedLongPolicy implements TradingPolicy {

        @Override
        public String getId() {
            return POLICY_ID;
        }

        @Override
        public TradeSignal decide(LatentState state, List<RegimeBelief> belief, Map<String, Double> features) {
            return TradeSignal.builder()
                    .policyId(POLICY_ID)
                    .direction(SignalDirection.LONG)
                    .confidence(0.9)
                    .expectedReturn(0.02)
                    .winProbability(0.6)
                    .avgWin(0.03)
                    .avgLoss(0.02)
                    .volatility(0.1)
                    .rationale("fixed")
                    .build();
        }
    }

    private static MarketTick calmTick() {
        return MarketTick.builder()
                .observation(TestModels.calm())
                .price(100.0)
                .marketConditions(MarketConditions.builder()
                        .spreadBps(2.0)
                        .depthUsd(2_000_000.0)
                        .volatilityPct(1.0)
                        .liquidityTier(1)
                        .build())
                .build();
    }

    private static PortfolioSnapshot portfolio() {
        return PortfolioSnapshot.empty(PORTFOLIO_VALUE);
    }

    private PipelineDecision runCalm(int ticks) {
        PipelineDecision last = null;
        for (int i = 0; i < ticks; i++) {
            last = engine.onTick(SYMBOL, calmTick(), portfolio());
        }
        return last;
    }

    private static CanaryTrade trade(int n, double pnl) {
        return CanaryTrade.builder()
                .tradeId("T-" + n)
                .symbol(SYMBOL)
                .policyId(POLICY_ID)
                .pnl(pnl)
                .closedAt(NOW.plusSeconds(n))
                .build();
    }

    // ==============================
    // REGISTRATION
    // ==============================

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Configured symbols are registered at startup and logged")
        void configuredSymbols_registered() {
            assertThat(engine.isRegistered(SYMBOL)).isTrue();
            verify(decisionLogger).logPipelineRegistered(eq(SYMBOL), any());
        }

        @Test
        @DisplayName("Registering an existing symbol returns the same pipeline")
        void registerSymbol_idempotent() {
            TradingPipeline first = engine.registerSymbol("ETH-USD");
            TradingPipeline second = engine.registerSymbol("ETH-USD");

            assertThat(second).isSameAs(first);
            verify(decisionLogger, times(1)).logPipelineRegistered(eq("ETH-USD"), any());
        }

        @Test
        @DisplayName("Blank or null symbols are rejected")
        void blankSymbol_throws() {
            assertThatThrownBy(() -> engine.registerSymbol("  ")).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> engine.registerSymbol(null)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Symbols are listed in sorted order")
        void getSymbols_sorted() {
            engine.registerSymbol("SOL-USD");
            engine.registerSymbol("ETH-USD");

            assertThat(engine.getSymbols()).containsExactly("BTC-USD", "ETH-USD", "SOL-USD");
        }

        @Test
        @DisplayName("Calls for an unregistered symbol raise UNKNOWN_SYMBOL")
        void unknownSymbol_throws() {
            assertThatThrownBy(() -> engine.onTick("DOGE-USD", calmTick(), portfolio()))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.UNKNOWN_SYMBOL);
            assertThatThrownBy(() -> engine.getStatus(null)).isInstanceOf(ConfigurationException.class);
            assertThat(engine.isRegistered(null)).isFalse();
        }

        @Test
        @DisplayName("Each symbol gets its own pipeline state")
        void symbols_isolated() {
            engine.registerSymbol("ETH-USD");
            runCalm(5);

            assertThat(engine.getStatus(SYMBOL).getTicks()).isEqualTo(5);
            assertThat(engine.getStatus("ETH-USD").getTicks()).isZero();
        }
    }

    // ==============================
    // TICKS
    // ==============================

    @Nested
    @DisplayName("Ticks")
    class Ticks {

        @Test
        @DisplayName("A disabled canary yields a shadow plan at full size that is never published")
        void disabledCanary_shadowPlan() {
            PipelineDecision decision = runCalm(10);

            assertThat(decision.getCanaryState()).isEqualTo(CanaryState.DISABLED);
            assertThat(decision.getSizing().getRecommendedSize()).isCloseTo(0.05, within(1e-12));
            assertThat(decision.isShadow()).isTrue();
            assertThat(decision.getOrder().getSizePct()).isCloseTo(0.05, within(1e-12));
            assertThat(decision.getEffectiveSize()).isZero();
            assertThat(decision.isDispatchable()).isFalse();
            verify(eventPublisherHelper, never()).publishExecutionPlan(any(), any(), any());
        }

        @Test
        @DisplayName("After enabling, orders carry the canary-weighted size and the plan is published")
        void enabledCanary_weightedOrder() {
            CanaryStatus status = engine.enableCanary(SYMBOL);
            assertThat(status.getState()).isEqualTo(CanaryState.CANARY);
            verify(eventPublisherHelper)
                    .publishCanaryEvent(
                            any(),
                            eq(SYMBOL),
                            eq(CanaryEventType.ENABLED),
                            eq(CanaryState.DISABLED),
                            eq(CanaryState.CANARY),
                            anyString());

            PipelineDecision decision = runCalm(10);

            assertThat(decision.isShadow()).isFalse();
            assertThat(decision.getCanaryWeight()).isEqualTo(0.01);
            assertThat(decision.getOrder().getSide()).isEqualTo(OrderSide.BUY);
            assertThat(decision.getOrder().getSizePct()).isCloseTo(0.05 * 0.01, within(1e-12));
            assertThat(decision.getEffectiveSize()).isCloseTo(0.0005, within(1e-12));
            assertThat(decision.isDispatchable()).isTrue();
            verify(eventPublisherHelper, atLeastOnce()).publishExecutionPlan(engine, decision.getOrder(), decision.getPlan());
        }

        @Test
        @DisplayName("Every stage is recorded in the decision log")
        void tick_logsStages() {
            PipelineDecision decision = engine.onTick(SYMBOL, calmTick(), portfolio());

            verify(decisionLogger).logRegimeUpdate(SYMBOL, decision.getRegime());
            verify(decisionLogger).logPolicyChoice(SYMBOL, decision.getChoice(), decision.getSignal());
            verify(decisionLogger).logSizing(decision.getSizing());
            verify(decisionLogger).logExecution(SYMBOL, decision.getPlan());
        }

        @Test
        @DisplayName("A move into the turbulent regime publishes a regime shift")
        void regimeShift_published() {
            runCalm(20);
            PipelineDecision last = null;
            for (int t = 0; t < 5; t++) {
                last = engine.onTick(
                        SYMBOL, MarketTick.builder().observation(TestModels.turbulent(t)).price(100.0).build(), portfolio());
            }

            assertThat(last.getRegime().getDominantRegime()).isEqualTo(3);
            verify(eventPublisherHelper, atLeastOnce())
                    .publishRegimeShift(any(), eq(SYMBOL), anyInt(), eq(3), anyString(), anyDouble());
        }

        @Test
        @DisplayName("A null tick degrades the regime and never trades")
        void nullTick_degrades() {
            PipelineDecision decision = engine.onTick(SYMBOL, null, portfolio());

            assertThat(decision.getRegime().isDegraded()).isTrue();
            assertThat(decision.getSizing().isTrade()).isFalse();
            assertThat(decision.getOrder()).isNull();
        }
    }

    // ==============================
    // EMERGENCY
    // ==============================

    @Nested
    @DisplayName("Emergency latch")
    class Emergency {

        @Test
        @DisplayName("A daily loss breach latches, trips the canary breaker and publishes both")
        void dailyLossBreach_tripsBreaker() {
            PortfolioSnapshot losing = portfolio().toBuilder().dailyPnl(-2_500.0).build();

            PipelineDecision decision = engine.onTick(SYMBOL, calmTick(), losing);

            assertThat(decision.isEmergencyTriggered()).isTrue();
            assertThat(decision.getSizing().isTrade()).isFalse();
            PipelineStatus status = engine.getStatus(SYMBOL);
            assertThat(status.isEmergencyLatched()).isTrue();
            assertThat(status.getCanary().isCircuitBreakerActive()).isTrue();
            verify(eventPublisherHelper)
                    .publishRiskEvent(
                            any(),
                            eq(SYMBOL),
                            eq(RiskEventType.DAILY_LOSS_LIMIT_BREACH),
                            eq(RiskLevel.CRITICAL),
                            anyString(),
                            any());
            verify(eventPublisherHelper)
                    .publishCanaryEvent(
                            any(),
                            eq(SYMBOL),
                            eq(CanaryEventType.CIRCUIT_BREAKER_TRIPPED),
                            any(),
                            any(),
                            anyString());
        }

        @Test
        @DisplayName("The latch holds on later ticks without re-announcing")
        void latch_holds() {
            engine.onTick(SYMBOL, calmTick(), portfolio().toBuilder().dailyPnl(-2_500.0).build());

            PipelineDecision next = engine.onTick(SYMBOL, calmTick(), portfolio());

            assertThat(next.isEmergencyTriggered()).isFalse();
            assertThat(next.getSizing().isTrade()).isFalse();
            assertThat(next.getSizing().getDrivingFactor()).isEqualTo("emergency latch");
            verify(eventPublisherHelper, times(1))
                    .publishCanaryEvent(
                            any(),
                            eq(SYMBOL),
                            eq(CanaryEventType.CIRCUIT_BREAKER_TRIPPED),
                            any(),
                            any(),
                            anyString());
        }

        @Test
        @DisplayName("resetEmergency clears the latch and the breaker, once")
        void resetEmergency_clears() {
            engine.onTick(SYMBOL, calmTick(), portfolio().toBuilder().dailyPnl(-2_500.0).build());

            PipelineStatus status = engine.resetEmergency(SYMBOL);
            engine.resetEmergency(SYMBOL);

            assertThat(status.isEmergencyLatched()).isFalse();
            assertThat(status.getCanary().isCircuitBreakerActive()).isFalse();
            verify(eventPublisherHelper, times(1)).publishEmergencyReset(any(), eq(SYMBOL), contains("daily P&L"));
            verify(eventPublisherHelper, times(1))
                    .publishCanaryEvent(
                            any(),
                            eq(SYMBOL),
                            eq(CanaryEventType.CIRCUIT_BREAKER_CLEARED),
                            any(),
                            any(),
                            anyString());
            assertThat(engine.onTick(SYMBOL, calmTick(), portfolio()).getSizing().isTrade()).isTrue();
        }
    }

    // ==============================
    // TRADES AND OPERATOR ACTIONS
    // ==============================

    @Nested
    @DisplayName("Trades and operator actions")
    class TradesAndOperator {

        @Test
        @DisplayName("16 wins and 9 small losses promote CANARY to PARTIAL on the 25th trade")
        void recordTrade_promotes() {
            engine.enableCanary(SYMBOL);
            runCalm(3);

            CanaryStatus status = null;
            for (int i = 0; i < 25; i++) {
                double pnl = i < 16 ? 10.0 : -0.5;
                status = engine.recordTrade(SYMBOL, trade(i, pnl), pnl > 0 ? 1.0 : 0.0);
                if (i < 24) {
                    assertThat(status.getState()).isEqualTo(CanaryState.CANARY);
                }
            }

            assertThat(status.getState()).isEqualTo(CanaryState.PARTIAL);
            verify(eventPublisherHelper)
                    .publishCanaryEvent(
                            any(),
                            eq(SYMBOL),
                            eq(CanaryEventType.PROMOTED),
                            eq(CanaryState.CANARY),
                            eq(CanaryState.PARTIAL),
                            anyString());
            verify(decisionLogger, times(25)).logPolicyUpdate(eq(SYMBOL), eq(POLICY_ID), anyDouble());

            PolicySnapshot policy = engine.getStatus(SYMBOL).getPolicies().get(0);
            assertThat(policy.getRewardUpdates()).isEqualTo(25);
        }

        @Test
        @DisplayName("A trade naming a policy outside the catalog raises UNKNOWN_POLICY")
        void recordTrade_unknownPolicy() {
            CanaryTrade foreign = CanaryTrade.builder()
                    .tradeId("T-x")
                    .symbol(SYMBOL)
                    .policyId("p_nope")
                    .pnl(5.0)
                    .build();

            assertThatThrownBy(() -> engine.recordTrade(SYMBOL, foreign, 1.0))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.UNKNOWN_POLICY);
        }

        @Test
        @DisplayName("A trade without a policy only feeds the canary window")
        void recordTrade_withoutPolicy() {
            engine.enableCanary(SYMBOL);

            CanaryStatus status = engine.recordTrade(
                    SYMBOL, CanaryTrade.builder().tradeId("T-1").pnl(4.0).build(), 1.0);

            assertThat(status.getMetrics().getTotalFills()).isEqualTo(1);
            verify(decisionLogger, never()).logPolicyUpdate(anyString(), anyString(), anyDouble());
        }

        @Test
        @DisplayName("Rollback to a lower stage is announced; a higher target is ignored")
        void rollback() {
            engine.enableCanary(SYMBOL);

            CanaryStatus ignored = engine.rollback(SYMBOL, CanaryState.LIVE, "operator typo");
            assertThat(ignored.getState()).isEqualTo(CanaryState.CANARY);

            CanaryStatus rolledBack = engine.rollback(SYMBOL, CanaryState.DISABLED, "manual stop");
            assertThat(rolledBack.getState()).isEqualTo(CanaryState.DISABLED);
            verify(eventPublisherHelper)
                    .publishCanaryEvent(
                            any(),
                            eq(SYMBOL),
                            eq(CanaryEventType.ROLLED_BACK),
                            eq(CanaryState.CANARY),
                            eq(CanaryState.DISABLED),
                            eq("manual stop"));
        }

        @Test
        @DisplayName("resetRegime restores the prior and is logged")
        void resetRegime() {
            PipelineStatus before = engine.getStatus(SYMBOL);
            runCalm(30);

            PipelineStatus after = engine.resetRegime(SYMBOL);

            assertThat(after.getRegime().probabilities())
                    .containsExactly(before.getRegime().probabilities(), within(1e-12));
            verify(decisionLogger).logRegimeReset(SYMBOL);
        }
    }
}
