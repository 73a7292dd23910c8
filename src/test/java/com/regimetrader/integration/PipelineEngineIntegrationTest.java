package com.regimetrader.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.regimetrader.canary.CanaryProperties;
import com.regimetrader.canary.CanaryState;
import com.regimetrader.canary.CanaryStatus;
import com.regimetrader.canary.CanaryTrade;
import com.regimetrader.config.PipelineProperties;
import com.regimetrader.config.RegimeProperties;
import com.regimetrader.domain.enums.DecisionSource;
import com.regimetrader.domain.model.DecisionRecord;
import com.regimetrader.domain.model.PortfolioSnapshot;
import com.regimetrader.domain.vo.RegimeBelief;
import com.regimetrader.event.CanaryEvent;
import com.regimetrader.event.CanaryEventType;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.ExecutionPlanEvent;
import com.regimetrader.event.RegimeShiftEvent;
import com.regimetrader.event.RiskEvent;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.execution.ExecutionDispatcher;
import com.regimetrader.execution.ExecutionRouter;
import com.regimetrader.execution.LoggingOrderGateway;
import com.regimetrader.execution.MarketConditions;
import com.regimetrader.execution.OrderGateway;
import com.regimetrader.observability.DecisionLogger;
import com.regimetrader.pipeline.MarketTick;
import com.regimetrader.pipeline.PipelineDecision;
import com.regimetrader.pipeline.PipelineEngine;
import com.regimetrader.pipeline.PipelineFactory;
import com.regimetrader.risk.CorrelationEstimator;
import com.regimetrader.risk.PortfolioRiskCalculator;
import com.regimetrader.risk.SizingLimits;
import com.regimetrader.router.RouterProperties;
import com.regimetrader.strategy.PolicyCatalogFactory;
import com.regimetrader.strategy.PolicyType;
import com.regimetrader.support.TestModels;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-component test for the per-symbol pipelines.
 * Wires the real factory, built-in policies, decision logger, event helper and execution
 * dispatcher together, with events routed by hand (simulating Spring events) so published
 * execution plans reach the order gateway.
 */
class PipelineEngineIntegrationTest {

    private static final String BTC = "BTC-USD";
    private static final String ETH = "ETH-USD";
    private static final Instant NOW = Instant.parse("2026-01-05T09:30:00Z");

    private final List<Object> events = new CopyOnWriteArrayList<>();

    private OrderGateway orderGateway;
    private ExecutionDispatcher executionDispatcher;
    private DecisionLogger decisionLogger;
    private PipelineEngine engine;

    @BeforeEach
    void setUp() {
        orderGateway = spy(new LoggingOrderGateway());
        executionDispatcher = new ExecutionDispatcher(orderGateway, 1_000L);

        ApplicationEventPublisher eventPublisher = event -> {
            events.add(event);
            if (event instanceof ExecutionPlanEvent planEvent) {
                executionDispatcher.onExecutionPlan(planEvent);
            }
        };
        decisionLogger = new DecisionLogger(eventPublisher);

        PipelineProperties pipelineProperties = new PipelineProperties();
        pipelineProperties.setSymbols(List.of(BTC, ETH));
        pipelineProperties.setRandomSeed(7L);

        PipelineFactory factory = new PipelineFactory(
                TestModels.defaultModel(),
                new RegimeProperties(),
                new RouterProperties(),
                pipelineProperties,
                new PolicyCatalogFactory(),
                SizingLimits.builder().build(),
                new PortfolioRiskCalculator(),
                new CorrelationEstimator(),
                new ExecutionRouter(),
                new CanaryProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        engine = new PipelineEngine(
                factory, pipelineProperties, decisionLogger, new EventPublisherHelper(eventPublisher));
        engine.registerConfiguredSymbols();
    }

    private static MarketTick tick(int t) {
        return MarketTick.builder()
                .observation(t < 15 ? TestModels.calm() : TestModels.turbulent(t))
                .price(100.0 + 0.1 * t)
                .marketConditions(MarketConditions.builder()
                        .spreadBps(3.0)
                        .depthUsd(1_000_000.0)
                        .volatilityPct(t < 15 ? 1.0 : 8.0)
                        .liquidityTier(1)
                        .build())
                .build();
    }

    private static PortfolioSnapshot portfolio() {
        return PortfolioSnapshot.empty(100_000.0);
    }

    private <T> List<T> eventsOf(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (Object event : events) {
            if (type.isInstance(event)) {
                matching.add(type.cast(event));
            }
        }
        return matching;
    }

    @Test
    @DisplayName("Two symbols run side by side; only the enabled one dispatches orders")
    void twoSymbols_onlyEnabledDispatches() {
        engine.enableCanary(BTC);

        List<PipelineDecision> decisions = new ArrayList<>();
        for (int t = 0; t < 30; t++) {
            decisions.add(engine.onTick(BTC, tick(t), portfolio()));
            decisions.add(engine.onTick(ETH, tick(t), portfolio()));
        }

        for (PipelineDecision decision : decisions) {
            double total = decision.getRegime().getBeliefs().stream()
                    .mapToDouble(RegimeBelief::getProbability)
                    .sum();
            assertThat(total).isCloseTo(1.0, within(1e-9));
            if (decision.getOrder() == null) {
                continue;
            }
            if (decision.getSymbol().equals(ETH)) {
                assertThat(decision.isShadow()).isTrue();
            } else {
                assertThat(decision.getOrder().getSizePct()).isLessThanOrEqualTo(0.05 * 0.01 + 1e-12);
            }
        }

        List<ExecutionPlanEvent> plans = eventsOf(ExecutionPlanEvent.class);
        assertThat(plans).allSatisfy(e -> assertThat(e.getOrder().getSymbol()).isEqualTo(BTC));
        verify(orderGateway, times(plans.size())).submit(any(), any());

        assertThat(engine.getStatus(BTC).getTicks()).isEqualTo(30);
        assertThat(engine.getStatus(ETH).getTicks()).isEqualTo(30);
        assertThat(engine.getStatus(ETH).getCanary().getState()).isEqualTo(CanaryState.DISABLED);
    }

    @Test
    @DisplayName("Turbulence after a calm stretch publishes a regime shift for each symbol")
    void regimeShift_perSymbol() {
        for (int t = 0; t < 25; t++) {
            engine.onTick(BTC, tick(t), portfolio());
            engine.onTick(ETH, tick(t), portfolio());
        }

        List<RegimeShiftEvent> shifts = eventsOf(RegimeShiftEvent.class);
        assertThat(shifts).anyMatch(e -> e.getSymbol().equals(BTC) && e.getNewRegime() == 3);
        assertThat(shifts).anyMatch(e -> e.getSymbol().equals(ETH) && e.getNewRegime() == 3);
        assertThat(engine.getStatus(BTC).getRegime().getDominantRegime()).isEqualTo(3);

        List<DecisionRecord> regimeRecords = decisionLogger.getRecentDecisions(1_000, DecisionSource.REGIME_DETECTOR);
        assertThat(regimeRecords).isNotEmpty();
        assertThat(decisionLogger.getRecentDecisions(1_000, ETH))
                .isNotEmpty()
                .allSatisfy(r -> assertThat(r.getSourceId()).isEqualTo(ETH));
    }

    @Test
    @DisplayName("A daily loss breach on one symbol latches only that symbol until reset")
    void emergency_isolatedAndReset() {
        engine.enableCanary(BTC);
        PortfolioSnapshot losing = portfolio().toBuilder().dailyPnl(-3_000.0).build();

        PipelineDecision decision = engine.onTick(BTC, tick(0), losing);
        engine.onTick(ETH, tick(0), portfolio());

        assertThat(decision.isEmergencyTriggered()).isTrue();
        assertThat(engine.getStatus(BTC).isEmergencyLatched()).isTrue();
        assertThat(engine.getStatus(ETH).isEmergencyLatched()).isFalse();
        assertThat(eventsOf(RiskEvent.class))
                .anyMatch(e -> e.getSymbol().equals(BTC) && e.getEventType() == RiskEventType.DAILY_LOSS_LIMIT_BREACH);
        assertThat(eventsOf(CanaryEvent.class))
                .anyMatch(e -> e.getSymbol().equals(BTC) && e.getEventType() == CanaryEventType.CIRCUIT_BREAKER_TRIPPED);

        engine.resetEmergency(BTC);

        assertThat(engine.getStatus(BTC).isEmergencyLatched()).isFalse();
        assertThat(engine.getStatus(BTC).getCanary().isCircuitBreakerActive()).isFalse();
        assertThat(eventsOf(RiskEvent.class)).anyMatch(e -> e.getEventType() == RiskEventType.EMERGENCY_RESET);
        assertThat(eventsOf(CanaryEvent.class))
                .anyMatch(e -> e.getEventType() == CanaryEventType.CIRCUIT_BREAKER_CLEARED);
    }

    @Test
    @DisplayName("Closed trades credit the policy and promote the canary")
    void trades_promoteCanary() {
        engine.enableCanary(BTC);
        for (int t = 0; t < 5; t++) {
            engine.onTick(BTC, tick(t), portfolio());
        }

        String policyId = PolicyType.MEAN_REVERSION.getPolicyId();
        CanaryStatus status = null;
        for (int i = 0; i < 25; i++) {
            double pnl = i < 16 ? 10.0 : -0.5;
            CanaryTrade trade = CanaryTrade.builder()
                    .tradeId("T-" + i)
                    .symbol(BTC)
                    .policyId(policyId)
                    .pnl(pnl)
                    .closedAt(NOW.plusSeconds(i))
                    .build();
            status = engine.recordTrade(BTC, trade, pnl > 0 ? 1.0 : 0.0);
        }

        assertThat(status.getState()).isEqualTo(CanaryState.PARTIAL);
        assertThat(eventsOf(CanaryEvent.class))
                .anyMatch(e -> e.getEventType() == CanaryEventType.PROMOTED
                        && e.getPreviousState() == CanaryState.CANARY
                        && e.getNewState() == CanaryState.PARTIAL);
        assertThat(engine.getStatus(BTC).getPolicies())
                .filteredOn(p -> p.getPolicyId().equals(policyId))
                .singleElement()
                .satisfies(p -> assertThat(p.getRewardUpdates()).isEqualTo(25));
        assertThat(decisionLogger.getRecentDecisions(1_000, DecisionSource.CANARY)).isNotEmpty();
        assertThat(engine.getStatus(ETH).getCanary().getState()).isEqualTo(CanaryState.DISABLED);
    }

    @Test
    @DisplayName("Concurrent ticks on different symbols keep each pipeline consistent")
    void concurrentSymbols() throws Exception {
        engine.enableCanary(BTC);
        engine.enableCanary(ETH);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String symbol : List.of(BTC, ETH)) {
                futures.add(executor.submit(() -> {
                    for (int t = 0; t < 200; t++) {
                        engine.onTick(symbol, tick(t % 30), portfolio());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(engine.getStatus(BTC).getTicks()).isEqualTo(200);
        assertThat(engine.getStatus(ETH).getTicks()).isEqualTo(200);
        double total = engine.getStatus(ETH).getRegime().getBeliefs().stream()
                .mapToDouble(RegimeBelief::getProbability)
                .sum();
        assertThat(total).isCloseTo(1.0, within(1e-9));
    }
}
