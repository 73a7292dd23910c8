package com.regimetrader.pipeline;

import com.regimetrader.canary.CanaryController;
import com.regimetrader.canary.CanaryState;
import com.regimetrader.canary.CanaryTrade;
import com.regimetrader.canary.CanaryTransition;
import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.enums.SignalDirection;
import com.regimetrader.domain.model.PortfolioSnapshot;
import com.regimetrader.domain.model.RegimeEstimate;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.exception.ConfigurationException;
import com.regimetrader.execution.ExecutionPlan;
import com.regimetrader.execution.ExecutionRouter;
import com.regimetrader.execution.OrderIntent;
import com.regimetrader.regime.RegimeDetector;
import com.regimetrader.risk.RiskAwarePositionSizer;
import com.regimetrader.risk.SizingResult;
import com.regimetrader.router.PolicyChoice;
import com.regimetrader.router.RouterContext;
import com.regimetrader.router.StrategyRouter;
import com.regimetrader.strategy.TradingPolicy;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One symbol's decision pipeline: regime detector → strategy router → policy → position
 * sizer → execution router, gated by the canary controller.
 *
 * <p>Every component here is owned by this handle and shared with nothing else, except the
 * stateless {@link ExecutionRouter}. A single {@link ReentrantLock} covers one full tick and
 * every trade or operator call, so a symbol's state has exactly one writer at a time while
 * different symbols run fully in parallel.
 *
 * <p>Built by {@link PipelineFactory}; driven by {@link PipelineEngine}.
 */
public class TradingPipeline {

    private static final Logger log = LoggerFactory.getLogger(TradingPipeline.class);

    private final String symbol;
    private final RegimeDetector detector;
    private final StrategyRouter router;
    private final Map<String, TradingPolicy> policies;
    private final RiskAwarePositionSizer sizer;
    private final ExecutionRouter executionRouter;
    private final CanaryController canary;

    private final ReentrantLock lock = new ReentrantLock();

    /** Context each policy was last chosen under, credited when its trade closes. */
    private final Map<String, RouterContext> decisionContexts = new HashMap<>();

    private int dominantRegime;
    private long ticks;

    TradingPipeline(
            String symbol,
            RegimeDetector detector,
            StrategyRouter router,
            Map<String, TradingPolicy> policies,
            RiskAwarePositionSizer sizer,
            ExecutionRouter executionRouter,
            CanaryController canary) {
        this.symbol = symbol;
        this.detector = detector;
        this.router = router;
        this.policies = policies;
        this.sizer = sizer;
        this.executionRouter = executionRouter;
        this.canary = canary;
        this.dominantRegime = detector.currentEstimate().getDominantRegime();
    }

    // ========================
    // TICK
    // ========================

    public PipelineDecision onTick(MarketTick tick, PortfolioSnapshot portfolio) {
        if (tick == null) {
            tick = MarketTick.builder().build();
        }
        lock.lock();
        try {
            ticks++;

            // 1. Regime filter
            RegimeEstimate estimate = detector.update(tick.getObservation(), tick.getExternalPrior());
            int previousRegime = dominantRegime;
            dominantRegime = estimate.getDominantRegime();

            // 2. Policy selection
            RouterContext context = RouterContext.of(tick.getFeatures(), estimate.probabilities());
            PolicyChoice choice = router.choose(context);
            decisionContexts.put(choice.getPolicyId(), context);

            // 3. Policy signal
            TradeSignal signal = decide(choice.getPolicyId(), estimate, context);

            // 4. Sizing
            boolean latchedBefore = sizer.isEmergencyLatched();
            SizingResult sizing = sizer.size(symbol, signal, portfolio, tick.getPrice());
            boolean emergencyTriggered = !latchedBefore && sizer.isEmergencyLatched();
            if (emergencyTriggered) {
                canary.tripCircuitBreaker("position sizer emergency: " + sizer.getEmergencyReason());
            }

            // 5. Canary weighting and execution routing
            CanaryState canaryState = canary.getState();
            double weight = canaryState.getWeight();
            double effectiveSize = sizing.getRecommendedSize() * weight;

            OrderIntent order = null;
            ExecutionPlan plan = null;
            boolean shadow = false;
            if (sizing.isTrade()) {
                shadow = weight <= 0.0;
                order = OrderIntent.builder()
                        .symbol(symbol)
                        .side(sizing.getDirection() == SignalDirection.SHORT ? OrderSide.SELL : OrderSide.BUY)
                        .sizePct(shadow ? sizing.getRecommendedSize() : effectiveSize)
                        .type(tick.getOrderType())
                        .build();
                plan = executionRouter.routeOrder(order, tick.getMarketConditions(), estimate.getUncertainty());
            }

            return PipelineDecision.builder()
                    .symbol(symbol)
                    .tick(ticks)
                    .regime(estimate)
                    .previousDominantRegime(previousRegime)
                    .regimeShift(previousRegime != dominantRegime)
                    .choice(choice)
                    .signal(signal)
                    .sizing(sizing)
                    .canaryState(canaryState)
                    .canaryWeight(weight)
                    .effectiveSize(sizing.isTrade() ? effectiveSize : 0.0)
                    .order(order)
                    .plan(plan)
                    .shadow(shadow)
                    .emergencyTriggered(emergencyTriggered)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private TradeSignal decide(String policyId, RegimeEstimate estimate, RouterContext context) {
        TradingPolicy policy = policies.get(policyId);
        try {
            TradeSignal signal = policy.decide(estimate.getState(), estimate.getBeliefs(), context.asMap());
            return signal != null ? signal : TradeSignal.flat(policyId, "policy returned no signal");
        } catch (RuntimeException e) {
            log.warn("[{}] Policy {} failed, treating as flat: {}", symbol, policyId, e.getMessage(), e);
            return TradeSignal.flat(policyId, "policy failed: " + e.getMessage());
        }
    }

    // ========================
    // TRADES
    // ========================

    /**
     * Credits a closed trade: the reward goes to the policy that opened it (under the context
     * it was chosen in) and the P&L goes to the canary window.
     *
     * @return the canary promotion this trade caused, if any
     * @throws ConfigurationException when the trade names a policy outside this pipeline's catalog
     */
    public Optional<CanaryTransition> recordTrade(CanaryTrade trade, double reward) {
        lock.lock();
        try {
            String policyId = trade != null ? trade.getPolicyId() : null;
            if (policyId != null) {
                router.update(policyId, reward, decisionContexts.get(policyId));
            }
            return canary.recordTrade(trade);
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // OPERATOR ACTIONS
    // ========================

    public Optional<CanaryTransition> enableCanary() {
        lock.lock();
        try {
            return canary.enable();
        } finally {
            lock.unlock();
        }
    }

    public Optional<CanaryTransition> rollback(CanaryState target, String reason) {
        lock.lock();
        try {
            return canary.rollback(target, reason);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the sizer's emergency latch and the canary circuit breaker it tripped.
     *
     * @return the latch reason that was cleared, or null when nothing was latched
     */
    public String resetEmergency() {
        lock.lock();
        try {
            if (!sizer.isEmergencyLatched()) {
                return null;
            }
            String reason = sizer.getEmergencyReason();
            sizer.resetEmergency();
            canary.clearCircuitBreaker();
            return reason;
        } finally {
            lock.unlock();
        }
    }

    public void resetRegime() {
        lock.lock();
        try {
            detector.reset();
            dominantRegime = detector.currentEstimate().getDominantRegime();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    public PipelineStatus getStatus() {
        lock.lock();
        try {
            return PipelineStatus.builder()
                    .symbol(symbol)
                    .ticks(ticks)
                    .modelVersion(detector.getModel().getVersion())
                    .regime(detector.currentEstimate())
                    .policies(router.snapshot())
                    .emergencyLatched(sizer.isEmergencyLatched())
                    .emergencyReason(sizer.getEmergencyReason())
                    .canary(canary.getStatus())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String getSymbol() {
        return symbol;
    }

    public CanaryController getCanary() {
        return canary;
    }
}
