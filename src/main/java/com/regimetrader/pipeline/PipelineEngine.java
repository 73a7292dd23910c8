package com.regimetrader.pipeline;

import com.regimetrader.canary.CanaryState;
import com.regimetrader.canary.CanaryStatus;
import com.regimetrader.canary.CanaryTrade;
import com.regimetrader.canary.CanaryTransition;
import com.regimetrader.config.PipelineProperties;
import com.regimetrader.domain.model.PortfolioSnapshot;
import com.regimetrader.event.CanaryEventType;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import com.regimetrader.exception.ConfigurationException;
import com.regimetrader.observability.DecisionLogger;
import com.regimetrader.risk.AlertLevel;
import com.regimetrader.risk.AlertType;
import com.regimetrader.risk.RiskAlert;
import com.regimetrader.router.PolicySnapshot;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registry and entry point for the per-symbol trading pipelines.
 *
 * <p><b>Concurrency model:</b> ConcurrentHashMap for the pipeline registry; each pipeline
 * serializes its own ticks and trades with a per-symbol lock, so there is no lock across
 * symbols. Decision logging and event publication happen after the pipeline call returns,
 * outside the symbol's lock.
 *
 * <p>Symbols listed under {@code regimetrader.pipeline.symbols} are registered at startup;
 * others can be added with {@link #registerSymbol}. Calls for a symbol that was never
 * registered are wiring errors and raise {@link ConfigurationException}.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final PipelineFactory pipelineFactory;
    private final PipelineProperties pipelineProperties;
    private final DecisionLogger decisionLogger;
    private final EventPublisherHelper eventPublisherHelper;

    private final ConcurrentHashMap<String, TradingPipeline> pipelines = new ConcurrentHashMap<>();

    public PipelineEngine(
            PipelineFactory pipelineFactory,
            PipelineProperties pipelineProperties,
            DecisionLogger decisionLogger,
            EventPublisherHelper eventPublisherHelper) {
        this.pipelineFactory = pipelineFactory;
        this.pipelineProperties = pipelineProperties;
        this.decisionLogger = decisionLogger;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @jakarta.annotation.PostConstruct
    public void registerConfiguredSymbols() {
        for (String symbol : pipelineProperties.getSymbols()) {
            registerSymbol(symbol);
        }
        log.info("Pipeline engine started with {} symbol(s): {}", pipelines.size(), pipelines.keySet());
    }

    // ========================
    // REGISTRATION
    // ========================

    /**
     * Creates the pipeline for a symbol. Registering an existing symbol returns the existing
     * pipeline unchanged.
     */
    public TradingPipeline registerSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ConfigurationException("Symbol must not be blank");
        }
        TradingPipeline existing = pipelines.get(symbol);
        if (existing != null) {
            return existing;
        }

        TradingPipeline created = pipelineFactory.create(symbol);
        TradingPipeline raced = pipelines.putIfAbsent(symbol, created);
        if (raced != null) {
            return raced;
        }

        PipelineStatus status = created.getStatus();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("modelVersion", status.getModelVersion());
        details.put("policies", status.getPolicies().stream().map(PolicySnapshot::getPolicyId).toList());
        details.put("canaryState", status.getCanary().getState());
        decisionLogger.logPipelineRegistered(symbol, details);

        log.info(
                "Registered pipeline for {} (model {}, canary {})",
                symbol,
                status.getModelVersion(),
                status.getCanary().getState());
        return created;
    }

    public boolean isRegistered(String symbol) {
        return symbol != null && pipelines.containsKey(symbol);
    }

    public List<String> getSymbols() {
        return pipelines.keySet().stream().sorted().toList();
    }

    // ========================
    // TICKS AND TRADES
    // ========================

    /**
     * Runs one tick through the symbol's pipeline, then records the decisions and publishes
     * the resulting events (regime shift, risk alerts, execution plan).
     */
    public PipelineDecision onTick(String symbol, MarketTick tick, PortfolioSnapshot portfolio) {
        TradingPipeline pipeline = pipeline(symbol);
        PipelineDecision decision = pipeline.onTick(tick, portfolio);

        // 1. Regime
        decisionLogger.logRegimeUpdate(symbol, decision.getRegime());
        if (decision.isRegimeShift()) {
            int newRegime = decision.getRegime().getDominantRegime();
            String name = decision.getRegime().dominantBelief().getName();
            double probability = decision.getRegime().dominantBelief().getProbability();
            decisionLogger.logRegimeShift(symbol, decision.getPreviousDominantRegime(), newRegime, name, probability);
            eventPublisherHelper.publishRegimeShift(
                    this, symbol, decision.getPreviousDominantRegime(), newRegime, name, probability);
        }

        // 2. Policy and sizing
        decisionLogger.logPolicyChoice(symbol, decision.getChoice(), decision.getSignal());
        decisionLogger.logSizing(decision.getSizing());
        publishAlerts(symbol, decision.getSizing().getAlerts());
        if (decision.isEmergencyTriggered()) {
            String reason = "position sizer emergency latch";
            decisionLogger.logCanaryCircuitBreaker(symbol, true, reason);
            eventPublisherHelper.publishCanaryEvent(
                    this,
                    symbol,
                    CanaryEventType.CIRCUIT_BREAKER_TRIPPED,
                    decision.getCanaryState(),
                    decision.getCanaryState(),
                    reason);
        }

        // 3. Execution
        if (decision.getPlan() != null) {
            decisionLogger.logExecution(symbol, decision.getPlan());
            if (decision.isDispatchable()) {
                eventPublisherHelper.publishExecutionPlan(this, decision.getOrder(), decision.getPlan());
            }
        }
        return decision;
    }

    /**
     * Reports a closed trade: credits the reward to its policy and feeds the P&L to the
     * canary, which may promote.
     *
     * @throws ConfigurationException for an unknown symbol or a policy outside the symbol's catalog
     */
    public CanaryStatus recordTrade(String symbol, CanaryTrade trade, double reward) {
        TradingPipeline pipeline = pipeline(symbol);
        Optional<CanaryTransition> promotion = pipeline.recordTrade(trade, reward);

        if (trade != null && trade.getPolicyId() != null) {
            decisionLogger.logPolicyUpdate(symbol, trade.getPolicyId(), reward);
        }
        promotion.ifPresent(t -> announce(symbol, t, CanaryEventType.PROMOTED));
        return pipeline.getCanary().getStatus();
    }

    // ========================
    // OPERATOR ACTIONS
    // ========================

    public CanaryStatus enableCanary(String symbol) {
        TradingPipeline pipeline = pipeline(symbol);
        pipeline.enableCanary().ifPresent(t -> announce(symbol, t, CanaryEventType.ENABLED));
        return pipeline.getCanary().getStatus();
    }

    /** Explicit rollback to a lower canary stage; a target at or above the current stage is ignored. */
    public CanaryStatus rollback(String symbol, CanaryState target, String reason) {
        TradingPipeline pipeline = pipeline(symbol);
        pipeline.rollback(target, reason).ifPresent(t -> announce(symbol, t, CanaryEventType.ROLLED_BACK));
        return pipeline.getCanary().getStatus();
    }

    /** Clears the sizer's emergency latch and the canary circuit breaker it tripped. */
    public PipelineStatus resetEmergency(String symbol) {
        TradingPipeline pipeline = pipeline(symbol);
        String previousReason = pipeline.resetEmergency();
        if (previousReason != null) {
            decisionLogger.logEmergencyReset(symbol, previousReason);
            decisionLogger.logCanaryCircuitBreaker(symbol, false, null);
            eventPublisherHelper.publishEmergencyReset(this, symbol, previousReason);
            CanaryState state = pipeline.getCanary().getState();
            eventPublisherHelper.publishCanaryEvent(
                    this, symbol, CanaryEventType.CIRCUIT_BREAKER_CLEARED, state, state, "emergency reset");
        }
        return pipeline.getStatus();
    }

    public PipelineStatus resetRegime(String symbol) {
        TradingPipeline pipeline = pipeline(symbol);
        pipeline.resetRegime();
        decisionLogger.logRegimeReset(symbol);
        return pipeline.getStatus();
    }

    public PipelineStatus getStatus(String symbol) {
        return pipeline(symbol).getStatus();
    }

    // ========================
    // INTERNALS
    // ========================

    private TradingPipeline pipeline(String symbol) {
        TradingPipeline pipeline = symbol != null ? pipelines.get(symbol) : null;
        if (pipeline == null) {
            throw ConfigurationException.unknownSymbol(symbol);
        }
        return pipeline;
    }

    private void announce(String symbol, CanaryTransition transition, CanaryEventType type) {
        decisionLogger.logCanaryTransition(symbol, transition);
        eventPublisherHelper.publishCanaryEvent(
                this, symbol, type, transition.getFrom(), transition.getTo(), transition.getReason());
    }

    private void publishAlerts(String symbol, List<RiskAlert> alerts) {
        for (RiskAlert alert : alerts) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("alertType", alert.getType());
            details.put("value", alert.getValue());
            details.put("threshold", alert.getThreshold());
            details.put("action", alert.getAction());
            eventPublisherHelper.publishRiskEvent(
                    this, symbol, riskEventType(alert), riskLevel(alert.getLevel()), alert.getMessage(), details);
        }
    }

    static RiskEventType riskEventType(RiskAlert alert) {
        if (alert.getType() == AlertType.DAILY_LOSS) {
            return alert.getLevel() == AlertLevel.EMERGENCY
                    ? RiskEventType.DAILY_LOSS_LIMIT_BREACH
                    : RiskEventType.DAILY_LOSS_LIMIT_APPROACH;
        }
        return switch (alert.getType()) {
            case CONSECUTIVE_LOSSES -> RiskEventType.CONSECUTIVE_LOSS_LIMIT;
            case DRAWDOWN -> RiskEventType.PORTFOLIO_LIMIT_BREACH;
            case POSITION_SIZE -> alert.getLevel() == AlertLevel.WARNING
                    ? RiskEventType.SIZING_ADJUSTED
                    : RiskEventType.PORTFOLIO_LIMIT_BREACH;
            default -> RiskEventType.SIZING_ADJUSTED;
        };
    }

    static RiskLevel riskLevel(AlertLevel level) {
        return switch (level) {
            case WARNING -> RiskLevel.WARNING;
            case CRITICAL, EMERGENCY -> RiskLevel.CRITICAL;
        };
    }
}
