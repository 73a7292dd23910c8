package com.regimetrader.observability;

import com.regimetrader.canary.CanaryState;
import com.regimetrader.canary.CanaryTransition;
import com.regimetrader.domain.enums.DecisionOutcome;
import com.regimetrader.domain.enums.DecisionSeverity;
import com.regimetrader.domain.enums.DecisionSource;
import com.regimetrader.domain.enums.DecisionType;
import com.regimetrader.domain.model.DecisionRecord;
import com.regimetrader.domain.model.RegimeEstimate;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.event.DecisionLogEvent;
import com.regimetrader.execution.ExecutionPlan;
import com.regimetrader.risk.AlertLevel;
import com.regimetrader.risk.RiskAlert;
import com.regimetrader.risk.SizingResult;
import com.regimetrader.router.PolicyChoice;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Central decision log for the trading pipelines.
 *
 * <p>Every automated decision (regime update, policy choice, sizing, execution routing,
 * canary transition) is captured as a structured {@link DecisionRecord} with its reasoning
 * and the numbers behind it. Records go to:
 * <ul>
 *   <li>an in-memory ring buffer of the last {@value #RING_BUFFER_SIZE} decisions, newest first</li>
 *   <li>a {@link DecisionLogEvent} for any live listener</li>
 * </ul>
 *
 * <p>Specialized methods set source, decision type, outcome and severity for each stage and
 * delegate to {@link #log}.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ApplicationEventPublisher applicationEventPublisher;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Core logging method ----

    public DecisionRecord log(
            DecisionSource source,
            String sourceId,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> dataContext,
            DecisionSeverity severity) {

        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(Instant.now())
                .source(source)
                .sourceId(sourceId)
                .decisionType(decisionType)
                .outcome(outcome)
                .reasoning(reasoning)
                .dataContext(dataContext)
                .severity(severity)
                .build();

        persist(decisionRecord);

        return decisionRecord;
    }

    // ---- Regime ----

    public void logRegimeUpdate(String symbol, RegimeEstimate estimate) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("probabilities", Arrays.stream(estimate.probabilities()).boxed().toList());
        context.put("dominantRegime", estimate.getDominantRegime());
        context.put("uncertainty", estimate.getUncertainty());

        log(
                DecisionSource.REGIME_DETECTOR,
                symbol,
                estimate.isDegraded() ? DecisionType.REGIME_DEGRADED : DecisionType.REGIME_UPDATED,
                DecisionOutcome.INFO,
                estimate.isDegraded()
                        ? "Non-finite observation, belief degraded toward uniform"
                        : "Regime posterior updated",
                context,
                estimate.isDegraded() ? DecisionSeverity.WARNING : DecisionSeverity.DEBUG);
    }

    public void logRegimeShift(String symbol, int previousRegime, int newRegime, String newRegimeName, double probability) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("previousRegime", previousRegime);
        context.put("newRegime", newRegime);
        context.put("probability", probability);

        log(
                DecisionSource.REGIME_DETECTOR,
                symbol,
                DecisionType.REGIME_SHIFT,
                DecisionOutcome.TRIGGERED,
                "Dominant regime changed to " + newRegimeName,
                context,
                DecisionSeverity.INFO);
    }

    public void logRegimeReset(String symbol) {
        log(
                DecisionSource.REGIME_DETECTOR,
                symbol,
                DecisionType.REGIME_RESET,
                DecisionOutcome.INFO,
                "Regime detector reset to model defaults",
                null,
                DecisionSeverity.INFO);
    }

    // ---- Strategy router ----

    public void logPolicyChoice(String symbol, PolicyChoice choice, TradeSignal signal) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("policyId", choice.getPolicyId());
        context.put("score", choice.getScore());
        context.put("sampledReward", choice.getSampledReward());
        context.put("contextualAdjustment", choice.getContextualAdjustment());
        context.put("explorationBonus", choice.getExplorationBonus());
        if (signal != null) {
            context.put("direction", signal.getDirection());
            context.put("confidence", signal.getConfidence());
        }

        log(
                DecisionSource.STRATEGY_ROUTER,
                symbol,
                DecisionType.POLICY_CHOSEN,
                DecisionOutcome.TRIGGERED,
                signal != null && signal.getRationale() != null
                        ? "Chose " + choice.getPolicyId() + ": " + signal.getRationale()
                        : "Chose " + choice.getPolicyId(),
                context,
                DecisionSeverity.DEBUG);
    }

    public void logPolicyUpdate(String symbol, String policyId, double reward) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("policyId", policyId);
        context.put("reward", reward);

        log(
                DecisionSource.STRATEGY_ROUTER,
                symbol,
                DecisionType.POLICY_UPDATED,
                DecisionOutcome.INFO,
                "Reward recorded for " + policyId,
                context,
                DecisionSeverity.DEBUG);
    }

    // ---- Position sizer ----

    public void logSizing(SizingResult result) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("direction", result.getDirection());
        context.put("recommendedSize", result.getRecommendedSize());
        context.put("maxAllowedSize", result.getMaxAllowedSize());
        context.put("kellyFraction", result.getKellyFraction());
        context.put("drivingFactor", result.getDrivingFactor());
        if (!result.getAlerts().isEmpty()) {
            context.put("alerts", result.getAlerts().stream().map(RiskAlert::toString).toList());
        }

        DecisionSeverity severity;
        if (result.hasAlert(AlertLevel.EMERGENCY) || result.hasAlert(AlertLevel.CRITICAL)) {
            severity = DecisionSeverity.CRITICAL;
        } else if (result.hasAlert(AlertLevel.WARNING)) {
            severity = DecisionSeverity.WARNING;
        } else {
            severity = DecisionSeverity.INFO;
        }

        log(
                DecisionSource.POSITION_SIZER,
                result.getSymbol(),
                result.isTrade() ? DecisionType.SIZING_APPROVED : DecisionType.SIZING_REJECTED,
                result.isTrade() ? DecisionOutcome.TRIGGERED : DecisionOutcome.REJECTED,
                result.getReasoning(),
                context,
                severity);
    }

    public void logEmergencyReset(String symbol, String previousReason) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("previousReason", previousReason);

        log(
                DecisionSource.POSITION_SIZER,
                symbol,
                DecisionType.SIZING_EMERGENCY_RESET,
                DecisionOutcome.INFO,
                "Emergency latch cleared by operator",
                context,
                DecisionSeverity.WARNING);
    }

    // ---- Execution router ----

    public void logExecution(String symbol, ExecutionPlan plan) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("type", plan.getPrimary().getType());
        context.put("uncertaintyBucket", plan.getUncertaintyBucket());
        context.put("volatilityBucket", plan.getVolatilityBucket());
        context.put("liquidityTier", plan.getEffectiveLiquidityTier());
        context.put("expectedSlippageBps", plan.getPrimary().getExpectedSlippageBps());
        if (plan.getFallback() != null) {
            context.put("fallback", plan.getFallback().getType());
        }

        log(
                DecisionSource.EXECUTION_ROUTER,
                symbol,
                plan.isHalt() ? DecisionType.EXECUTION_HALTED : DecisionType.EXECUTION_ROUTED,
                plan.isHalt() ? DecisionOutcome.REJECTED : DecisionOutcome.TRIGGERED,
                plan.getReason(),
                context,
                plan.isHalt() ? DecisionSeverity.WARNING : DecisionSeverity.INFO);
    }

    // ---- Canary ----

    public void logCanaryTransition(String symbol, CanaryTransition transition) {
        DecisionType type;
        if (transition.getFrom() == CanaryState.DISABLED && transition.getTo() == CanaryState.CANARY) {
            type = DecisionType.CANARY_ENABLED;
        } else if (transition.getTo().isBelow(transition.getFrom())) {
            type = DecisionType.CANARY_ROLLED_BACK;
        } else {
            type = DecisionType.CANARY_PROMOTED;
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("from", transition.getFrom());
        context.put("to", transition.getTo());
        context.put("automatic", transition.isAutomatic());
        context.put("weight", transition.getTo().getWeight());

        log(
                DecisionSource.CANARY,
                symbol,
                type,
                DecisionOutcome.TRIGGERED,
                transition.getReason(),
                context,
                type == DecisionType.CANARY_ROLLED_BACK ? DecisionSeverity.WARNING : DecisionSeverity.INFO);
    }

    public void logCanaryCircuitBreaker(String symbol, boolean tripped, String reason) {
        log(
                DecisionSource.CANARY,
                symbol,
                DecisionType.CANARY_CIRCUIT_BREAKER,
                tripped ? DecisionOutcome.TRIGGERED : DecisionOutcome.INFO,
                tripped ? "Circuit breaker tripped: " + reason : "Circuit breaker cleared",
                null,
                tripped ? DecisionSeverity.CRITICAL : DecisionSeverity.INFO);
    }

    // ---- Engine ----

    public void logPipelineRegistered(String symbol, Map<String, Object> details) {
        log(
                DecisionSource.PIPELINE_ENGINE,
                symbol,
                DecisionType.PIPELINE_REGISTERED,
                DecisionOutcome.INFO,
                "Pipeline registered",
                details,
                DecisionSeverity.INFO);
    }

    // ---- Ring buffer queries ----

    /** Most recent N decisions, newest first. */
    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionSource source) {
        return ringBuffer.stream()
                .filter(r -> r.getSource() == source)
                .limit(count)
                .toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, String symbol) {
        return ringBuffer.stream()
                .filter(r -> symbol.equals(r.getSourceId()))
                .limit(count)
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private void persist(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        try {
            applicationEventPublisher.publishEvent(new DecisionLogEvent(this, decisionRecord));
        } catch (Exception e) {
            // Event publishing failure must never block the trading path
            logger.error("Failed to publish DecisionLogEvent: {}", e.getMessage());
        }
    }

    // ---- Visible for testing ----

    void clearBuffer() {
        ringBuffer.clear();
    }
}
