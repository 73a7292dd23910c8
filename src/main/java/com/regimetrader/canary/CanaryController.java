package com.regimetrader.canary;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progressive-rollout state machine for one pipeline: DISABLED → CANARY (1%) → PARTIAL (10%)
 * → LIVE (100%).
 *
 * <p>Promotion is automatic and happens inside {@link #recordTrade} when every criterion of
 * the current stage holds at once and no circuit breaker is active. Demotion never happens
 * automatically: only {@link #rollback} lowers the stage, so the weight is non-decreasing
 * between explicit operator calls. Leaving DISABLED requires an explicit {@link #enable}.
 *
 * <p>All public methods are synchronized: a trade's metric update and the promotion check
 * that follows it are one atomic step.
 */
public class CanaryController {

    private static final Logger log = LoggerFactory.getLogger(CanaryController.class);

    static final double CVAR_MULTIPLIER = 1.5;
    static final double CVAR_FLOOR = 0.01;

    private final String symbol;
    private final CanaryProperties properties;
    private final Clock clock;

    private final Deque<CanaryTrade> window = new ArrayDeque<>();
    private final List<CanaryTransition> history = new ArrayList<>();

    private CanaryState state;
    private CanaryMetrics metrics = CanaryMetrics.empty();
    private boolean circuitBreakerActive;
    private String circuitBreakerReason;
    private Instant lastStateChange;

    public CanaryController(String symbol, CanaryProperties properties, Clock clock) {
        this.symbol = symbol;
        this.properties = properties;
        this.clock = clock;
        this.state = CanaryState.DISABLED;
        this.lastStateChange = clock.instant();
        if (properties.isEnabledOnStartup()) {
            enable();
        }
    }

    // ========================
    // TRADES
    // ========================

    /**
     * Appends a realized trade to the rolling window, recomputes the metrics and promotes
     * when the current stage's criteria are all met.
     *
     * @return the promotion, if this trade caused one
     */
    public synchronized Optional<CanaryTransition> recordTrade(CanaryTrade trade) {
        if (trade == null || !Double.isFinite(trade.getPnl())) {
            log.warn("[{}] Ignoring canary trade with non-finite P&L: {}", symbol, trade);
            return Optional.empty();
        }

        window.addLast(trade);
        while (window.size() > properties.getWindowSize()) {
            window.removeFirst();
        }
        metrics = computeMetrics(window);

        if (!isPromotionEligible()) {
            return Optional.empty();
        }

        CanaryState next = state.next();
        String reason = String.format(
                Locale.ROOT,
                "criteria met after %d trades: winRate=%.3f, drawdown=%.4f, pnl=%.2f, cvar=%.4f",
                metrics.getTotalFills(),
                metrics.getWinRate(),
                metrics.getMaxDrawdown(),
                metrics.getTotalPnl(),
                metrics.getCvar());
        log.info("[{}] Auto-promoting canary {} -> {} ({})", symbol, state, next, reason);
        return Optional.of(transition(next, reason, true));
    }

    // ========================
    // OPERATOR ACTIONS
    // ========================

    /** DISABLED → CANARY. No-op in any other state. */
    public synchronized Optional<CanaryTransition> enable() {
        if (state != CanaryState.DISABLED) {
            log.debug("[{}] Canary already enabled ({})", symbol, state);
            return Optional.empty();
        }
        log.info("[{}] Canary enabled at {}% of capital", symbol, CanaryState.CANARY.getWeight() * 100);
        return Optional.of(transition(CanaryState.CANARY, "enabled by operator", false));
    }

    /**
     * Moves to a strictly lower stage. The trade window is kept, so the metrics that led to
     * the rollback still count against re-promotion.
     *
     * @return the rollback, or empty when {@code target} is not below the current stage
     */
    public synchronized Optional<CanaryTransition> rollback(CanaryState target, String reason) {
        if (target == null || !target.isBelow(state)) {
            log.warn("[{}] Rejected canary rollback from {} to {}: target must be a lower stage", symbol, state, target);
            return Optional.empty();
        }
        log.warn("[{}] Canary rolled back {} -> {}: {}", symbol, state, target, reason);
        return Optional.of(transition(target, reason, false));
    }

    /** Blocks promotion until {@link #clearCircuitBreaker()}. Does not change the weight. */
    public synchronized boolean tripCircuitBreaker(String reason) {
        if (circuitBreakerActive) {
            return false;
        }
        circuitBreakerActive = true;
        circuitBreakerReason = reason;
        log.warn("[{}] Canary circuit breaker tripped: {}", symbol, reason);
        return true;
    }

    public synchronized boolean clearCircuitBreaker() {
        if (!circuitBreakerActive) {
            return false;
        }
        circuitBreakerActive = false;
        circuitBreakerReason = null;
        log.info("[{}] Canary circuit breaker cleared", symbol);
        return true;
    }

    // ========================
    // QUERIES
    // ========================

    public synchronized CanaryStatus getStatus() {
        return CanaryStatus.builder()
                .state(state)
                .weight(state.getWeight())
                .metrics(metrics)
                .criteria(hasCriteria() ? properties.criteriaFor(state) : null)
                .promotionEligible(isPromotionEligible())
                .requirements(requirements())
                .circuitBreakerActive(circuitBreakerActive)
                .circuitBreakerReason(circuitBreakerReason)
                .lastStateChange(lastStateChange)
                .history(List.copyOf(history))
                .build();
    }

    public synchronized CanaryState getState() {
        return state;
    }

    public synchronized double getWeight() {
        return state.getWeight();
    }

    public String getSymbol() {
        return symbol;
    }

    // ========================
    // INTERNALS
    // ========================

    private boolean hasCriteria() {
        return state == CanaryState.CANARY || state == CanaryState.PARTIAL;
    }

    private boolean isPromotionEligible() {
        if (!hasCriteria() || circuitBreakerActive) {
            return false;
        }
        CanaryCriteria criteria = properties.criteriaFor(state);
        return metrics.getTotalFills() >= criteria.getMinTrades()
                && metrics.getWinRate() >= criteria.getMinWinRate()
                && metrics.getMaxDrawdown() <= criteria.getMaxDrawdown()
                && metrics.getTotalPnl() >= criteria.getPnlThreshold()
                && metrics.getCvar() <= criteria.getCvarCap();
    }

    private List<String> requirements() {
        if (state.isTerminal()) {
            return List.of("Already at maximum deployment level");
        }
        if (state == CanaryState.DISABLED) {
            return List.of("Canary must be enabled explicitly");
        }

        CanaryCriteria criteria = properties.criteriaFor(state);
        List<String> requirements = new ArrayList<>();
        if (metrics.getTotalFills() < criteria.getMinTrades()) {
            requirements.add("Need " + (criteria.getMinTrades() - metrics.getTotalFills()) + " more trades");
        }
        if (metrics.getWinRate() < criteria.getMinWinRate()) {
            requirements.add(String.format(
                    Locale.ROOT,
                    "Win rate too low: %.1f%% < %.1f%%",
                    metrics.getWinRate() * 100,
                    criteria.getMinWinRate() * 100));
        }
        if (metrics.getMaxDrawdown() > criteria.getMaxDrawdown()) {
            requirements.add(String.format(
                    Locale.ROOT,
                    "Drawdown too high: %.1f%% > %.1f%%",
                    metrics.getMaxDrawdown() * 100,
                    criteria.getMaxDrawdown() * 100));
        }
        if (metrics.getTotalPnl() < criteria.getPnlThreshold()) {
            requirements.add(String.format(
                    Locale.ROOT, "PnL too low: $%.2f < $%.2f", metrics.getTotalPnl(), criteria.getPnlThreshold()));
        }
        if (metrics.getCvar() > criteria.getCvarCap()) {
            requirements.add(String.format(
                    Locale.ROOT,
                    "CVaR too high: %.1f%% > %.1f%%",
                    metrics.getCvar() * 100,
                    criteria.getCvarCap() * 100));
        }
        if (circuitBreakerActive) {
            requirements.add("Circuit breakers must be clear");
        }
        if (requirements.isEmpty()) {
            requirements.add("Ready for promotion!");
        }
        return List.copyOf(requirements);
    }

    private CanaryTransition transition(CanaryState target, String reason, boolean automatic) {
        Instant now = clock.instant();
        CanaryTransition transition = new CanaryTransition(state, target, reason, automatic, now);
        history.add(transition);
        state = target;
        lastStateChange = now;
        return transition;
    }

    static CanaryMetrics computeMetrics(Iterable<CanaryTrade> trades) {
        int fills = 0;
        int wins = 0;
        double cumulative = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;

        for (CanaryTrade trade : trades) {
            fills++;
            if (trade.isWin()) {
                wins++;
            }
            cumulative += trade.getPnl();
            peak = Math.max(peak, cumulative);
            double drawdown = (peak - cumulative) / Math.max(peak, 1.0);
            maxDrawdown = Math.max(maxDrawdown, drawdown);
        }

        if (fills == 0) {
            return CanaryMetrics.empty();
        }
        return CanaryMetrics.builder()
                .totalFills(fills)
                .totalPnl(cumulative)
                .winRate((double) wins / fills)
                .maxDrawdown(maxDrawdown)
                .cvar(Math.max(CVAR_FLOOR, maxDrawdown * CVAR_MULTIPLIER))
                .build();
    }
}
