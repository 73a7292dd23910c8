package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.DecisionOutcome;
import com.regimetrader.domain.enums.DecisionSeverity;
import com.regimetrader.domain.enums.DecisionSource;
import com.regimetrader.domain.enums.DecisionType;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Structured decision log entry.
 *
 * <p>Every automated pipeline decision (regime update, policy choice, sizing, execution
 * routing, canary transition) is captured with its reasoning and a snapshot of the
 * numbers that drove it, so a decision can be explained after the fact.
 *
 * <p>Key fields:
 * <ul>
 *   <li>{@code source} -- which stage made the decision</li>
 *   <li>{@code sourceId} -- the traded symbol (one pipeline per symbol)</li>
 *   <li>{@code reasoning} -- human-readable explanation</li>
 *   <li>{@code dataContext} -- structured snapshot of relevant values at decision time</li>
 * </ul>
 */
@Data
@Builder
public class DecisionRecord {

    private Instant timestamp;

    private DecisionSource source;

    /** Symbol of the pipeline that made the decision. */
    private String sourceId;

    private DecisionType decisionType;

    private DecisionOutcome outcome;

    private String reasoning;

    private Map<String, Object> dataContext;

    private DecisionSeverity severity;
}
