package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.SignalDirection;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Qualitative trading signal produced by a policy and consumed by the position sizer.
 *
 * <p>{@code winProbability}, {@code avgWin} and {@code avgLoss} feed the Kelly fraction;
 * {@code volatility} selects the sizer's volatility band; {@code confidence} is gated
 * against the minimum confidence floor.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class TradeSignal {

    private final String policyId;
    private final SignalDirection direction;
    private final double confidence;
    private final double expectedReturn;
    private final double winProbability;
    private final double avgWin;
    private final double avgLoss;
    private final double volatility;

    /** Reason attached by the policy, mostly useful for FLAT signals. */
    private final String rationale;

    public static TradeSignal flat(String policyId, String rationale) {
        return TradeSignal.builder()
                .policyId(policyId)
                .direction(SignalDirection.FLAT)
                .confidence(0.0)
                .winProbability(0.5)
                .rationale(rationale)
                .build();
    }

    public boolean isFlat() {
        return direction == null || direction == SignalDirection.FLAT;
    }

    /** True when every numeric field is finite. */
    public boolean isFinite() {
        return Double.isFinite(confidence)
                && Double.isFinite(expectedReturn)
                && Double.isFinite(winProbability)
                && Double.isFinite(avgWin)
                && Double.isFinite(avgLoss)
                && Double.isFinite(volatility);
    }
}
