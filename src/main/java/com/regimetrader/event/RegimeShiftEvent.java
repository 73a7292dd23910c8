package com.regimetrader.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when the most probable regime of a pipeline changes between ticks.
 */
public class RegimeShiftEvent extends ApplicationEvent {

    private final String symbol;
    private final int previousRegime;
    private final int newRegime;
    private final String newRegimeName;
    private final double probability;

    public RegimeShiftEvent(
            Object source, String symbol, int previousRegime, int newRegime, String newRegimeName, double probability) {
        super(source);
        this.symbol = symbol;
        this.previousRegime = previousRegime;
        this.newRegime = newRegime;
        this.newRegimeName = newRegimeName;
        this.probability = probability;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPreviousRegime() {
        return previousRegime;
    }

    public int getNewRegime() {
        return newRegime;
    }

    public String getNewRegimeName() {
        return newRegimeName;
    }

    /** Posterior probability of the new dominant regime. */
    public double getProbability() {
        return probability;
    }
}
