package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.SignalDirection;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One open position as seen by the sizer. Created on fill, revalued on price update and
 * removed on close by the external fill reporter.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class PositionExposure {

    private final String symbol;
    private final SignalDirection direction;
    private final double quantity;
    private final double price;

    /** Absolute notional of the position. */
    public double marketValue() {
        return Math.abs(quantity * price);
    }
}
