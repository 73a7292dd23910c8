package com.regimetrader.execution;

import lombok.Builder;
import lombok.Value;

/**
 * How a parent order is worked over time. {@code visibleFraction} only applies to ICEBERG.
 */
@Value
@Builder
public class ChildSchedule {

    int slices;
    int durationMinutes;
    double sliceSizePct;
    double visibleFraction;
}
