package com.regimetrader.execution;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExecutionInstruction {

    ExecutionType type;

    /** Null for LIMIT and HALT. */
    ChildSchedule schedule;

    double expectedSlippageBps;
}
