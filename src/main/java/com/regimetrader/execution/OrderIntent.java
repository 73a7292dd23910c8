package com.regimetrader.execution;

import com.regimetrader.domain.enums.OrderSide;
import lombok.Builder;
import lombok.Value;

/**
 * A sized order awaiting an execution style. {@code sizePct} is a fraction of portfolio value.
 */
@Value
@Builder
public class OrderIntent {

    String symbol;
    OrderSide side;
    double sizePct;
    RequestedOrderType type;
}
