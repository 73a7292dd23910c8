package com.regimetrader.pipeline;

import com.regimetrader.domain.vo.Observation;
import com.regimetrader.execution.MarketConditions;
import com.regimetrader.execution.RequestedOrderType;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one market tick brings into a pipeline.
 *
 * <p>{@code externalPrior} (regime hint) and {@code features} (router context) are optional.
 */
@Value
@Builder
public class MarketTick {

    Observation observation;
    double[] externalPrior;
    Map<String, Double> features;
    double price;
    MarketConditions marketConditions;

    @Builder.Default
    RequestedOrderType orderType = RequestedOrderType.MARKET;
}
