package com.regimetrader.strategy;

import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.domain.vo.LatentState;
import com.regimetrader.domain.vo.RegimeBelief;
import java.util.List;
import java.util.Map;

/**
 * Capability every routable trading policy implements.
 *
 * <p>Policies are independent variant types. They receive the detector's latent state,
 * the full regime belief and the router's feature bag, and answer with a signal. They
 * must be side-effect free: the router may call {@code decide} on a policy it did not
 * choose (e.g. for shadow evaluation) and the pipeline calls it under the symbol's lock.
 */
public interface TradingPolicy {

    /** Stable id used by the router's posterior table, e.g. {@code p_momentum}. */
    String getId();

    TradeSignal decide(LatentState state, List<RegimeBelief> belief, Map<String, Double> features);
}
