package com.regimetrader.strategy;

import com.regimetrader.strategy.impl.BreakoutPolicy;
import com.regimetrader.strategy.impl.MeanReversionPolicy;
import com.regimetrader.strategy.impl.MomentumPolicy;
import com.regimetrader.strategy.impl.TrendFollowingPolicy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates policy instances from {@link PolicyType}.
 *
 * <p><b>Adding a new policy (3-step process):</b>
 * <ol>
 *   <li>Implement {@link TradingPolicy} in {@code strategy.impl}</li>
 *   <li>Add the type and its router id to {@link PolicyType}</li>
 *   <li>Add a case in {@link #create(PolicyType)}</li>
 * </ol>
 *
 * <p>Policies are plain Java objects, not Spring beans. Every pipeline gets its own
 * catalog so nothing is shared across symbols.
 */
@Component
public class PolicyCatalogFactory {

    private static final Logger log = LoggerFactory.getLogger(PolicyCatalogFactory.class);

    public TradingPolicy create(PolicyType type) {
        return switch (type) {
            case TREND_FOLLOWING -> new TrendFollowingPolicy();
            case BREAKOUT -> new BreakoutPolicy();
            case MEAN_REVERSION -> new MeanReversionPolicy();
            case MOMENTUM -> new MomentumPolicy();
        };
    }

    /** Builds a catalog for the given types, or every built-in type when none are given. */
    public List<TradingPolicy> createCatalog(List<PolicyType> types) {
        List<PolicyType> selected = types == null || types.isEmpty() ? Arrays.asList(PolicyType.values()) : types;
        List<TradingPolicy> catalog = new ArrayList<>(selected.size());
        for (PolicyType type : selected) {
            catalog.add(create(type));
        }
        log.debug("Created policy catalog {}", selected);
        return catalog;
    }
}
