package com.regimetrader.pipeline;

import com.regimetrader.canary.CanaryController;
import com.regimetrader.canary.CanaryProperties;
import com.regimetrader.config.PipelineProperties;
import com.regimetrader.config.RegimeProperties;
import com.regimetrader.execution.ExecutionRouter;
import com.regimetrader.regime.RegimeDetector;
import com.regimetrader.regime.RegimeModel;
import com.regimetrader.risk.CorrelationEstimator;
import com.regimetrader.risk.PortfolioRiskCalculator;
import com.regimetrader.risk.RiskAwarePositionSizer;
import com.regimetrader.risk.SizingLimits;
import com.regimetrader.router.RouterProperties;
import com.regimetrader.router.StrategyRouter;
import com.regimetrader.strategy.PolicyCatalogFactory;
import com.regimetrader.strategy.TradingPolicy;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds a fresh {@link TradingPipeline} per symbol.
 *
 * <p>Every stateful component (detector, router, policies, sizer, canary) is a new plain
 * object so two symbols never share mutable state. Only the immutable model and limits and
 * the stateless calculators and execution router are shared.
 */
@Component
public class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private final RegimeModel regimeModel;
    private final RegimeProperties regimeProperties;
    private final RouterProperties routerProperties;
    private final PipelineProperties pipelineProperties;
    private final PolicyCatalogFactory policyCatalogFactory;
    private final SizingLimits sizingLimits;
    private final PortfolioRiskCalculator riskCalculator;
    private final CorrelationEstimator correlationEstimator;
    private final ExecutionRouter executionRouter;
    private final CanaryProperties canaryProperties;
    private final Clock clock;

    public PipelineFactory(
            RegimeModel regimeModel,
            RegimeProperties regimeProperties,
            RouterProperties routerProperties,
            PipelineProperties pipelineProperties,
            PolicyCatalogFactory policyCatalogFactory,
            SizingLimits sizingLimits,
            PortfolioRiskCalculator riskCalculator,
            CorrelationEstimator correlationEstimator,
            ExecutionRouter executionRouter,
            CanaryProperties canaryProperties,
            Clock clock) {
        this.regimeModel = regimeModel;
        this.regimeProperties = regimeProperties;
        this.routerProperties = routerProperties;
        this.pipelineProperties = pipelineProperties;
        this.policyCatalogFactory = policyCatalogFactory;
        this.sizingLimits = sizingLimits;
        this.riskCalculator = riskCalculator;
        this.correlationEstimator = correlationEstimator;
        this.executionRouter = executionRouter;
        this.canaryProperties = canaryProperties;
        this.clock = clock;
    }

    public TradingPipeline create(String symbol) {
        RegimeDetector detector = new RegimeDetector(regimeModel, regimeProperties.getExternalPriorWeight());

        List<TradingPolicy> catalog = policyCatalogFactory.createCatalog(pipelineProperties.getPolicies());
        Map<String, TradingPolicy> policies = new LinkedHashMap<>();
        for (TradingPolicy policy : catalog) {
            policies.put(policy.getId(), policy);
        }
        StrategyRouter router = new StrategyRouter(
                catalog.stream().map(TradingPolicy::getId).toList(),
                regimeModel.regimeCount(),
                routerProperties,
                randomFor(symbol));

        RiskAwarePositionSizer sizer = new RiskAwarePositionSizer(sizingLimits, riskCalculator, correlationEstimator);
        CanaryController canary = new CanaryController(symbol, canaryProperties, clock);

        log.debug("Built pipeline for {} with policies {}", symbol, policies.keySet());
        return new TradingPipeline(symbol, detector, router, policies, sizer, executionRouter, canary);
    }

    /** A seeded stream per symbol when a seed is configured, otherwise a fresh self-seeded one. */
    RandomGenerator randomFor(String symbol) {
        Long seed = pipelineProperties.getRandomSeed();
        return seed != null ? new Well19937c(seed * 31 + symbol.hashCode()) : new Well19937c();
    }
}
