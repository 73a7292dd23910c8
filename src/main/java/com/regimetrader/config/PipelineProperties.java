package com.regimetrader.config;

import com.regimetrader.strategy.PolicyType;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the per-symbol pipelines.
 *
 * <p>Properties prefix: {@code regimetrader.pipeline.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>symbols: none (register at runtime)</li>
 *   <li>policies: empty, meaning every built-in policy</li>
 *   <li>randomSeed: null, meaning a fresh seed per pipeline</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.pipeline")
public class PipelineProperties {

    private List<String> symbols = new ArrayList<>();

    private List<PolicyType> policies = new ArrayList<>();

    /** Seed for the router's sampler. Each symbol derives its own stream from it. */
    private Long randomSeed;
}
