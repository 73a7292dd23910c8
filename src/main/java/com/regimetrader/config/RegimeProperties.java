package com.regimetrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Properties prefix: {@code regimetrader.regime.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.regime")
public class RegimeProperties {

    /** Spring resource location of the versioned regime model JSON. */
    private String modelLocation = "classpath:regime-models/regime-model-v1.json";

    /** Weight of an external regime prior when one is supplied; at most 0.10. */
    private double externalPriorWeight = 0.1;
}
