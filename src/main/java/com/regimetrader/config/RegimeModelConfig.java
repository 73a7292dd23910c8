package com.regimetrader.config;

import com.regimetrader.regime.RegimeModel;
import com.regimetrader.regime.RegimeModelLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the regime model once at startup. A missing or invalid model fails the context.
 */
@Configuration
public class RegimeModelConfig {

    @Bean
    public RegimeModel regimeModel(RegimeModelLoader loader, RegimeProperties properties) {
        return loader.load(properties.getModelLocation());
    }
}
