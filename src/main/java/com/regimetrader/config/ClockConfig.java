package com.regimetrader.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /** Time source for canary transition timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
