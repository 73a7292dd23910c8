package com.regimetrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class RegimeTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegimeTraderApplication.class, args);
    }
}
