package com.bank.lending.application.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Business policy binding and the clock used for every persisted timestamp
 */
@Configuration
@EnableConfigurationProperties(LendingProperties.class)
public class LendingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
