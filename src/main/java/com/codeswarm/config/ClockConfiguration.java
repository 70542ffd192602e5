package com.codeswarm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Wall clock for run timing; tests construct the orchestrator with a fixed one. */
@Configuration
public class ClockConfiguration {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
