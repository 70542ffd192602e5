package com.codeswarm.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Defaults for the control loop. A run request may override the iteration
 * budget; the phase timeout is global.
 */
@Component
public class LoopSettings {

    private final int      defaultMaxIterations;
    private final Duration phaseTimeout;

    @Autowired
    public LoopSettings(
            @Value("${codeswarm.loop.max-iterations:10}")         int  defaultMaxIterations,
            @Value("${codeswarm.loop.phase-timeout-seconds:600}")   long phaseTimeoutSeconds
    ) {
        if (phaseTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("codeswarm.loop.phase-timeout-seconds must be positive");
        }
        this.defaultMaxIterations = defaultMaxIterations;
        this.phaseTimeout         = Duration.ofSeconds(phaseTimeoutSeconds);
    }

    public LoopSettings(int defaultMaxIterations, Duration phaseTimeout) {
        this.defaultMaxIterations = defaultMaxIterations;
        this.phaseTimeout         = phaseTimeout;
    }

    public int      getDefaultMaxIterations() { return defaultMaxIterations; }
    public Duration getPhaseTimeout()         { return phaseTimeout; }
}
