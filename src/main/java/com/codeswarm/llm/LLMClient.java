package com.codeswarm.llm;

import com.codeswarm.core.agent.AgentType;

/**
 * LLMClient - single interface for all model interactions in CodeSwarm.
 *
 * ONE abstract method: generateWithRole(AgentType, String, double, String).
 * The model override is the run's opaque model selector; null means the
 * client's configured default. Retry and backoff live inside the
 * implementations, driven by the injected {@link RetryPolicy}.
 *
 * getTemperatureForRole(AgentType) is a default method so the canonical
 * temperatures live here, not scattered across agents.
 */
@FunctionalInterface
public interface LLMClient {

    /**
     * Primary generation method.
     *
     * @param role          Agent role, drives system prompt selection in the implementation.
     * @param userPrompt    Task-specific prompt body.
     * @param temperature   Sampling temperature (0.0 = deterministic).
     * @param modelOverride Model name to use instead of the configured one, or null.
     * @return Raw model response text. Never null; empty string on empty model output.
     * @throws LlmClientException when the call fails after the retry policy is exhausted.
     */
    String generateWithRole(AgentType role, String userPrompt, double temperature, String modelOverride);

    /**
     * Canonical per-role sampling temperatures.
     *
     * AUDITOR  0.2 - structured JSON output; low creativity
     * FIXER    0.1 - code rewrite; near deterministic
     * JUDGE    0.0 - classification; fully deterministic
     */
    default double getTemperatureForRole(AgentType role) {
        return switch (role) {
            case AUDITOR -> 0.2;
            case FIXER   -> 0.1;
            case JUDGE   -> 0.0;
        };
    }
}
