package com.codeswarm.llm;

import com.codeswarm.core.agent.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Component
@Profile("gemini")
public class GeminiLLMClient implements LLMClient {

    private static final Logger log =
            LoggerFactory.getLogger(GeminiLLMClient.class);

    private final WebClient   webClient;
    private final RetryPolicy retryPolicy;

    @Value("${gemini.api.key}")
    private String apiKey;

    @Value("${gemini.api.model:gemini-1.5-flash}")
    private String model;

    @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${gemini.api.timeout-seconds:60}")
    private int timeoutSeconds;

    public GeminiLLMClient(WebClient.Builder builder, RetryPolicy retryPolicy) {
        this.webClient   = builder.build();
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String generateWithRole(AgentType role, String userPrompt, double temperature, String modelOverride) {

        String effectiveModel = modelOverride != null ? modelOverride : model;

        log.info("[Gemini] role={} | model={} | keyHash={} | promptLen={}",
                role, effectiveModel, apiKey.hashCode(), userPrompt.length());

        Map<String, Object> body = Map.of(
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", SystemPrompts.forRole(role)))
            ),
            "contents", List.of(
                Map.of(
                    "role", "user",
                    "parts", List.of(Map.of("text", userPrompt))
                )
            ),
            "generationConfig", Map.of("temperature", temperature)
        );

        Map<?, ?> response = retryPolicy.execute(
                "Gemini " + role,
                () -> webClient
                        .post()
                        .uri(baseUrl + "/models/" + effectiveModel + ":generateContent?key=" + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(Map.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block(),
                GeminiLLMClient::isRetryable
        );

        return extractText(response);
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content    = (Map<String, Object>) candidates.get(0).get("content");
            var parts      = (List<Map<String, Object>>) content.get("parts");
            Object text    = parts.get(0).get("text");
            return text != null ? text.toString() : "";
        } catch (Exception e) {
            log.error("[Gemini] Failed to parse response: {}", response, e);
            throw new LlmClientException("Malformed Gemini response", 1, e);
        }
    }

    /** Retry only transient failures */
    static boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientResponseException.ServiceUnavailable    // 503
            || ex instanceof WebClientResponseException.TooManyRequests    // 429
            || ex instanceof WebClientResponseException.GatewayTimeout     // 504
            || ex instanceof WebClientRequestException) {
            return true;
        }
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof IOException || cause instanceof TimeoutException) return true;
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return false;
    }
}
