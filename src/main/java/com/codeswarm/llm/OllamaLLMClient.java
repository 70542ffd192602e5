package com.codeswarm.llm;

import com.codeswarm.core.agent.AgentType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient - default LLMClient backed by a local Ollama server.
 *
 * Active unless the "gemini" or "mock" profile is selected. Implements only
 * generateWithRole(); temperatures come from the LLMClient interface default.
 */
@Component
@Profile("!gemini & !mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RetryPolicy  retryPolicy;

    public OllamaLLMClient(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public String generateWithRole(AgentType role, String userPrompt, double temperature, String modelOverride) {
        String effectiveModel = modelOverride != null ? modelOverride : model;

        log.debug("[Ollama] role={} model={} temperature={} promptLen={}",
                role, effectiveModel, temperature, userPrompt.length());

        String raw = retryPolicy.execute(
                "Ollama " + role,
                () -> callOllama(effectiveModel, SystemPrompts.forRole(role), userPrompt, temperature),
                OllamaLLMClient::isRetryable
        );

        return extractResponse(raw);
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String effectiveModel, String systemPrompt, String prompt, double temperature) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);

        Map<String, Object> body = new HashMap<>();
        body.put("model",   effectiveModel);
        body.put("system",  systemPrompt);
        body.put("prompt",  prompt);
        body.put("options", options);
        body.put("stream",  false);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response =
                restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        return response.getBody();
    }

    private String extractResponse(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        try {
            JsonNode root   = objectMapper.readTree(raw);
            String   result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;
        } catch (IOException e) {
            log.error("[Ollama] Unreadable response body: {}", e.getMessage());
            throw new LlmClientException("Malformed Ollama response", 1, e);
        }
    }

    static boolean isRetryable(Throwable ex) {
        return ex instanceof ResourceAccessException
            || ex instanceof HttpServerErrorException.ServiceUnavailable
            || ex instanceof HttpServerErrorException.GatewayTimeout
            || ex instanceof HttpClientErrorException.TooManyRequests;
    }
}
