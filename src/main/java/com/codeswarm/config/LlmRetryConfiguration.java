package com.codeswarm.config;

import com.codeswarm.llm.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmRetryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LlmRetryConfiguration.class);

    @Bean
    public RetryPolicy llmRetryPolicy(
            @Value("${codeswarm.llm.retry.max-attempts:4}")      int  maxAttempts,
            @Value("${codeswarm.llm.retry.base-backoff-ms:500}") long baseBackoffMs,
            @Value("${codeswarm.llm.retry.max-jitter-ms:250}")   long maxJitterMs
    ) {
        RetryPolicy policy = RetryPolicy.of(maxAttempts, baseBackoffMs, maxJitterMs);
        log.info("[Config] LLM {}", policy);
        return policy;
    }
}
