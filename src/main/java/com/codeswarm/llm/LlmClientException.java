package com.codeswarm.llm;

/**
 * A model call that failed for good: either a non-retryable error or a
 * transient one that outlived the retry policy.
 */
public class LlmClientException extends RuntimeException {

    private final int attempts;

    public LlmClientException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
