package com.codeswarm.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.function.LongConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * RetryPolicy - bounded retry with exponential backoff and jitter for
 * external model calls.
 *
 * Backoff before attempt n+1 is baseBackoffMs * 2^(n-1) plus a random jitter
 * in [0, maxJitterMs]. Only failures the caller marks retryable are retried.
 * The control loop never retries; this policy is handed to the clients.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int          maxAttempts;
    private final long         baseBackoffMs;
    private final long         maxJitterMs;
    private final Random       jitterRandom;
    private final LongConsumer sleeper;

    RetryPolicy(int maxAttempts, long baseBackoffMs, long maxJitterMs, Random jitterRandom, LongConsumer sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseBackoffMs < 0 || maxJitterMs < 0) {
            throw new IllegalArgumentException("Backoff values must be non-negative");
        }
        this.maxAttempts   = maxAttempts;
        this.baseBackoffMs = baseBackoffMs;
        this.maxJitterMs   = maxJitterMs;
        this.jitterRandom  = jitterRandom;
        this.sleeper       = sleeper;
    }

    public static RetryPolicy of(int maxAttempts, long baseBackoffMs, long maxJitterMs) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, maxJitterMs, new Random(), RetryPolicy::sleep);
    }

    /** Single attempt, no backoff. */
    public static RetryPolicy noRetry() {
        return of(1, 0, 0);
    }

    public int  getMaxAttempts()   { return maxAttempts; }
    public long getBaseBackoffMs() { return baseBackoffMs; }
    public long getMaxJitterMs()   { return maxJitterMs; }

    /** Delay to wait after the given failed attempt (1-based). */
    public long backoffAfter(int attempt) {
        long exponential = baseBackoffMs * (1L << Math.min(attempt - 1, 20));
        long jitter      = maxJitterMs > 0 ? jitterRandom.nextLong(maxJitterMs + 1) : 0;
        return exponential + jitter;
    }

    /**
     * Run the call until it succeeds, fails with a non-retryable error, or
     * the attempts are used up.
     *
     * @throws LlmClientException wrapping the last failure
     */
    public <T> T execute(String label, Supplier<T> call, Predicate<Throwable> retryable) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T result = call.get();
                if (attempt > 1) {
                    log.info("[Retry] {} succeeded | retries={}", label, attempt - 1);
                }
                return result;

            } catch (RuntimeException ex) {

                if (!retryable.test(ex) || attempt >= maxAttempts) {
                    log.error("[Retry] {} final failure | attempts={} | cause={}", label, attempt, rootMessage(ex));
                    throw new LlmClientException(label + " failed after " + attempt + " attempt(s): "
                            + rootMessage(ex), attempt, ex);
                }

                long backoff = backoffAfter(attempt);
                log.warn("[Retry] {} transient failure on attempt {}. Retrying after {} ms. Cause: {}",
                        label, attempt, backoff, rootMessage(ex));
                sleeper.accept(backoff);

                if (Thread.currentThread().isInterrupted()) {
                    throw new LlmClientException(label + " interrupted during backoff", attempt, ex);
                }
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseBackoffMs=" + baseBackoffMs
                + ", maxJitterMs=" + maxJitterMs + "}";
    }
}
