package com.auditlead.core.agent;

import java.time.Duration;

/**
 * How often an agent's work function is attempted and how long to back off in between.
 *
 * @param maxRetries total number of attempts (at least 1)
 * @param retryDelay base delay; attempt {@code n} is followed by {@code retryDelay * 2^(n-1)}
 */
public record RetryPolicy(int maxRetries, Duration retryDelay) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2));

    public RetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be zero or positive: " + retryDelay);
        }
    }

    /** Backoff to wait after the given (1-based) failed attempt. */
    public Duration backoffAfter(int attempt) {
        return retryDelay.multipliedBy(1L << (attempt - 1));
    }
}
