package com.neptune.query.api.clients;

import java.time.Duration;

import com.neptune.query.api.config.QueryLimits;

/**
 * Exponential backoff with a cap. A server-provided delay hint wins when it is longer.
 */
public class BackoffPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public BackoffPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static BackoffPolicy from(QueryLimits limits) {
        return new BackoffPolicy(limits.getRetryMaxAttempts(), limits.getRetryInitialBackoff(),
                limits.getRetryMaxBackoff());
    }

    /** Total attempts, the first one included. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay after the given failed attempt (1-based).
     */
    public Duration delayAfter(int attempt, Duration serverHint) {
        int exponent = Math.min(attempt - 1, 30);
        long millis = initialDelay.toMillis() * (1L << exponent);
        Duration delay = Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
        if (serverHint != null && serverHint.compareTo(delay) > 0) {
            return serverHint;
        }
        return delay;
    }
}
