package com.ziplens.service.retry;

import java.time.Duration;

/**
 * @param rateLimitCooldown extra wait added before the next attempt when the provider answered
 *                          "too many requests"; zero treats that answer like any transient failure
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Duration rateLimitCooldown) {
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be zero or positive");
        }
        rateLimitCooldown = rateLimitCooldown == null ? Duration.ZERO : rateLimitCooldown;
    }

    public static RetryPolicy defaults(int maxAttempts) {
        return new RetryPolicy(maxAttempts, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, Duration.ZERO);
    }

    /**
     * min(maxDelay, baseDelay * 2^(attempt - 1)); zero for the first attempt.
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempt - 1, 30);
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        // base * 2^shift exceeds the cap exactly when base > floor(cap / 2^shift)
        if (base > (cap >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(base << shift);
    }
}
