package com.ziplens.service.retry;

import com.ziplens.service.ratelimit.Sleeper;
import com.ziplens.service.ratelimit.SlidingWindowRateLimiter;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Runs an operation up to N times with exponential backoff between attempts. Every attempt,
 * the first included, is admitted through the shared rate limiter.
 */
public final class RetryController {
    private static final Logger LOGGER = Logger.getLogger(RetryController.class.getName());

    private final RetryPolicy policy;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Sleeper sleeper;

    public RetryController(RetryPolicy policy, SlidingWindowRateLimiter rateLimiter, Sleeper sleeper) {
        this.policy = policy;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
    }

    public <T> T run(Attempt<T> operation) throws InterruptedException {
        return run(operation, policy.maxAttempts());
    }

    /**
     * @throws RetryExhaustedException when every attempt failed; the last failure is the cause
     * @throws RuntimeException        the failure itself when it is classified {@link RetryDecision#FAIL_FAST}
     */
    public <T> T run(Attempt<T> operation, int maxAttempts) throws InterruptedException {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        Exception lastFailure = null;
        RetryDecision lastDecision = RetryDecision.RETRY;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                Duration delay = policy.delayBefore(attempt);
                if (lastDecision == RetryDecision.RETRY_AFTER_COOLDOWN) {
                    delay = delay.plus(policy.rateLimitCooldown());
                }
                sleeper.sleep(delay);
            }
            rateLimiter.admit();
            try {
                return operation.call(attempt);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastFailure = e;
                lastDecision = classify(e);
                if (lastDecision == RetryDecision.FAIL_FAST) {
                    throw e instanceof RuntimeException runtime ? runtime : new IllegalStateException(e.getMessage(), e);
                }
                int current = attempt;
                LOGGER.warning(() -> "Attempt " + current + "/" + maxAttempts + " failed: " + e.getMessage());
            }
        }
        throw new RetryExhaustedException(maxAttempts, lastFailure);
    }

    static RetryDecision classify(Exception failure) {
        if (failure instanceof ClassifiedFailure classified) {
            return classified.retryDecision();
        }
        if (failure instanceof IllegalArgumentException) {
            return RetryDecision.FAIL_FAST;
        }
        return RetryDecision.RETRY;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T call(int attempt) throws Exception;
    }
}
