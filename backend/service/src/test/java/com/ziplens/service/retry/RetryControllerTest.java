package com.ziplens.service.retry;

import com.ziplens.service.acs.AcsRequestException;
import com.ziplens.service.ratelimit.SlidingWindowRateLimiter;
import com.ziplens.service.support.MutableClock;
import com.ziplens.service.support.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryControllerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(100, clock, sleeper);

    @Test
    void retriesTransientFailuresWithExponentialBackoff() throws Exception {
        RetryController retry = new RetryController(RetryPolicy.defaults(3), limiter, sleeper);
        AtomicInteger calls = new AtomicInteger();

        String result = retry.run(attempt -> {
            calls.incrementAndGet();
            if (attempt < 3) {
                throw transientFailure();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeper.sleeps());
        assertEquals(3, limiter.windowCount());
    }

    @Test
    void givesUpAfterMaxAttemptsWithLastFailureAsCause() throws Exception {
        RetryController retry = new RetryController(RetryPolicy.defaults(3), limiter, sleeper);
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException error = assertThrows(RetryExhaustedException.class, () -> retry.run(attempt -> {
            calls.incrementAndGet();
            throw new AcsRequestException(AcsRequestException.Kind.TRANSIENT, 500, "boom " + attempt);
        }));

        assertEquals(3, error.attempts());
        assertEquals(3, calls.get());
        assertEquals("boom 3", error.getCause().getMessage());
        assertTrue(error.getMessage().contains("3 attempts"));
    }

    @Test
    void credentialRejectionIsNotRetried() {
        RetryController retry = new RetryController(RetryPolicy.defaults(5), limiter, sleeper);
        AtomicInteger calls = new AtomicInteger();
        AcsRequestException rejected = AcsRequestException.forStatus(403);

        AcsRequestException error = assertThrows(AcsRequestException.class, () -> retry.run(attempt -> {
            calls.incrementAndGet();
            throw rejected;
        }));

        assertSame(rejected, error);
        assertEquals(1, calls.get());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void validationErrorsAreNotRetried() {
        RetryController retry = new RetryController(RetryPolicy.defaults(5), limiter, sleeper);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> retry.run(attempt -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad zip");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void rateLimitedAnswerAddsConfiguredCooldown() throws Exception {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(5));
        RetryController retry = new RetryController(policy, limiter, sleeper);

        Integer result = retry.run(attempt -> {
            if (attempt == 1) {
                throw AcsRequestException.forStatus(429);
            }
            return attempt;
        });

        assertEquals(2, result);
        assertEquals(List.of(Duration.ofSeconds(7)), sleeper.sleeps());
    }

    @Test
    void unclassifiedFailuresAreRetried() throws Exception {
        RetryController retry = new RetryController(RetryPolicy.defaults(2), limiter, sleeper);

        String result = retry.run(attempt -> {
            if (attempt == 1) {
                throw new IOException("reset");
            }
            return "second";
        });

        assertEquals("second", result);
    }

    @Test
    void backoffIsCapped() {
        RetryPolicy policy = RetryPolicy.defaults(10);

        assertEquals(Duration.ZERO, policy.delayBefore(1));
        assertEquals(Duration.ofSeconds(16), policy.delayBefore(5));
        assertEquals(Duration.ofSeconds(30), policy.delayBefore(6));
        assertEquals(Duration.ofSeconds(30), policy.delayBefore(60));
    }

    @Test
    void largeBaseDelaySaturatesAtTheCapInsteadOfOverflowing() {
        RetryPolicy policy = new RetryPolicy(40, Duration.ofDays(200), Duration.ofDays(500), Duration.ZERO);

        assertEquals(Duration.ofDays(400), policy.delayBefore(2));
        assertEquals(Duration.ofDays(500), policy.delayBefore(3));
        assertEquals(Duration.ofDays(500), policy.delayBefore(31));
        assertEquals(Duration.ofDays(500), policy.delayBefore(40));
    }

    @Test
    void rateLimiterGatesEveryAttempt() throws Exception {
        SlidingWindowRateLimiter tight = new SlidingWindowRateLimiter(1, Duration.ZERO, clock, sleeper);
        RetryController retry = new RetryController(
                new RetryPolicy(2, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ZERO), tight, sleeper);

        retry.run(attempt -> {
            if (attempt == 1) {
                throw transientFailure();
            }
            return attempt;
        });

        // backoff of 2s, then the limiter holds the second attempt for the rest of the minute
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(58)), sleeper.sleeps());
    }

    private static AcsRequestException transientFailure() {
        return new AcsRequestException(AcsRequestException.Kind.TRANSIENT, 503, "unavailable");
    }
}
