package com.ziplens.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Admits at most {@code ceiling} requests in any trailing 60 second window.
 *
 * <p>Pruning, the count check and recording the admitted timestamp happen under one lock, so
 * concurrent callers cannot both take the last free slot. Waiting happens outside the lock and
 * every wake-up re-checks the window from scratch.
 */
public final class SlidingWindowRateLimiter {
    private static final Logger LOGGER = Logger.getLogger(SlidingWindowRateLimiter.class.getName());

    public static final Duration WINDOW = Duration.ofMinutes(1);
    public static final Duration DEFAULT_SLACK = Duration.ofMillis(100);

    private final int ceiling;
    private final Duration slack;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ArrayDeque<Instant> admitted = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlidingWindowRateLimiter(int ceiling, Clock clock, Sleeper sleeper) {
        this(ceiling, DEFAULT_SLACK, clock, sleeper);
    }

    public SlidingWindowRateLimiter(int ceiling, Duration slack, Clock clock, Sleeper sleeper) {
        if (ceiling <= 0) {
            throw new IllegalArgumentException("Rate limit ceiling must be positive");
        }
        this.ceiling = ceiling;
        this.slack = slack;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until one more request fits in the window, records it and returns its admission time.
     */
    public Instant admit() throws InterruptedException {
        while (true) {
            Duration wait;
            lock.lock();
            try {
                Instant now = clock.instant();
                prune(now);
                if (admitted.size() < ceiling) {
                    admitted.addLast(now);
                    return now;
                }
                Instant oldest = admitted.peekFirst();
                wait = WINDOW.minus(Duration.between(oldest, now)).plus(slack);
            } finally {
                lock.unlock();
            }
            if (wait.isNegative() || wait.isZero()) {
                wait = slack.isZero() ? Duration.ofMillis(1) : slack;
            }
            Duration waitFor = wait;
            LOGGER.info(() -> "Rate limit of " + ceiling + "/min reached, waiting " + waitFor.toMillis() + " ms");
            sleeper.sleep(waitFor);
        }
    }

    public int windowCount() {
        lock.lock();
        try {
            prune(clock.instant());
            return admitted.size();
        } finally {
            lock.unlock();
        }
    }

    private void prune(Instant now) {
        Instant threshold = now.minus(WINDOW);
        while (!admitted.isEmpty()) {
            Instant first = admitted.peekFirst();
            if (first != null && !first.isAfter(threshold)) {
                admitted.removeFirst();
            } else {
                break;
            }
        }
    }
}
