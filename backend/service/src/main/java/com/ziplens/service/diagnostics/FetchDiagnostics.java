package com.ziplens.service.diagnostics;

import com.ziplens.core.bus.EventBus;
import com.ziplens.core.events.BatchFailed;
import com.ziplens.core.events.CacheSwept;
import com.ziplens.core.events.FetchCompleted;
import com.ziplens.core.events.ProviderCallCompleted;
import com.ziplens.core.events.ZipsMissing;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Event-fed view of recent fetch activity: a bounded ring of recent errors and the number of
 * provider calls in the trailing minute.
 */
public final class FetchDiagnostics {
    public static final int MAX_ERRORS = 100;

    private final Clock clock;
    private final ArrayDeque<ErrorEntry> errors = new ArrayDeque<>();
    private final ArrayDeque<Instant> recentCalls = new ArrayDeque<>();
    private final Object lock = new Object();
    private final LongAdder fetchesCompleted = new LongAdder();
    private final LongAdder zipsMissing = new LongAdder();
    private volatile Instant lastSweepAt;

    public FetchDiagnostics(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribe(ProviderCallCompleted.class, this::onProviderCall);
        eventBus.subscribe(BatchFailed.class, this::onBatchFailed);
        eventBus.subscribe(ZipsMissing.class, event -> zipsMissing.add(event.zips().size()));
        eventBus.subscribe(FetchCompleted.class, event -> fetchesCompleted.increment());
        eventBus.subscribe(CacheSwept.class, event -> lastSweepAt = event.timestamp());
    }

    /**
     * Most recent first.
     */
    public List<ErrorEntry> recentErrors(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<ErrorEntry> recent = new ArrayList<>();
        synchronized (lock) {
            Iterator<ErrorEntry> newestFirst = errors.descendingIterator();
            while (newestFirst.hasNext() && recent.size() < limit) {
                recent.add(newestFirst.next());
            }
        }
        return recent;
    }

    public int requestsPerMinute() {
        synchronized (lock) {
            trimOld(clock.instant());
            return recentCalls.size();
        }
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("requestsPerMinute", requestsPerMinute());
        snapshot.put("fetchesCompleted", fetchesCompleted.sum());
        snapshot.put("zipsMissing", zipsMissing.sum());
        synchronized (lock) {
            snapshot.put("errorCount", errors.size());
        }
        snapshot.put("lastSweepAt", lastSweepAt == null ? null : lastSweepAt.toString());
        return snapshot;
    }

    private void onProviderCall(ProviderCallCompleted event) {
        synchronized (lock) {
            recentCalls.addLast(event.timestamp());
            trimOld(clock.instant());
            if (!event.success()) {
                record(new ErrorEntry(event.timestamp(), "provider_call",
                        "Attempt " + event.attempt() + " for " + event.zipCount() + " ZIPs failed: " + event.error()));
            }
        }
    }

    private void onBatchFailed(BatchFailed event) {
        synchronized (lock) {
            record(new ErrorEntry(event.timestamp(), "batch",
                    "Batch " + event.zips() + " gave up after " + event.attempts() + " attempt(s): " + event.message()));
        }
    }

    private void record(ErrorEntry entry) {
        errors.addLast(entry);
        while (errors.size() > MAX_ERRORS) {
            errors.removeFirst();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentCalls.isEmpty()) {
            Instant first = recentCalls.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentCalls.removeFirst();
            } else {
                break;
            }
        }
    }

    public record ErrorEntry(Instant timestamp, String category, String message) {
    }
}
