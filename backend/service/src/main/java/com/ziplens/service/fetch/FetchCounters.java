package com.ziplens.service.fetch;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

final class FetchCounters {
    private final LongAdder total = new LongAdder();
    private final LongAdder successful = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder durationMillis = new LongAdder();
    private final AtomicInteger active = new AtomicInteger();

    void requestStarted() {
        active.incrementAndGet();
    }

    void requestFinished(boolean success, long elapsedMillis) {
        active.decrementAndGet();
        total.increment();
        durationMillis.add(elapsedMillis);
        if (success) {
            successful.increment();
        } else {
            failed.increment();
        }
    }

    void cacheHit() {
        cacheHits.increment();
    }

    void cacheMiss() {
        cacheMisses.increment();
    }

    FetchStats snapshot() {
        long requests = total.sum();
        double average = requests == 0 ? 0.0 : (double) durationMillis.sum() / requests;
        return new FetchStats(requests, successful.sum(), failed.sum(), cacheHits.sum(), cacheMisses.sum(), average, active.get());
    }

    void reset() {
        total.reset();
        successful.reset();
        failed.reset();
        cacheHits.reset();
        cacheMisses.reset();
        durationMillis.reset();
    }
}
