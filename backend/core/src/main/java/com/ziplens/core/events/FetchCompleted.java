package com.ziplens.core.events;

import java.time.Instant;

public record FetchCompleted(
        Instant timestamp,
        String requestId,
        int requested,
        int cached,
        int fetched,
        int missing,
        int failedBatches,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FetchCompleted";
    }
}
