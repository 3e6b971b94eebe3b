package com.ziplens.core.events;

import java.time.Instant;

public record IndexLoaded(
        Instant timestamp,
        int accepted,
        int rejected,
        int totalRecords,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "IndexLoaded";
    }
}
