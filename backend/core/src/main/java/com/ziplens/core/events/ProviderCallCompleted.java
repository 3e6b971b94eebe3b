package com.ziplens.core.events;

import java.time.Instant;

public record ProviderCallCompleted(
        Instant timestamp,
        int zipCount,
        int attempt,
        boolean success,
        long durationMillis,
        String error
) implements Event {
    @Override
    public String type() {
        return "ProviderCallCompleted";
    }
}
