package com.ziplens.core.events;

import java.time.Instant;
import java.util.List;

public record FetchStarted(
        Instant timestamp,
        String requestId,
        List<String> zips,
        List<String> variables
) implements Event {
    @Override
    public String type() {
        return "FetchStarted";
    }
}
