package com.ziplens.core.events;

import java.time.Instant;
import java.util.List;

public record BatchFailed(
        Instant timestamp,
        String requestId,
        List<String> zips,
        int attempts,
        String message
) implements Event {
    @Override
    public String type() {
        return "BatchFailed";
    }
}
