package com.ziplens.core.events;

import java.time.Instant;

public record CacheSwept(Instant timestamp, int expiredRemoved, int corruptRemoved) implements Event {
    @Override
    public String type() {
        return "CacheSwept";
    }
}
