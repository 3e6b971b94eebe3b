package com.ziplens.core.events;

import java.time.Instant;
import java.util.List;

public record ZipsMissing(Instant timestamp, String requestId, List<String> zips) implements Event {
    @Override
    public String type() {
        return "ZipsMissing";
    }
}
