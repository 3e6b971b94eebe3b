package com.ziplens.index;

import java.util.ArrayList;
import java.util.List;

public record LoadReport(int accepted, int replaced, List<Rejection> rejections, long durationMillis) {
    public LoadReport {
        rejections = List.copyOf(rejections);
    }

    public int rejected() {
        return rejections.size();
    }

    public LoadReport withParseRejections(List<Rejection> parseRejections) {
        if (parseRejections.isEmpty()) {
            return this;
        }
        List<Rejection> merged = new ArrayList<>(parseRejections);
        merged.addAll(rejections);
        return new LoadReport(accepted, replaced, merged, durationMillis);
    }

    /**
     * A source entry that was not indexed. {@code source} is the ZIP when known, otherwise a row or position label.
     */
    public record Rejection(String source, String reason) {
    }
}
