package com.ziplens.service.fetch;

import com.ziplens.core.model.ZipValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one fetch call. Every requested ZIP ends up in exactly one of {@code values},
 * {@code missing} or the ZIP list of one entry in {@code failures}.
 */
public record FetchResult(
        String requestId,
        Map<String, ZipValues> values,
        List<String> missing,
        List<BatchFailure> failures,
        int cached,
        int fetched,
        long durationMillis
) {
    public FetchResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        missing = List.copyOf(missing);
        failures = List.copyOf(failures);
    }

    public boolean complete() {
        return missing.isEmpty() && failures.isEmpty();
    }

    public List<String> failedZips() {
        return failures.stream().flatMap(failure -> failure.zips().stream()).toList();
    }
}
