package com.ziplens.core.model;

import java.time.Instant;

public record ValueMetadata(
        String name,
        String source,
        String dataset,
        String year,
        Instant fetchedAt,
        Instant cachedAt,
        String cacheVersion
) {
    public static ValueMetadata fromApi(String name, String dataset, String year, Instant fetchedAt) {
        return new ValueMetadata(name, "api", dataset, year, fetchedAt, null, null);
    }

    public ValueMetadata cached(Instant at, String version) {
        return new ValueMetadata(name, source, dataset, year, fetchedAt, at, version);
    }

    public ValueMetadata withSource(String newSource) {
        return new ValueMetadata(name, newSource, dataset, year, fetchedAt, cachedAt, cacheVersion);
    }
}
