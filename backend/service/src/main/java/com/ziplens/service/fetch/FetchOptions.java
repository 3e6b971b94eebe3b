package com.ziplens.service.fetch;

/**
 * Per-call overrides.
 *
 * @param batchSize   ZIPs per provider request; 0 uses the service default
 * @param bypassCache skip the cache lookup (results are still written back)
 */
public record FetchOptions(int batchSize, boolean bypassCache) {
    public FetchOptions {
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize must not be negative");
        }
    }

    public static FetchOptions defaults() {
        return new FetchOptions(0, false);
    }

    public static FetchOptions withBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        return new FetchOptions(batchSize, false);
    }
}
