package com.ziplens.service.fetch;

public record FetchSettings(String dataset, int year, int batchSize, int maxAttempts) {
    public static final String DEFAULT_DATASET = "acs/acs5";
    public static final int DEFAULT_YEAR = 2022;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public FetchSettings {
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("dataset is required");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
    }

    public static FetchSettings defaults() {
        return new FetchSettings(DEFAULT_DATASET, DEFAULT_YEAR, DEFAULT_BATCH_SIZE, DEFAULT_MAX_ATTEMPTS);
    }
}
