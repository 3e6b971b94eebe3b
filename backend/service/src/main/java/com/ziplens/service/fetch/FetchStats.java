package com.ziplens.service.fetch;

public record FetchStats(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long cacheHits,
        long cacheMisses,
        double averageRequestMillis,
        int activeRequests
) {
    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups == 0 ? 0.0 : (double) cacheHits / lookups;
    }
}
