package com.ziplens.service.cache;

public record CacheStats(int count, long sizeBytes, int expired, long maxBytes) {
}
