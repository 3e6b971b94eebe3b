package com.ziplens.service.config;

import com.ziplens.service.acs.HttpAcsTransport;
import com.ziplens.service.cache.CacheStore;
import com.ziplens.service.fetch.FetchSettings;
import com.ziplens.service.ratelimit.SlidingWindowRateLimiter;
import com.ziplens.service.retry.RetryPolicy;

import java.time.Duration;

/**
 * Contents of {@code fetch.json}. Absent fields take the defaults below; durations are ISO-8601
 * strings such as {@code "PT30S"}.
 */
public record FetchServiceConfig(
        String baseUrl,
        Integer year,
        String dataset,
        Integer maxRetries,
        Duration requestTimeout,
        Integer batchSize,
        Integer requestsPerMinute,
        Duration rateLimitSlack,
        Duration backoffBase,
        Duration backoffCap,
        Duration rateLimitCooldown,
        String cacheVersion,
        Duration cacheTtl,
        Integer quotaEvictionCount,
        Long maxCacheBytes,
        Integer workerThreads
) {
    public static final int DEFAULT_REQUESTS_PER_MINUTE = 50;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_CACHE_VERSION = "1.0";
    public static final int DEFAULT_WORKER_THREADS = 4;

    public FetchServiceConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? HttpAcsTransport.DEFAULT_BASE_URL : baseUrl;
        year = year == null ? FetchSettings.DEFAULT_YEAR : year;
        dataset = dataset == null || dataset.isBlank() ? FetchSettings.DEFAULT_DATASET : dataset;
        maxRetries = maxRetries == null ? FetchSettings.DEFAULT_MAX_ATTEMPTS : maxRetries;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        batchSize = batchSize == null ? FetchSettings.DEFAULT_BATCH_SIZE : batchSize;
        requestsPerMinute = requestsPerMinute == null ? DEFAULT_REQUESTS_PER_MINUTE : requestsPerMinute;
        rateLimitSlack = rateLimitSlack == null ? SlidingWindowRateLimiter.DEFAULT_SLACK : rateLimitSlack;
        backoffBase = backoffBase == null ? RetryPolicy.DEFAULT_BASE_DELAY : backoffBase;
        backoffCap = backoffCap == null ? RetryPolicy.DEFAULT_MAX_DELAY : backoffCap;
        rateLimitCooldown = rateLimitCooldown == null ? Duration.ZERO : rateLimitCooldown;
        cacheVersion = cacheVersion == null || cacheVersion.isBlank() ? DEFAULT_CACHE_VERSION : cacheVersion;
        cacheTtl = cacheTtl == null ? CacheStore.DEFAULT_TTL : cacheTtl;
        quotaEvictionCount = quotaEvictionCount == null ? CacheStore.DEFAULT_QUOTA_EVICTION_COUNT : quotaEvictionCount;
        maxCacheBytes = maxCacheBytes == null ? CacheStore.DEFAULT_MAX_BYTES : maxCacheBytes;
        workerThreads = workerThreads == null ? DEFAULT_WORKER_THREADS : workerThreads;
        if (maxRetries <= 0 || batchSize <= 0 || requestsPerMinute <= 0 || workerThreads <= 0) {
            throw new IllegalArgumentException("maxRetries, batchSize, requestsPerMinute and workerThreads must be positive");
        }
    }

    public static FetchServiceConfig defaults() {
        return new FetchServiceConfig(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    public FetchSettings fetchSettings() {
        return new FetchSettings(dataset, year, batchSize, maxRetries);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, backoffBase, backoffCap, rateLimitCooldown);
    }
}
