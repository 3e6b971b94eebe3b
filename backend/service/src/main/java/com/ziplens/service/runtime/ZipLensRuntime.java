package com.ziplens.service.runtime;

import com.ziplens.core.bus.EventBus;
import com.ziplens.index.LoadReport;
import com.ziplens.index.ZipIndex;
import com.ziplens.index.ZipIndexLoader;
import com.ziplens.service.acs.HttpAcsTransport;
import com.ziplens.service.cache.CacheStore;
import com.ziplens.service.cache.JsonFileKeyValueStore;
import com.ziplens.service.cache.SweepResult;
import com.ziplens.service.config.FetchServiceConfig;
import com.ziplens.service.diagnostics.FetchDiagnostics;
import com.ziplens.service.fetch.FetchService;
import com.ziplens.service.ratelimit.Sleeper;
import com.ziplens.service.ratelimit.SlidingWindowRateLimiter;
import com.ziplens.service.retry.RetryController;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Wires the index, the cache and the fetch pipeline together and owns the worker pool.
 * The index file is read on first use.
 */
public final class ZipLensRuntime implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(ZipLensRuntime.class.getName());

    private final ZipIndex index;
    private final Path indexFile;
    private final FetchService fetchService;
    private final FetchDiagnostics diagnostics;
    private final ExecutorService workers;
    private final Object indexLock = new Object();

    public ZipLensRuntime(
            ZipIndex index,
            Path indexFile,
            FetchService fetchService,
            FetchDiagnostics diagnostics,
            ExecutorService workers
    ) {
        this.index = index;
        this.indexFile = indexFile;
        this.fetchService = fetchService;
        this.diagnostics = diagnostics;
        this.workers = workers;
    }

    public static ZipLensRuntime create(FetchServiceConfig config, String apiKey, Path cacheFile, Path indexFile, Clock clock) {
        if (apiKey == null) {
            LOGGER.warning("No Census API key configured; requests will be sent without a key");
        }
        EventBus eventBus = new EventBus();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        CacheStore cache = new CacheStore(
                new JsonFileKeyValueStore(cacheFile),
                config.cacheVersion(),
                config.cacheTtl(),
                config.quotaEvictionCount(),
                config.maxCacheBytes(),
                clock
        );
        Sleeper sleeper = Sleeper.system();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(config.requestsPerMinute(), config.rateLimitSlack(), clock, sleeper);
        RetryController retry = new RetryController(config.retryPolicy(), limiter, sleeper);
        ExecutorService workers = Executors.newFixedThreadPool(config.workerThreads(), workerThreadFactory());
        FetchDiagnostics diagnostics = new FetchDiagnostics(eventBus, clock);
        FetchService fetchService = new FetchService(
                new HttpAcsTransport(httpClient, config.baseUrl(), apiKey, config.requestTimeout()),
                cache,
                retry,
                limiter,
                workers,
                eventBus,
                clock,
                config.fetchSettings()
        );
        SweepResult swept = fetchService.sweepCache();
        if (swept.total() > 0) {
            LOGGER.info(() -> "Startup cache sweep removed " + swept.expiredRemoved() + " expired and "
                    + swept.corruptRemoved() + " corrupt entries");
        }
        return new ZipLensRuntime(new ZipIndex(eventBus, clock), indexFile, fetchService, diagnostics, workers);
    }

    /**
     * The ZIP index, loaded from the index file on the first call when it is not loaded yet.
     */
    public ZipIndex index() {
        synchronized (indexLock) {
            if (!index.isLoaded() && indexFile != null) {
                if (!Files.exists(indexFile)) {
                    throw new IllegalStateException("ZIP index file not found: " + indexFile);
                }
                LoadReport report = ZipIndexLoader.load(index, indexFile);
                if (report.rejected() > 0) {
                    LOGGER.warning(() -> "Skipped " + report.rejected() + " invalid records from " + indexFile);
                }
            }
        }
        return index;
    }

    public FetchService fetchService() {
        return fetchService;
    }

    public FetchDiagnostics diagnostics() {
        return diagnostics;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "acs-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
