package com.ziplens.service.fetch;

import com.ziplens.core.bus.EventBus;
import com.ziplens.core.events.BatchFailed;
import com.ziplens.core.events.CacheSwept;
import com.ziplens.core.events.FetchCompleted;
import com.ziplens.core.events.FetchStarted;
import com.ziplens.core.events.ProviderCallCompleted;
import com.ziplens.core.events.ZipsMissing;
import com.ziplens.core.model.ZipValues;
import com.ziplens.core.util.ZipCodes;
import com.ziplens.service.acs.AcsQuery;
import com.ziplens.service.acs.AcsRequestException;
import com.ziplens.service.acs.AcsResponseParser;
import com.ziplens.service.acs.AcsTable;
import com.ziplens.service.acs.AcsTransport;
import com.ziplens.service.acs.CredentialStatus;
import com.ziplens.service.cache.CacheStats;
import com.ziplens.service.cache.CacheStore;
import com.ziplens.service.cache.SweepResult;
import com.ziplens.service.ratelimit.SlidingWindowRateLimiter;
import com.ziplens.service.retry.RetryController;
import com.ziplens.service.retry.RetryExhaustedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Cache-first retrieval of ACS variables for ZIP code tabulation areas.
 *
 * <p>Cache misses are split into batches, one provider request per batch. Batches of one call
 * run concurrently on the supplied executor and share the rate limiter and the cache; a batch's
 * own retries run sequentially. A batch that gives up is reported next to whatever succeeded.
 */
public final class FetchService {
    private static final Logger LOGGER = Logger.getLogger(FetchService.class.getName());
    static final String PROBE_VARIABLE = "B01003_001E";
    static final String PROBE_ZIP = "10001";

    private final AcsTransport transport;
    private final CacheStore cache;
    private final RetryController retry;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Executor executor;
    private final EventBus eventBus;
    private final Clock clock;
    private final FetchSettings settings;
    private final FetchCounters counters = new FetchCounters();

    public FetchService(
            AcsTransport transport,
            CacheStore cache,
            RetryController retry,
            SlidingWindowRateLimiter rateLimiter,
            Executor executor,
            EventBus eventBus,
            Clock clock,
            FetchSettings settings
    ) {
        this.transport = transport;
        this.cache = cache;
        this.retry = retry;
        this.rateLimiter = rateLimiter;
        this.executor = executor;
        this.eventBus = eventBus;
        this.clock = clock;
        this.settings = settings;
    }

    public FetchResult fetchVariables(Collection<String> zips, List<String> variables) throws InterruptedException {
        return fetchVariables(zips, variables, FetchOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException for an empty or malformed ZIP list or an empty variable list,
     *                                  before any cache or network access
     */
    public FetchResult fetchVariables(Collection<String> zips, List<String> variables, FetchOptions options)
            throws InterruptedException {
        if (zips == null || zips.isEmpty()) {
            throw new IllegalArgumentException("At least one ZIP is required");
        }
        List<String> normalizedZips = ZipCodes.normalizeAll(zips);
        List<String> normalizedVariables = normalizeVariables(variables);
        FetchOptions effective = options == null ? FetchOptions.defaults() : options;
        int batchSize = effective.batchSize() > 0 ? effective.batchSize() : settings.batchSize();

        String requestId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        eventBus.publish(new FetchStarted(started, requestId, normalizedZips, normalizedVariables));

        Map<String, ZipValues> values = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        for (String zip : normalizedZips) {
            Optional<ZipValues> hit = effective.bypassCache() ? Optional.empty() : readCache(zip, normalizedVariables);
            if (hit.isPresent()) {
                counters.cacheHit();
                values.put(zip, hit.get());
            } else {
                if (!effective.bypassCache()) {
                    counters.cacheMiss();
                }
                misses.add(zip);
            }
        }
        int cachedCount = values.size();

        List<CompletableFuture<BatchOutcome>> pending = new ArrayList<>();
        for (List<String> batch : partition(misses, batchSize)) {
            pending.add(CompletableFuture.supplyAsync(() -> runBatch(requestId, batch, normalizedVariables), executor));
        }

        List<String> missing = new ArrayList<>();
        List<BatchFailure> failures = new ArrayList<>();
        int fetchedCount = 0;
        for (CompletableFuture<BatchOutcome> future : pending) {
            BatchOutcome outcome = await(future);
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
                continue;
            }
            for (String zip : outcome.zips()) {
                ZipValues fetched = outcome.values().get(zip);
                if (fetched == null) {
                    missing.add(zip);
                    continue;
                }
                writeCache(zip, normalizedVariables, fetched);
                values.put(zip, fetched);
                fetchedCount++;
            }
        }

        if (!missing.isEmpty()) {
            eventBus.publish(new ZipsMissing(clock.instant(), requestId, missing));
        }
        long durationMillis = Duration.between(started, clock.instant()).toMillis();
        eventBus.publish(new FetchCompleted(clock.instant(), requestId, normalizedZips.size(),
                cachedCount, fetchedCount, missing.size(), failures.size(), durationMillis));
        int fetchedTotal = fetchedCount;
        LOGGER.info(() -> "Fetch " + requestId + ": " + normalizedZips.size() + " ZIPs, " + cachedCount + " cached, "
                + fetchedTotal + " fetched, " + missing.size() + " missing, " + failures.size() + " failed batches");
        return new FetchResult(requestId, ordered(normalizedZips, values), missing, failures, cachedCount, fetchedCount, durationMillis);
    }

    public Optional<ZipValues> fetchSingle(String zip, List<String> variables) throws InterruptedException {
        String normalized = ZipCodes.normalize(zip);
        FetchResult result = fetchVariables(List.of(normalized), variables);
        return Optional.ofNullable(result.values().get(normalized));
    }

    /**
     * Issues one small request and classifies the answer. Never throws for provider failures.
     */
    public CredentialStatus validateCredential() throws InterruptedException {
        AcsQuery probe = new AcsQuery(settings.dataset(), settings.year(), List.of(PROBE_VARIABLE), List.of(PROBE_ZIP));
        rateLimiter.admit();
        try {
            CredentialStatus status = CredentialStatus.fromHttpStatus(transport.probe(probe));
            LOGGER.info(() -> "API key validation: " + status.status());
            return status;
        } catch (AcsRequestException e) {
            LOGGER.warning(() -> "API key validation failed: " + e.getMessage());
            return new CredentialStatus(CredentialStatus.Status.ERROR, e.statusCode(), e.getMessage());
        }
    }

    public int clearCache() {
        int removed = cache.clear();
        LOGGER.info(() -> "Cleared " + removed + " cache entries");
        return removed;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public SweepResult sweepCache() {
        SweepResult result = cache.sweep();
        eventBus.publish(new CacheSwept(clock.instant(), result.expiredRemoved(), result.corruptRemoved()));
        return result;
    }

    public FetchStats stats() {
        return counters.snapshot();
    }

    public void resetStats() {
        counters.reset();
    }

    private BatchOutcome runBatch(String requestId, List<String> batch, List<String> variables) {
        AcsQuery query = new AcsQuery(settings.dataset(), settings.year(), variables, batch);
        AtomicInteger attempts = new AtomicInteger();
        try {
            AcsTable table = retry.run(attempt -> {
                attempts.set(attempt);
                return call(query, attempt);
            }, settings.maxAttempts());
            Map<String, ZipValues> parsed = AcsResponseParser.parse(table, variables, settings.dataset(), settings.year(), clock.instant());
            return BatchOutcome.success(batch, parsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(requestId, batch, attempts.get(), "Interrupted while fetching batch");
        } catch (RetryExhaustedException e) {
            return failed(requestId, batch, e.attempts(), e.getMessage());
        } catch (RuntimeException e) {
            return failed(requestId, batch, Math.max(1, attempts.get()), e.getMessage());
        }
    }

    private AcsTable call(AcsQuery query, int attempt) {
        counters.requestStarted();
        Instant callStarted = clock.instant();
        boolean success = false;
        String error = null;
        try {
            AcsTable table = transport.fetch(query);
            success = true;
            return table;
        } catch (RuntimeException e) {
            error = e.getMessage();
            throw e;
        } finally {
            long elapsed = Duration.between(callStarted, clock.instant()).toMillis();
            counters.requestFinished(success, elapsed);
            eventBus.publish(new ProviderCallCompleted(clock.instant(), query.zips().size(), attempt, success, elapsed, error));
        }
    }

    private BatchOutcome failed(String requestId, List<String> batch, int attempts, String message) {
        LOGGER.warning(() -> "Batch of " + batch.size() + " ZIPs failed after " + attempts + " attempt(s): " + message);
        eventBus.publish(new BatchFailed(clock.instant(), requestId, batch, attempts, message));
        return BatchOutcome.failure(new BatchFailure(batch, attempts, message));
    }

    private Optional<ZipValues> readCache(String zip, List<String> variables) {
        try {
            return cache.get(cache.keyFor(zip, variables))
                    .map(hit -> new ZipValues(hit.data(), hit.metadata() == null ? null : hit.metadata().withSource("cache")));
        } catch (RuntimeException e) {
            LOGGER.warning(() -> "Cache read failed for ZIP " + zip + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String zip, List<String> variables, ZipValues values) {
        try {
            cache.put(cache.keyFor(zip, variables), values);
        } catch (RuntimeException e) {
            LOGGER.warning(() -> "Cache write failed for ZIP " + zip + ": " + e.getMessage());
        }
    }

    private static BatchOutcome await(CompletableFuture<BatchOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch task failed unexpectedly", e.getCause());
        }
    }

    private static List<String> normalizeVariables(List<String> variables) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("At least one variable is required");
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String variable : variables) {
            if (variable == null || variable.isBlank()) {
                throw new IllegalArgumentException("Variable names must not be blank");
            }
            distinct.add(variable.trim());
        }
        return List.copyOf(distinct);
    }

    static List<List<String>> partition(List<String> zips, int batchSize) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < zips.size(); i += batchSize) {
            batches.add(List.copyOf(zips.subList(i, Math.min(zips.size(), i + batchSize))));
        }
        return batches;
    }

    private static Map<String, ZipValues> ordered(List<String> requested, Map<String, ZipValues> values) {
        Map<String, ZipValues> ordered = new LinkedHashMap<>();
        for (String zip : requested) {
            ZipValues value = values.get(zip);
            if (value != null) {
                ordered.put(zip, value);
            }
        }
        return ordered;
    }

    private record BatchOutcome(List<String> zips, Map<String, ZipValues> values, BatchFailure failure) {
        private static BatchOutcome success(List<String> zips, Map<String, ZipValues> values) {
            return new BatchOutcome(zips, values, null);
        }

        private static BatchOutcome failure(BatchFailure failure) {
            return new BatchOutcome(failure.zips(), Map.of(), failure);
        }
    }
}
