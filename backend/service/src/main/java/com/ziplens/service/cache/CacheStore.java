package com.ziplens.service.cache;

import com.ziplens.core.model.ValueMetadata;
import com.ziplens.core.model.ZipValues;
import com.ziplens.core.util.JsonUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expiring cache of per-ZIP variable values on top of a {@link KeyValueStore}.
 *
 * <p>All keys live under a version-stamped namespace prefix; other keys in the backing store are
 * never read or touched. Sizes are measured in key plus value characters. One lock guards every
 * operation, so a reader never observes a sweep or an eviction halfway through.
 */
public final class CacheStore {
    private static final Logger LOGGER = Logger.getLogger(CacheStore.class.getName());

    public static final Duration DEFAULT_TTL = Duration.ofDays(30);
    public static final int DEFAULT_QUOTA_EVICTION_COUNT = 20;
    public static final long DEFAULT_MAX_BYTES = 50L * 1024 * 1024;
    static final int MIN_BUDGET_EVICTION_COUNT = 50;
    private static final long MEGABYTE = 1024L * 1024;

    private final KeyValueStore backing;
    private final String cacheVersion;
    private final String namespace;
    private final Duration ttl;
    private final int quotaEvictionCount;
    private final long maxBytes;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public CacheStore(KeyValueStore backing, String cacheVersion, Clock clock) {
        this(backing, cacheVersion, DEFAULT_TTL, DEFAULT_QUOTA_EVICTION_COUNT, DEFAULT_MAX_BYTES, clock);
    }

    public CacheStore(
            KeyValueStore backing,
            String cacheVersion,
            Duration ttl,
            int quotaEvictionCount,
            long maxBytes,
            Clock clock
    ) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.backing = backing;
        this.cacheVersion = cacheVersion;
        this.namespace = CacheKeys.namespace(cacheVersion);
        this.ttl = ttl;
        this.quotaEvictionCount = quotaEvictionCount;
        this.maxBytes = maxBytes;
        this.clock = clock;
    }

    public String keyFor(String zip, List<String> variables) {
        return CacheKeys.key(namespace, zip, variables);
    }

    public Optional<ZipValues> get(String key) {
        lock.lock();
        try {
            Optional<String> raw = backing.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            Optional<CacheEntry> entry = decode(key, raw.get());
            if (entry.isEmpty()) {
                backing.remove(key);
                return Optional.empty();
            }
            if (isExpired(entry.get(), clock.instant())) {
                backing.remove(key);
                return Optional.empty();
            }
            return Optional.of(new ZipValues(entry.get().data(), entry.get().metadata()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes with expiry now + TTL. On a quota failure the oldest entries are evicted and the
     * write is tried exactly once more; a second quota failure propagates.
     */
    public void put(String key, ZipValues values) {
        if (!key.startsWith(namespace)) {
            throw new IllegalArgumentException("Key is outside cache namespace " + namespace + ": " + key);
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            ValueMetadata metadata = values.metadata() == null
                    ? new ValueMetadata(null, "api", null, null, now, now, cacheVersion)
                    : values.metadata().cached(now, cacheVersion);
            String json = JsonUtils.toJson(new CacheEntry(values.data(), metadata, now.plus(ttl)));
            try {
                backing.put(key, json);
            } catch (StorageQuotaExceededException quota) {
                int evicted = evictOldest(quotaEvictionCount);
                LOGGER.warning(() -> "Cache storage quota exceeded; evicted " + evicted + " oldest entries and retrying write");
                backing.put(key, json);
            }
            enforceBudget();
        } finally {
            lock.unlock();
        }
    }

    public SweepResult sweep() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> expired = new ArrayList<>();
            List<String> corrupt = new ArrayList<>();
            for (String key : namespacedKeys()) {
                Optional<String> raw = backing.get(key);
                if (raw.isEmpty()) {
                    continue;
                }
                Optional<CacheEntry> entry = decode(key, raw.get());
                if (entry.isEmpty()) {
                    corrupt.add(key);
                } else if (isExpired(entry.get(), now)) {
                    expired.add(key);
                }
            }
            backing.removeAll(expired);
            backing.removeAll(corrupt);
            SweepResult result = new SweepResult(expired.size(), corrupt.size());
            if (result.total() > 0) {
                LOGGER.info(() -> "Cache sweep removed " + result.expiredRemoved() + " expired and "
                        + result.corruptRemoved() + " unreadable entries");
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int clear() {
        lock.lock();
        try {
            return backing.removeAll(namespacedKeys());
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return namespacedKeys().size();
        } finally {
            lock.unlock();
        }
    }

    public long sizeBytes() {
        lock.lock();
        try {
            return namespaceSize();
        } finally {
            lock.unlock();
        }
    }

    public int expiredCount() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int expired = 0;
            for (String key : namespacedKeys()) {
                Optional<CacheEntry> entry = backing.get(key).flatMap(raw -> decode(key, raw));
                if (entry.isPresent() && isExpired(entry.get(), now)) {
                    expired++;
                }
            }
            return expired;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(namespacedKeys().size(), namespaceSize(), expiredCount(), maxBytes);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes up to {@code count} entries with the oldest write time; unreadable entries rank first.
     */
    int evictOldest(int count) {
        if (count <= 0) {
            return 0;
        }
        List<RankedKey> ranked = new ArrayList<>();
        for (String key : namespacedKeys()) {
            Instant cachedAt = backing.get(key)
                    .flatMap(raw -> decode(key, raw))
                    .map(entry -> entry.metadata() == null ? null : entry.metadata().cachedAt())
                    .orElse(Instant.EPOCH);
            ranked.add(new RankedKey(key, cachedAt == null ? Instant.EPOCH : cachedAt));
        }
        ranked.sort(Comparator.comparing(RankedKey::cachedAt).thenComparing(RankedKey::key));
        List<String> victims = new ArrayList<>();
        for (RankedKey rankedKey : ranked.subList(0, Math.min(count, ranked.size()))) {
            victims.add(rankedKey.key());
        }
        return backing.removeAll(victims);
    }

    private void enforceBudget() {
        long size = namespaceSize();
        if (maxBytes <= 0 || size <= maxBytes) {
            return;
        }
        long overMegabytes = (long) Math.ceil((size - maxBytes * 0.8) / MEGABYTE);
        int toEvict = (int) Math.max(MIN_BUDGET_EVICTION_COUNT, overMegabytes * 10);
        int evicted = evictOldest(toEvict);
        LOGGER.info(() -> "Cache exceeded " + maxBytes + " bytes (" + size + "); evicted " + evicted + " oldest entries");
    }

    private List<String> namespacedKeys() {
        List<String> keys = new ArrayList<>();
        for (String key : backing.keys()) {
            if (key.startsWith(namespace)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private long namespaceSize() {
        long total = 0;
        for (String key : namespacedKeys()) {
            Optional<String> raw = backing.get(key);
            if (raw.isPresent()) {
                total += InMemoryKeyValueStore.entrySize(key, raw.get());
            }
        }
        return total;
    }

    private static boolean isExpired(CacheEntry entry, Instant now) {
        return entry.expiry() == null || now.isAfter(entry.expiry());
    }

    private static Optional<CacheEntry> decode(String key, String raw) {
        try {
            CacheEntry entry = JsonUtils.fromJson(raw, CacheEntry.class);
            if (entry == null || entry.data() == null) {
                LOGGER.fine(() -> "Dropping cache entry without data: " + key);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IllegalArgumentException unreadable) {
            LOGGER.log(Level.FINE, "Dropping unreadable cache entry " + key, unreadable);
            return Optional.empty();
        }
    }

    private record RankedKey(String key, Instant cachedAt) {
    }
}
