package com.ziplens.service.cache;

import com.ziplens.core.model.ValueMetadata;
import com.ziplens.core.model.ZipValues;
import com.ziplens.core.util.JsonUtils;
import com.ziplens.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheStoreTest {
    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    private static final List<String> VARS = List.of("B01003_001E", "B19013_001E");

    @Test
    void storesAndReturnsValuesWithCacheMetadata() {
        MutableClock clock = new MutableClock(START);
        CacheStore cache = new CacheStore(new InMemoryKeyValueStore(), "1.0", clock);
        String key = cache.keyFor("10001", VARS);

        cache.put(key, values(42.0));

        ZipValues hit = cache.get(key).orElseThrow();
        assertEquals(42.0, hit.value("B01003_001E"));
        assertEquals(START, hit.metadata().cachedAt());
        assertEquals("1.0", hit.metadata().cacheVersion());
        assertEquals("api", hit.metadata().source());
        assertTrue(key.startsWith("acs_cache_v1.0_10001_"));
    }

    @Test
    void blankProviderValuesSurviveAsNull() {
        CacheStore cache = new CacheStore(new InMemoryKeyValueStore(), "1.0", new MutableClock(START));
        String key = cache.keyFor("10001", VARS);
        Map<String, Double> data = new LinkedHashMap<>();
        data.put("B01003_001E", 5.0);
        data.put("B19013_001E", null);

        cache.put(key, new ZipValues(data, ValueMetadata.fromApi("ZCTA5 10001", "acs/acs5", "2022", START)));

        ZipValues hit = cache.get(key).orElseThrow();
        assertEquals(5.0, hit.value("B01003_001E"));
        assertNull(hit.value("B19013_001E"));
    }

    @Test
    void entryExpiresOnlyAfterTtlHasPassed() {
        MutableClock clock = new MutableClock(START);
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(backing, "1.0", clock);
        String key = cache.keyFor("10001", VARS);
        cache.put(key, values(1.0));

        clock.advance(Duration.ofDays(30));
        assertTrue(cache.get(key).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(key).isEmpty());
        assertFalse(backing.keys().contains(key));
    }

    @Test
    void unreadableEntryIsTreatedAsMissAndRemoved() {
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(backing, "1.0", new MutableClock(START));
        String key = cache.keyFor("10001", VARS);
        backing.put(key, "{not json");

        assertTrue(cache.get(key).isEmpty());
        assertFalse(backing.keys().contains(key));
    }

    @Test
    void sweepRemovesExpiredAndCorruptEntriesButLeavesForeignKeys() {
        MutableClock clock = new MutableClock(START);
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(backing, "1.0", clock);
        cache.put(cache.keyFor("10001", VARS), values(1.0));
        clock.advance(Duration.ofDays(20));
        cache.put(cache.keyFor("10002", VARS), values(2.0));
        backing.put(cache.keyFor("10003", VARS), "garbage");
        backing.put("unrelated_key", "garbage");
        backing.put("acs_cache_v0.9_10001_abc", "garbage");

        clock.advance(Duration.ofDays(15));
        SweepResult result = cache.sweep();

        assertEquals(1, result.expiredRemoved());
        assertEquals(1, result.corruptRemoved());
        assertEquals(1, cache.count());
        assertTrue(cache.get(cache.keyFor("10002", VARS)).isPresent());
        assertTrue(backing.keys().contains("unrelated_key"));
        assertTrue(backing.keys().contains("acs_cache_v0.9_10001_abc"));
    }

    @Test
    void secondSweepWithoutWritesChangesNothing() {
        MutableClock clock = new MutableClock(START);
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(backing, "1.0", clock);
        cache.put(cache.keyFor("10001", VARS), values(1.0));
        clock.advance(Duration.ofDays(20));
        cache.put(cache.keyFor("10002", VARS), values(2.0));
        cache.put(cache.keyFor("10004", VARS), values(4.0));
        backing.put(cache.keyFor("10003", VARS), "garbage");
        clock.advance(Duration.ofDays(15));

        SweepResult first = cache.sweep();
        int countAfterFirst = cache.count();
        long sizeAfterFirst = cache.sizeBytes();
        SweepResult second = cache.sweep();

        assertEquals(2, first.total());
        assertEquals(0, second.total());
        assertEquals(2, countAfterFirst);
        assertEquals(countAfterFirst, cache.count());
        assertEquals(sizeAfterFirst, cache.sizeBytes());
    }

    @Test
    void clearOnlyTouchesOwnNamespace() {
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(backing, "2.0", new MutableClock(START));
        cache.put(cache.keyFor("10001", VARS), values(1.0));
        cache.put(cache.keyFor("10002", VARS), values(2.0));
        backing.put("acs_cache_v1.0_10001_x", "old");

        assertEquals(2, cache.clear());
        assertEquals(0, cache.count());
        assertEquals(Set.of("acs_cache_v1.0_10001_x"), backing.keys());
    }

    @Test
    void quotaFailureEvictsOldestEntriesAndRetriesOnce() {
        MutableClock clock = new MutableClock(START);
        long entrySize = measureEntrySize();
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore(entrySize * 3);
        CacheStore cache = new CacheStore(backing, "1.0", CacheStore.DEFAULT_TTL, 2, 0, clock);

        for (String zip : List.of("10001", "10002", "10003")) {
            cache.put(cache.keyFor(zip, VARS), values(1.0));
            clock.advance(Duration.ofSeconds(1));
        }
        cache.put(cache.keyFor("10004", VARS), values(1.0));

        assertEquals(2, cache.count());
        assertTrue(cache.get(cache.keyFor("10001", VARS)).isEmpty());
        assertTrue(cache.get(cache.keyFor("10002", VARS)).isEmpty());
        assertTrue(cache.get(cache.keyFor("10003", VARS)).isPresent());
        assertTrue(cache.get(cache.keyFor("10004", VARS)).isPresent());
    }

    @Test
    void secondQuotaFailurePropagates() {
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore(10);
        CacheStore cache = new CacheStore(backing, "1.0", new MutableClock(START));

        assertThrows(StorageQuotaExceededException.class, () -> cache.put(cache.keyFor("10001", VARS), values(1.0)));
    }

    @Test
    void exceedingSizeBudgetEvictsOldestBatch() {
        MutableClock clock = new MutableClock(START);
        long entrySize = measureEntrySize();
        CacheStore cache = new CacheStore(new InMemoryKeyValueStore(), "1.0", CacheStore.DEFAULT_TTL,
                CacheStore.DEFAULT_QUOTA_EVICTION_COUNT, entrySize * 60, clock);

        for (int i = 0; i < 61; i++) {
            cache.put(cache.keyFor(String.format("%05d", 10000 + i), VARS), values(1.0));
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(61 - CacheStore.MIN_BUDGET_EVICTION_COUNT, cache.count());
        assertTrue(cache.get(cache.keyFor("10000", VARS)).isEmpty());
        assertTrue(cache.get(cache.keyFor("10060", VARS)).isPresent());
    }

    @Test
    void rejectsKeysOutsideNamespace() {
        CacheStore cache = new CacheStore(new InMemoryKeyValueStore(), "1.0", new MutableClock(START));

        assertThrows(IllegalArgumentException.class, () -> cache.put("other_10001", values(1.0)));
    }

    @Test
    void statsReportCountSizeAndExpired() {
        MutableClock clock = new MutableClock(START);
        CacheStore cache = new CacheStore(new InMemoryKeyValueStore(), "1.0", clock);
        cache.put(cache.keyFor("10001", VARS), values(1.0));
        clock.advance(Duration.ofDays(31));
        cache.put(cache.keyFor("10002", VARS), values(2.0));

        CacheStats stats = cache.stats();

        assertEquals(2, stats.count());
        assertEquals(1, stats.expired());
        assertEquals(cache.sizeBytes(), stats.sizeBytes());
        assertTrue(stats.sizeBytes() > 0);
        assertEquals(CacheStore.DEFAULT_MAX_BYTES, stats.maxBytes());
    }

    private static long measureEntrySize() {
        InMemoryKeyValueStore probe = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(probe, "1.0", new MutableClock(START));
        cache.put(cache.keyFor("10001", VARS), values(1.0));
        return probe.usedBytes();
    }

    private static ZipValues values(double population) {
        return new ZipValues(Map.of("B01003_001E", population),
                ValueMetadata.fromApi("ZCTA5", "acs/acs5", "2022", START));
    }

    @Test
    void storedEntryIsPlainJson() throws Exception {
        InMemoryKeyValueStore backing = new InMemoryKeyValueStore();
        CacheStore cache = new CacheStore(backing, "1.0", new MutableClock(START));
        String key = cache.keyFor("10001", VARS);
        cache.put(key, values(7.0));

        String raw = backing.get(key).orElseThrow();
        assertEquals(7.0, JsonUtils.objectMapper().readTree(raw).path("data").path("B01003_001E").asDouble());
        assertTrue(raw.contains("\"expiry\":\"2026-03-31T00:00:00Z\""));
    }
}
