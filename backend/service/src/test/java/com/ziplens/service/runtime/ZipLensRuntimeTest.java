package com.ziplens.service.runtime;

import com.ziplens.service.config.FetchServiceConfig;
import com.ziplens.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZipLensRuntimeTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void startupSweepDropsUnreadableAndExpiredEntries() throws Exception {
        Path dir = Files.createTempDirectory("ziplens-runtime-");
        Path cacheFile = dir.resolve("acs-cache.json");
        Files.writeString(cacheFile, """
                {
                  "acs_cache_v1.0_10001_0123456789abcdef": "{broken",
                  "acs_cache_v1.0_10002_0123456789abcdef": "{\\"data\\":{\\"X\\":1.0},\\"expiry\\":\\"2026-01-01T00:00:00Z\\"}",
                  "acs_cache_v1.0_10003_0123456789abcdef": "{\\"data\\":{\\"X\\":2.0},\\"expiry\\":\\"2026-12-01T00:00:00Z\\"}",
                  "someone_else": "kept"
                }
                """);

        try (ZipLensRuntime runtime = ZipLensRuntime.create(FetchServiceConfig.defaults(), "key", cacheFile,
                dir.resolve("zips.json"), new MutableClock(NOW))) {
            assertEquals(1, runtime.fetchService().cacheStats().count());
            assertNotNull(runtime.diagnostics().snapshot().get("lastSweepAt"));
        }
        String persisted = Files.readString(cacheFile);
        assertTrue(persisted.contains("someone_else"));
        assertFalse(persisted.contains("10001"));
    }

    @Test
    void indexIsLoadedOnFirstUse() throws Exception {
        Path dir = Files.createTempDirectory("ziplens-runtime-");
        Path indexFile = dir.resolve("zips.csv");
        Files.writeString(indexFile, "zip,lat,lng,city,state_id\n10001,40.75,-73.99,New York,NY\n");

        try (ZipLensRuntime runtime = ZipLensRuntime.create(FetchServiceConfig.defaults(), null, dir.resolve("cache.json"),
                indexFile, new MutableClock(NOW))) {
            assertEquals("New York", runtime.index().get("10001").orElseThrow().city());
            assertEquals(1, runtime.index().stats().totalRecords());
        }
    }

    @Test
    void missingIndexFileIsReported() throws Exception {
        Path dir = Files.createTempDirectory("ziplens-runtime-");

        try (ZipLensRuntime runtime = ZipLensRuntime.create(FetchServiceConfig.defaults(), null, dir.resolve("cache.json"),
                dir.resolve("absent.json"), new MutableClock(NOW))) {
            IllegalStateException error = assertThrows(IllegalStateException.class, runtime::index);
            assertTrue(error.getMessage().contains("absent.json"));
        }
    }
}
