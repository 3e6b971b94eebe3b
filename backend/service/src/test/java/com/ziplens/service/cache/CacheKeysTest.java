package com.ziplens.service.cache;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheKeysTest {
    @Test
    void variableOrderAndDuplicatesDoNotChangeKey() {
        String namespace = CacheKeys.namespace("1.0");

        String a = CacheKeys.key(namespace, "10001", List.of("B19013_001E", "B01003_001E"));
        String b = CacheKeys.key(namespace, "10001", List.of("B01003_001E", "B19013_001E", "B01003_001E"));

        assertEquals(a, b);
    }

    @Test
    void keyLayoutIsNamespaceZipAndShortHash() {
        String key = CacheKeys.key(CacheKeys.namespace("1.0"), "02108", List.of("B01003_001E"));

        assertTrue(key.startsWith("acs_cache_v1.0_02108_"));
        assertEquals("acs_cache_v1.0_02108_".length() + 16, key.length());
        assertTrue(key.substring("acs_cache_v1.0_02108_".length()).matches("[0-9a-f]{16}"));
    }

    @Test
    void differentVariableSetsOrVersionsGiveDifferentKeys() {
        String base = CacheKeys.key(CacheKeys.namespace("1.0"), "10001", List.of("B01003_001E"));

        assertNotEquals(base, CacheKeys.key(CacheKeys.namespace("1.0"), "10001", List.of("B19013_001E")));
        assertNotEquals(base, CacheKeys.key(CacheKeys.namespace("1.1"), "10001", List.of("B01003_001E")));
        assertNotEquals(base, CacheKeys.key(CacheKeys.namespace("1.0"), "10002", List.of("B01003_001E")));
    }
}
