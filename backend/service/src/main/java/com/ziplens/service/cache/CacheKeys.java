package com.ziplens.service.cache;

import com.ziplens.core.util.HashingUtils;

import java.util.Collection;
import java.util.TreeSet;

public final class CacheKeys {
    private static final int VARIABLE_HASH_LENGTH = 16;

    private CacheKeys() {
    }

    public static String namespace(String cacheVersion) {
        return "acs_cache_v" + cacheVersion + "_";
    }

    /**
     * {@code namespace + zip + "_" + first 16 hex chars of SHA-256(sorted distinct variables joined by ",")}.
     * Order and duplicates in {@code variables} do not change the key.
     */
    public static String key(String namespace, String zip, Collection<String> variables) {
        String joined = String.join(",", new TreeSet<>(variables));
        return namespace + zip + "_" + HashingUtils.sha256(joined).substring(0, VARIABLE_HASH_LENGTH);
    }
}
