package com.ziplens.service.cache;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Durable string key/value persistence underneath {@link CacheStore}. Implementations must be
 * safe for concurrent use.
 */
public interface KeyValueStore {
    Optional<String> get(String key);

    /**
     * @throws StorageQuotaExceededException when the write would push the store past its capacity
     */
    void put(String key, String value);

    boolean remove(String key);

    default int removeAll(Collection<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (remove(key)) {
                removed++;
            }
        }
        return removed;
    }

    Set<String> keys();
}
