package com.ziplens.service.cache;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

public final class InMemoryKeyValueStore implements KeyValueStore {
    public static final long UNLIMITED = 0;

    private final long quotaBytes;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, String> values = new HashMap<>();
    private long usedBytes;

    public InMemoryKeyValueStore() {
        this(UNLIMITED);
    }

    /**
     * @param quotaBytes capacity in key plus value characters, {@link #UNLIMITED} for none
     */
    public InMemoryKeyValueStore(long quotaBytes) {
        this.quotaBytes = quotaBytes;
    }

    @Override
    public Optional<String> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(values.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, String value) {
        lock.lock();
        try {
            String previous = values.get(key);
            long next = usedBytes + entrySize(key, value) - (previous == null ? 0 : entrySize(key, previous));
            if (quotaBytes > UNLIMITED && next > quotaBytes) {
                throw new StorageQuotaExceededException(quotaBytes, next);
            }
            values.put(key, value);
            usedBytes = next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String key) {
        lock.lock();
        try {
            String previous = values.remove(key);
            if (previous == null) {
                return false;
            }
            usedBytes -= entrySize(key, previous);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> keys() {
        lock.lock();
        try {
            return new LinkedHashSet<>(values.keySet());
        } finally {
            lock.unlock();
        }
    }

    public long usedBytes() {
        lock.lock();
        try {
            return usedBytes;
        } finally {
            lock.unlock();
        }
    }

    static long entrySize(String key, String value) {
        return (long) key.length() + value.length();
    }
}
