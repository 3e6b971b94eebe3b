package com.ziplens.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ziplens.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Whole-file JSON object of string values. Every mutation rewrites the file through a temp
 * file and an atomic move, so a crash leaves either the old or the new map on disk.
 */
public final class JsonFileKeyValueStore implements KeyValueStore {
    private final Path file;
    private final long quotaBytes;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, String> values = new LinkedHashMap<>();
    private long usedBytes;

    public JsonFileKeyValueStore(Path file) {
        this(file, InMemoryKeyValueStore.UNLIMITED);
    }

    public JsonFileKeyValueStore(Path file, long quotaBytes) {
        this.file = file;
        this.quotaBytes = quotaBytes;
        load();
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
            long next = usedBytes + InMemoryKeyValueStore.entrySize(key, value)
                    - (previous == null ? 0 : InMemoryKeyValueStore.entrySize(key, previous));
            if (quotaBytes > InMemoryKeyValueStore.UNLIMITED && next > quotaBytes) {
                throw new StorageQuotaExceededException(quotaBytes, next);
            }
            values.put(key, value);
            usedBytes = next;
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String key) {
        lock.lock();
        try {
            boolean removed = removeQuietly(key);
            if (removed) {
                persist();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int removeAll(Collection<String> keys) {
        lock.lock();
        try {
            int removed = 0;
            for (String key : keys) {
                if (removeQuietly(key)) {
                    removed++;
                }
            }
            if (removed > 0) {
                persist();
            }
            return removed;
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

    private boolean removeQuietly(String key) {
        String previous = values.remove(key);
        if (previous == null) {
            return false;
        }
        usedBytes -= InMemoryKeyValueStore.entrySize(key, previous);
        return true;
    }

    private void load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                Map<String, String> loaded = JsonUtils.objectMapper().readValue(in, new TypeReference<LinkedHashMap<String, String>>() {
                });
                if (loaded == null) {
                    return;
                }
                for (Map.Entry<String, String> entry : loaded.entrySet()) {
                    if (entry.getValue() == null) {
                        continue;
                    }
                    values.put(entry.getKey(), entry.getValue());
                    usedBytes += InMemoryKeyValueStore.entrySize(entry.getKey(), entry.getValue());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read key/value store " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            JsonUtils.objectMapper().writeValue(tmp.toFile(), values);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write key/value store " + file, e);
        }
    }
}
