package com.ziplens.index;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Category key to the ZIPs filed under it, both in insertion order.
 */
final class CategoryIndex {
    private final Map<String, LinkedHashSet<String>> zipsByKey;

    CategoryIndex() {
        this.zipsByKey = new LinkedHashMap<>();
    }

    private CategoryIndex(Map<String, LinkedHashSet<String>> zipsByKey) {
        this.zipsByKey = zipsByKey;
    }

    CategoryIndex copy() {
        Map<String, LinkedHashSet<String>> copied = new LinkedHashMap<>();
        for (Map.Entry<String, LinkedHashSet<String>> entry : zipsByKey.entrySet()) {
            copied.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }
        return new CategoryIndex(copied);
    }

    void add(String key, String zip) {
        zipsByKey.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(zip);
    }

    void remove(String key, String zip) {
        LinkedHashSet<String> zips = zipsByKey.get(key);
        if (zips == null) {
            return;
        }
        zips.remove(zip);
        if (zips.isEmpty()) {
            zipsByKey.remove(key);
        }
    }

    Set<String> zips(String key) {
        LinkedHashSet<String> zips = zipsByKey.get(key);
        return zips == null ? Set.of() : zips;
    }

    Set<String> matchingZips(BiPredicate<String, Set<String>> keyFilter, int limit) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, LinkedHashSet<String>> entry : zipsByKey.entrySet()) {
            if (!keyFilter.test(entry.getKey(), entry.getValue())) {
                continue;
            }
            for (String zip : entry.getValue()) {
                out.add(zip);
                if (out.size() >= limit) {
                    return out;
                }
            }
        }
        return out;
    }

    int size() {
        return zipsByKey.size();
    }
}
