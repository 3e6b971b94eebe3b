package com.ziplens.index;

import com.ziplens.core.model.ZipRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class RecordStore {
    private final Map<String, ZipRecord> byZip;

    RecordStore() {
        this.byZip = new LinkedHashMap<>();
    }

    private RecordStore(Map<String, ZipRecord> byZip) {
        this.byZip = byZip;
    }

    RecordStore copy() {
        return new RecordStore(new LinkedHashMap<>(byZip));
    }

    /**
     * Returns the record that was replaced, if any.
     */
    Optional<ZipRecord> put(ZipRecord record) {
        return Optional.ofNullable(byZip.put(record.zip(), record));
    }

    Optional<ZipRecord> get(String normalizedZip) {
        return Optional.ofNullable(byZip.get(normalizedZip));
    }

    Collection<ZipRecord> all() {
        return Collections.unmodifiableCollection(byZip.values());
    }

    List<String> keys() {
        return new ArrayList<>(byZip.keySet());
    }

    int size() {
        return byZip.size();
    }
}
