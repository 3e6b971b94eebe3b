package com.ziplens.service.cache;

import com.ziplens.core.model.ValueMetadata;

import java.time.Instant;
import java.util.Map;

record CacheEntry(Map<String, Double> data, ValueMetadata metadata, Instant expiry) {
}
