package com.ziplens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable values for one ZIP. A variable the provider left blank maps to {@code null}.
 */
public record ZipValues(Map<String, Double> data, ValueMetadata metadata) {
    public ZipValues {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Double value(String variable) {
        return data.get(variable);
    }
}
