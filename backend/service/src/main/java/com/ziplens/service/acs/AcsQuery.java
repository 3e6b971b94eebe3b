package com.ziplens.service.acs;

import java.util.List;

/**
 * One provider call: a set of variables for a batch of ZIP code tabulation areas.
 */
public record AcsQuery(String dataset, int year, List<String> variables, List<String> zips) {
    public AcsQuery {
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("dataset is required");
        }
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("At least one variable is required");
        }
        if (zips == null || zips.isEmpty()) {
            throw new IllegalArgumentException("At least one ZIP is required");
        }
        variables = List.copyOf(variables);
        zips = List.copyOf(zips);
    }
}
