package com.ziplens.service.fetch;

import java.util.List;

public record BatchFailure(List<String> zips, int attempts, String message) {
    public BatchFailure {
        zips = List.copyOf(zips);
    }
}
