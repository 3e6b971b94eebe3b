package com.ziplens.core.model;

public record RadiusMatch(ZipRecord record, double distanceKm) {
    public String zip() {
        return record.zip();
    }
}
