package com.ziplens.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ZIP code centroid with its place names and demographic summary.
 * Latitude and longitude are nullable in source files; the index rejects records that lack either.
 */
public record ZipRecord(
        String zip,
        Double lat,
        Double lng,
        String city,
        @JsonProperty("state_id") String stateId,
        @JsonProperty("county_fips") String countyFips,
        @JsonProperty("county_name") String countyName,
        long population,
        double density,
        String timezone,
        boolean zcta
) {
    public boolean hasCoordinates() {
        return lat != null && lng != null;
    }

    public ZipRecord withZip(String normalizedZip) {
        return new ZipRecord(
                normalizedZip,
                lat,
                lng,
                city,
                stateId,
                countyFips,
                countyName,
                population,
                density,
                timezone,
                zcta
        );
    }
}
