package com.ziplens.index;

import com.ziplens.core.model.RadiusMatch;
import com.ziplens.core.model.ZipRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed 0.5 degree latitude/longitude buckets over every record that has coordinates.
 * Built once from a snapshot of records and never mutated afterwards.
 */
final class SpatialGridIndex {
    static final double CELL_DEGREES = 0.5;
    static final int MIN_LAT_CELL = bucket(-90);
    static final int MAX_LAT_CELL = bucket(90);
    static final int MIN_LNG_CELL = bucket(-180);
    static final int MAX_LNG_CELL = bucket(180);

    private final Map<CellKey, List<ZipRecord>> cells;

    private SpatialGridIndex(Map<CellKey, List<ZipRecord>> cells) {
        this.cells = cells;
    }

    static SpatialGridIndex empty() {
        return new SpatialGridIndex(Map.of());
    }

    static SpatialGridIndex build(Collection<ZipRecord> records) {
        Map<CellKey, List<ZipRecord>> cells = new HashMap<>();
        for (ZipRecord record : records) {
            if (!record.hasCoordinates()) {
                continue;
            }
            cells.computeIfAbsent(CellKey.of(record.lat(), record.lng()), ignored -> new ArrayList<>()).add(record);
        }
        return new SpatialGridIndex(cells);
    }

    /**
     * Stops scanning as soon as {@code limit} matches are collected and returns them in scan order.
     * Only a scan that finishes under the limit is sorted by distance.
     */
    List<RadiusMatch> searchRadius(double lat, double lng, double radiusKm, int limit) {
        double latDelta = GeoMath.latDegreesFor(radiusKm);
        double lngDelta = GeoMath.lngDegreesFor(radiusKm, lat);
        int minLatCell = Math.max(MIN_LAT_CELL, bucket(lat - latDelta));
        int maxLatCell = Math.min(MAX_LAT_CELL, bucket(lat + latDelta));
        int minLngCell = MIN_LNG_CELL;
        int maxLngCell = MAX_LNG_CELL;
        // near the poles or for very large radii the box covers every longitude
        if (Double.isFinite(lngDelta) && lngDelta < 180) {
            minLngCell = Math.max(MIN_LNG_CELL, bucket(lng - lngDelta));
            maxLngCell = Math.min(MAX_LNG_CELL, bucket(lng + lngDelta));
        }

        List<RadiusMatch> matches = new ArrayList<>();
        for (int latCell = minLatCell; latCell <= maxLatCell; latCell++) {
            for (int lngCell = minLngCell; lngCell <= maxLngCell; lngCell++) {
                List<ZipRecord> cell = cells.get(new CellKey(latCell, lngCell));
                if (cell == null) {
                    continue;
                }
                for (ZipRecord record : cell) {
                    double distance = GeoMath.haversineKm(lat, lng, record.lat(), record.lng());
                    if (distance > radiusKm) {
                        continue;
                    }
                    matches.add(new RadiusMatch(record, distance));
                    if (matches.size() >= limit) {
                        return matches;
                    }
                }
            }
        }
        matches.sort(Comparator.comparingDouble(RadiusMatch::distanceKm));
        return matches;
    }

    List<ZipRecord> searchBoundingBox(double minLat, double minLng, double maxLat, double maxLng, int limit) {
        List<ZipRecord> out = new ArrayList<>();
        for (int latCell = bucket(minLat); latCell <= bucket(maxLat); latCell++) {
            for (int lngCell = bucket(minLng); lngCell <= bucket(maxLng); lngCell++) {
                List<ZipRecord> cell = cells.get(new CellKey(latCell, lngCell));
                if (cell == null) {
                    continue;
                }
                for (ZipRecord record : cell) {
                    if (record.lat() < minLat || record.lat() > maxLat || record.lng() < minLng || record.lng() > maxLng) {
                        continue;
                    }
                    out.add(record);
                    if (out.size() >= limit) {
                        return out;
                    }
                }
            }
        }
        return out;
    }

    int cellCount() {
        return cells.size();
    }

    int pointCount() {
        int total = 0;
        for (List<ZipRecord> cell : cells.values()) {
            total += cell.size();
        }
        return total;
    }

    static int bucket(double degrees) {
        return (int) Math.floor(degrees / CELL_DEGREES);
    }

    record CellKey(int latCell, int lngCell) {
        static CellKey of(double lat, double lng) {
            return new CellKey(bucket(lat), bucket(lng));
        }
    }
}
