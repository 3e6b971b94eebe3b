package com.ziplens.index;

import com.ziplens.core.bus.EventBus;
import com.ziplens.core.events.IndexLoaded;
import com.ziplens.core.model.RadiusMatch;
import com.ziplens.core.model.ZipRecord;
import com.ziplens.core.util.ZipCodes;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Query surface over the loaded ZIP records: exact lookup, state/city/county categories, and
 * spatial radius and bounding-box search.
 *
 * <p>Every load builds a fresh {@link IndexState} and publishes it through a single volatile
 * write, so readers always see a complete index and never lock. Loads and clears serialize on
 * a writer lock.
 */
public final class ZipIndex {
    private static final Logger LOGGER = Logger.getLogger(ZipIndex.class.getName());

    private final EventBus eventBus;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile IndexState state = IndexState.empty();

    public ZipIndex() {
        this(new EventBus(), Clock.systemUTC());
    }

    public ZipIndex(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public LoadReport load(Collection<ZipRecord> records) {
        return load(records, null);
    }

    /**
     * @param sources labels naming where each record came from ("line 4", "#2"), parallel to
     *                {@code records}; rejections of records without a usable ZIP carry that label
     */
    LoadReport load(Collection<ZipRecord> records, List<String> sources) {
        if (sources != null && sources.size() != records.size()) {
            throw new IllegalArgumentException("Expected one source label per record");
        }
        long started = System.nanoTime();
        writeLock.lock();
        try {
            IndexState current = state;
            RecordStore store = current.records().copy();
            CategoryIndex byState = current.byState().copy();
            CategoryIndex byCity = current.byCity().copy();
            CategoryIndex byCounty = current.byCounty().copy();

            int accepted = 0;
            int replaced = 0;
            List<LoadReport.Rejection> rejections = new ArrayList<>();
            int position = 0;
            for (ZipRecord raw : records) {
                position++;
                String problem = validate(raw);
                if (problem != null) {
                    String source = raw == null || raw.zip() == null || raw.zip().isBlank() ? sourceLabel(sources, position) : raw.zip();
                    rejections.add(new LoadReport.Rejection(source, problem));
                    continue;
                }
                ZipRecord record = raw.withZip(ZipCodes.normalize(raw.zip()));
                Optional<ZipRecord> previous = store.put(record);
                if (previous.isPresent()) {
                    replaced++;
                    unindex(previous.get(), byState, byCity, byCounty);
                }
                index(record, byState, byCity, byCounty);
                accepted++;
            }

            long indexStarted = System.nanoTime();
            SpatialGridIndex grid = SpatialGridIndex.build(store.all());
            long indexMillis = (System.nanoTime() - indexStarted) / 1_000_000;
            long loadMillis = (System.nanoTime() - started) / 1_000_000;

            state = new IndexState(store, byState, byCity, byCounty, grid, true, loadMillis, indexMillis);
            LoadReport report = new LoadReport(accepted, replaced, rejections, loadMillis);
            LOGGER.info(() -> "Indexed " + report.accepted() + " ZIP records (" + report.rejected()
                    + " rejected) into " + grid.cellCount() + " grid cells in " + loadMillis + " ms");
            eventBus.publish(new IndexLoaded(clock.instant(), accepted, report.rejected(), store.size(), loadMillis));
            return report;
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<ZipRecord> get(String zip) {
        if (!ZipCodes.isNormalizable(zip)) {
            return Optional.empty();
        }
        return state.records().get(ZipCodes.normalize(zip));
    }

    public List<ZipRecord> byState(String stateId, int limit) {
        requirePositive(limit);
        if (stateId == null || stateId.isBlank()) {
            return List.of();
        }
        IndexState snapshot = state;
        return resolve(snapshot, snapshot.byState().zips(stateKey(stateId)), limit);
    }

    public List<ZipRecord> byCounty(String countyFips, int limit) {
        requirePositive(limit);
        if (countyFips == null || countyFips.isBlank()) {
            return List.of();
        }
        IndexState snapshot = state;
        return resolve(snapshot, snapshot.byCounty().zips(countyFips.trim()), limit);
    }

    /**
     * Case-insensitive substring match on city name, optionally restricted to one state.
     */
    public List<ZipRecord> byCity(String cityName, String stateId, int limit) {
        requirePositive(limit);
        if (cityName == null) {
            return List.of();
        }
        String term = cityName.trim().toLowerCase(Locale.ROOT);
        String wantedState = stateId == null || stateId.isBlank() ? null : stateKey(stateId);
        IndexState snapshot = state;
        Set<String> zips = snapshot.byCity().matchingZips((key, ignored) -> {
            int comma = key.lastIndexOf(',');
            String city = key.substring(0, comma);
            String state = key.substring(comma + 1);
            return city.contains(term) && (wantedState == null || wantedState.equals(state));
        }, limit);
        return resolve(snapshot, zips, limit);
    }

    public List<RadiusMatch> searchRadius(double lat, double lng, double radiusKm, int limit) {
        requirePositive(limit);
        requireCoordinate(lat, lng);
        if (!Double.isFinite(radiusKm) || radiusKm < 0) {
            throw new IllegalArgumentException("radiusKm must be a finite value, zero or positive");
        }
        return state.grid().searchRadius(lat, lng, radiusKm, limit);
    }

    public List<ZipRecord> searchBoundingBox(double minLat, double minLng, double maxLat, double maxLng, int limit) {
        requirePositive(limit);
        requireCoordinate(minLat, minLng);
        requireCoordinate(maxLat, maxLng);
        if (minLat > maxLat || minLng > maxLng) {
            throw new IllegalArgumentException("Bounding box minimum must not exceed maximum");
        }
        return state.grid().searchBoundingBox(minLat, minLng, maxLat, maxLng, limit);
    }

    public List<ZipRecord> randomSample(int count) {
        return randomSample(count, ThreadLocalRandom.current());
    }

    public List<ZipRecord> randomSample(int count, Random random) {
        IndexState snapshot = state;
        List<String> keys = snapshot.records().keys();
        Collections.shuffle(keys, random);
        List<ZipRecord> sample = new ArrayList<>();
        for (String zip : keys.subList(0, Math.min(Math.max(count, 0), keys.size()))) {
            snapshot.records().get(zip).ifPresent(sample::add);
        }
        return sample;
    }

    public List<ZipRecord> export(int limit) {
        requirePositive(limit);
        List<ZipRecord> out = new ArrayList<>();
        for (ZipRecord record : state.records().all()) {
            out.add(record);
            if (out.size() >= limit) {
                break;
            }
        }
        return out;
    }

    public IndexStats stats() {
        IndexState snapshot = state;
        return new IndexStats(
                snapshot.records().size(),
                snapshot.byState().size(),
                snapshot.byCity().size(),
                snapshot.byCounty().size(),
                snapshot.grid().cellCount(),
                snapshot.grid().pointCount(),
                snapshot.loaded(),
                snapshot.lastLoadMillis(),
                snapshot.lastIndexMillis()
        );
    }

    public boolean isLoaded() {
        return state.loaded();
    }

    public void clear() {
        writeLock.lock();
        try {
            state = IndexState.empty();
        } finally {
            writeLock.unlock();
        }
    }

    private static String sourceLabel(List<String> sources, int position) {
        return sources == null ? "#" + position : sources.get(position - 1);
    }

    private static String validate(ZipRecord record) {
        if (record == null) {
            return "record is null";
        }
        if (record.zip() == null || record.zip().isBlank()) {
            return "missing zip";
        }
        if (!ZipCodes.isNormalizable(record.zip())) {
            return "zip must be 1 to 5 digits";
        }
        if (!record.hasCoordinates()) {
            return "missing coordinates";
        }
        if (Math.abs(record.lat()) > 90 || Math.abs(record.lng()) > 180) {
            return "coordinates out of range";
        }
        if (record.population() < 0 || record.density() < 0) {
            return "population and density must be non-negative";
        }
        return null;
    }

    private static void index(ZipRecord record, CategoryIndex byState, CategoryIndex byCity, CategoryIndex byCounty) {
        if (record.stateId() != null && !record.stateId().isBlank()) {
            byState.add(stateKey(record.stateId()), record.zip());
        }
        if (record.city() != null && !record.city().isBlank()) {
            byCity.add(cityKey(record), record.zip());
        }
        if (record.countyFips() != null && !record.countyFips().isBlank()) {
            byCounty.add(record.countyFips().trim(), record.zip());
        }
    }

    private static void unindex(ZipRecord record, CategoryIndex byState, CategoryIndex byCity, CategoryIndex byCounty) {
        if (record.stateId() != null && !record.stateId().isBlank()) {
            byState.remove(stateKey(record.stateId()), record.zip());
        }
        if (record.city() != null && !record.city().isBlank()) {
            byCity.remove(cityKey(record), record.zip());
        }
        if (record.countyFips() != null && !record.countyFips().isBlank()) {
            byCounty.remove(record.countyFips().trim(), record.zip());
        }
    }

    private static String stateKey(String stateId) {
        return stateId.trim().toUpperCase(Locale.ROOT);
    }

    private static String cityKey(ZipRecord record) {
        String state = record.stateId() == null ? "" : stateKey(record.stateId());
        return record.city().trim().toLowerCase(Locale.ROOT) + "," + state;
    }

    private static List<ZipRecord> resolve(IndexState snapshot, Collection<String> zips, int limit) {
        List<ZipRecord> out = new ArrayList<>();
        for (String zip : zips) {
            snapshot.records().get(zip).ifPresent(out::add);
            if (out.size() >= limit) {
                break;
            }
        }
        return out;
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    private static void requireCoordinate(double lat, double lng) {
        if (Double.isNaN(lat) || Double.isNaN(lng) || Math.abs(lat) > 90 || Math.abs(lng) > 180) {
            throw new IllegalArgumentException("Coordinates out of range: " + lat + "," + lng);
        }
    }

    private record IndexState(
            RecordStore records,
            CategoryIndex byState,
            CategoryIndex byCity,
            CategoryIndex byCounty,
            SpatialGridIndex grid,
            boolean loaded,
            long lastLoadMillis,
            long lastIndexMillis
    ) {
        private static IndexState empty() {
            return new IndexState(
                    new RecordStore(),
                    new CategoryIndex(),
                    new CategoryIndex(),
                    new CategoryIndex(),
                    SpatialGridIndex.empty(),
                    false,
                    0,
                    0
            );
        }
    }
}
