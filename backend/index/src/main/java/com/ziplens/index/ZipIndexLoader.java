package com.ziplens.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.ziplens.core.model.ZipRecord;
import com.ziplens.core.util.JsonUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ZIP record files into a {@link ZipIndex}. JSON may be an array of records or an object
 * keyed by ZIP; CSV needs a header row. Bad entries are reported in the {@link LoadReport} and
 * skipped, they never fail the whole load.
 */
public final class ZipIndexLoader {
    private static final Pattern CSV_FIELD = Pattern.compile("(?:,|^)(?:\"([^\"]*(?:\"\"[^\"]*)*)\"|([^\",]*))");

    private ZipIndexLoader() {
    }

    public static LoadReport load(ZipIndex index, Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return loadCsv(index, file);
        }
        return loadJson(index, file);
    }

    public static LoadReport loadJson(ZipIndex index, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return loadJson(index, in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read ZIP index file " + file, e);
        }
    }

    public static LoadReport loadJson(ZipIndex index, InputStream in) throws IOException {
        JsonNode root = JsonUtils.objectMapper().readTree(in);
        List<ZipRecord> records = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        List<LoadReport.Rejection> rejections = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return index.load(records);
        }
        if (root.isArray()) {
            int position = 0;
            for (JsonNode node : root) {
                position++;
                addJsonRecord(node, null, "#" + position, records, sources, rejections);
            }
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addJsonRecord(field.getValue(), field.getKey(), field.getKey(), records, sources, rejections);
            }
        } else {
            throw new IllegalArgumentException("ZIP index JSON must be an array or an object keyed by ZIP");
        }
        return index.load(records, sources).withParseRejections(rejections);
    }

    public static LoadReport loadCsv(ZipIndex index, Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return loadCsv(index, reader);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read ZIP index file " + file, e);
        }
    }

    public static LoadReport loadCsv(ZipIndex index, Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<ZipRecord> records = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        List<LoadReport.Rejection> rejections = new ArrayList<>();
        String headerLine = reader.readLine();
        if (headerLine == null || headerLine.isBlank()) {
            return index.load(records);
        }
        List<String> headers = new ArrayList<>();
        for (String header : headerLine.split(",")) {
            headers.add(header.trim().replace("\"", ""));
        }

        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(parseCsvRow(headers, splitCsv(line)));
                sources.add("line " + lineNumber);
            } catch (IllegalArgumentException rowError) {
                rejections.add(new LoadReport.Rejection("line " + lineNumber, rowError.getMessage()));
            }
        }
        return index.load(records, sources).withParseRejections(rejections);
    }

    static List<String> splitCsv(String line) {
        List<String> fields = new ArrayList<>();
        Matcher matcher = CSV_FIELD.matcher(line + ",");
        while (matcher.find()) {
            String quoted = matcher.group(1);
            String plain = matcher.group(2);
            String value = quoted != null ? quoted : plain == null ? "" : plain;
            fields.add(value.replace("\"\"", "\""));
        }
        // the appended comma always yields one trailing empty field
        fields.remove(fields.size() - 1);
        return fields;
    }

    private static ZipRecord parseCsvRow(List<String> headers, List<String> fields) {
        if (fields.size() != headers.size()) {
            throw new IllegalArgumentException("Field count mismatch: expected " + headers.size() + ", got " + fields.size());
        }
        Map<String, String> row = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            row.put(headers.get(i), fields.get(i));
        }
        String zip = row.getOrDefault("zip", "").trim();
        Double lat = parseDouble(row.get("lat"));
        Double lng = parseDouble(row.get("lng"));
        if (zip.isEmpty() || lat == null || lng == null) {
            throw new IllegalArgumentException("Missing required fields (zip, lat, lng)");
        }
        Double density = parseDouble(row.get("density"));
        return new ZipRecord(
                zip,
                lat,
                lng,
                emptyToNull(row.get("city")),
                emptyToNull(row.get("state_id")),
                emptyToNull(row.get("county_fips")),
                emptyToNull(row.get("county_name")),
                parseLong(row.get("population")),
                density == null ? 0 : density,
                emptyToNull(row.get("timezone")),
                "TRUE".equalsIgnoreCase(row.getOrDefault("zcta", "").trim())
        );
    }

    private static void addJsonRecord(
            JsonNode node,
            String keyZip,
            String source,
            List<ZipRecord> records,
            List<String> sources,
            List<LoadReport.Rejection> rejections
    ) {
        if (node == null || !node.isObject()) {
            rejections.add(new LoadReport.Rejection(source, "entry is not an object"));
            return;
        }
        String zip = text(node, "zip");
        if (zip == null) {
            zip = keyZip;
        }
        Double density = number(node.path("density"));
        Double population = number(node.path("population"));
        records.add(new ZipRecord(
                zip,
                number(node.path("lat")),
                number(node.path("lng")),
                text(node, "city"),
                text(node, "state_id"),
                text(node, "county_fips"),
                text(node, "county_name"),
                population == null ? 0 : population.longValue(),
                density == null ? 0 : density,
                text(node, "timezone"),
                flag(node.path("zcta"))
        ));
        sources.add(source);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return emptyToNull(value.asText());
    }

    private static Double number(JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            return parseDouble(value.asText());
        }
        return null;
    }

    private static boolean flag(JsonNode value) {
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.isTextual() && "TRUE".equalsIgnoreCase(value.asText().trim());
    }

    private static Double parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private static long parseLong(String raw) {
        Double parsed = parseDouble(raw);
        return parsed == null ? 0 : parsed.longValue();
    }

    private static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
