package com.ziplens.service.acs;

import com.ziplens.core.model.ValueMetadata;
import com.ziplens.core.model.ZipValues;
import com.ziplens.core.util.ZipCodes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns a provider table into per-ZIP values. Rows without a ZIP column value are skipped,
 * empty cells and the provider's null become null values.
 */
public final class AcsResponseParser {
    private static final Logger LOGGER = Logger.getLogger(AcsResponseParser.class.getName());
    static final String ZIP_COLUMN = "zip code tabulation area";

    private AcsResponseParser() {
    }

    public static Map<String, ZipValues> parse(AcsTable table, List<String> variables, String dataset, int year, Instant fetchedAt) {
        Map<String, ZipValues> byZip = new LinkedHashMap<>();
        if (table == null || table.isEmpty()) {
            return byZip;
        }
        List<String> header = table.header();
        int zipColumn = header.indexOf(ZIP_COLUMN);
        if (zipColumn < 0) {
            throw new AcsRequestException(AcsRequestException.Kind.TRANSIENT, 200,
                    "Provider response has no '" + ZIP_COLUMN + "' column");
        }
        int nameColumn = header.indexOf("NAME");
        for (List<String> row : table.rows()) {
            if (row == null || row.size() <= zipColumn || row.get(zipColumn) == null) {
                continue;
            }
            String zip;
            try {
                zip = ZipCodes.normalize(row.get(zipColumn));
            } catch (IllegalArgumentException e) {
                LOGGER.fine(() -> "Skipping provider row with unusable ZIP " + row.get(zipColumn));
                continue;
            }
            Map<String, Double> data = new LinkedHashMap<>();
            for (String variable : variables) {
                int column = header.indexOf(variable);
                data.put(variable, column < 0 || column >= row.size() ? null : toNumber(row.get(column)));
            }
            String name = nameColumn >= 0 && nameColumn < row.size() ? row.get(nameColumn) : null;
            byZip.put(zip, new ZipValues(data, ValueMetadata.fromApi(name, dataset, String.valueOf(year), fetchedAt)));
        }
        return byZip;
    }

    static Double toNumber(String cell) {
        if (cell == null) {
            return null;
        }
        String text = cell.trim();
        if (text.isEmpty() || "null".equalsIgnoreCase(text)) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
