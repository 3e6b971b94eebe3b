package com.ziplens.core.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

public final class ZipCodes {
    public static final int LENGTH = 5;

    private ZipCodes() {
    }

    /**
     * Left-pads a ZIP of up to five digits with zeros, so "1" and "00001" name the same key.
     */
    public static String normalize(String zip) {
        String value = zip == null ? "" : zip.trim();
        if (value.isEmpty() || value.length() > LENGTH || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("ZIP must be 1 to 5 digits: '" + zip + "'");
        }
        if (value.length() == LENGTH) {
            return value;
        }
        return "0".repeat(LENGTH - value.length()) + value;
    }

    public static boolean isNormalizable(String zip) {
        try {
            normalize(zip);
            return true;
        } catch (IllegalArgumentException invalid) {
            return false;
        }
    }

    public static List<String> normalizeAll(Collection<String> zips) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String zip : zips) {
            normalized.add(normalize(zip));
        }
        return List.copyOf(normalized);
    }
}
