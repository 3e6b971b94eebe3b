package com.ziplens.service.acs;

import java.util.List;

/**
 * Raw tabular provider answer: a header row followed by data rows. Cells may be null.
 */
public record AcsTable(List<String> header, List<List<String>> rows) {
    public static AcsTable empty() {
        return new AcsTable(List.of(), List.of());
    }

    public boolean isEmpty() {
        return header.isEmpty() || rows.isEmpty();
    }
}
