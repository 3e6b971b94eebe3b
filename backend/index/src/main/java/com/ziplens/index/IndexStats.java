package com.ziplens.index;

public record IndexStats(
        int totalRecords,
        int states,
        int cities,
        int counties,
        int spatialCells,
        int spatialPoints,
        boolean loaded,
        long lastLoadMillis,
        long lastIndexMillis
) {
}
