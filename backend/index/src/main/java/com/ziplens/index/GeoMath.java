package com.ziplens.index;

final class GeoMath {
    static final double EARTH_RADIUS_KM = 6371.0;
    static final double KM_PER_DEGREE_LAT = 111.32;

    private GeoMath() {
    }

    static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    // Longitude degrees shrink with cos(lat); evaluated at the query latitude only.
    static double lngDegreesFor(double km, double atLat) {
        return km / (KM_PER_DEGREE_LAT * Math.cos(Math.toRadians(atLat)));
    }

    static double latDegreesFor(double km) {
        return km / KM_PER_DEGREE_LAT;
    }
}
