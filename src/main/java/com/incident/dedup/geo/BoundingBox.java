package com.incident.dedup.geo;

/**
 * Latitude/longitude box used as a coarse spatial candidate filter.
 * Longitude bounds may wrap past the antimeridian, in which case {@code minLon > maxLon}.
 */
public record BoundingBox(double minLat, double maxLat, double minLon, double maxLon) {

    public BoundingBox {
        if (minLat > maxLat) {
            throw new IllegalArgumentException("minLat must be <= maxLat");
        }
    }

    /**
     * Box around a point covering {@code maxKm} in every direction, using
     * {@code Δlat = maxKm / 111.32} and {@code Δlon = maxKm / (111.32 · cos(lat))}.
     */
    public static BoundingBox around(double lat, double lon, double maxKm) {
        if (maxKm <= 0) {
            throw new IllegalArgumentException("maxKm must be > 0");
        }
        double deltaLat = maxKm / GeoTimeMetrics.KM_PER_DEGREE;
        double cosLat = Math.cos(lat * Math.PI / 180.0);
        double deltaLon = cosLat > 1e-9 ? maxKm / (GeoTimeMetrics.KM_PER_DEGREE * cosLat) : 180.0;

        double minLat = Math.max(-90.0, lat - deltaLat);
        double maxLat = Math.min(90.0, lat + deltaLat);
        if (deltaLon >= 180.0) {
            return new BoundingBox(minLat, maxLat, -180.0, 180.0);
        }
        return new BoundingBox(minLat, maxLat, wrapLongitude(lon - deltaLon), wrapLongitude(lon + deltaLon));
    }

    public boolean contains(Double lat, Double lon) {
        if (lat == null || lon == null) {
            return false;
        }
        if (lat < minLat || lat > maxLat) {
            return false;
        }
        if (crossesAntimeridian()) {
            return lon >= minLon || lon <= maxLon;
        }
        return lon >= minLon && lon <= maxLon;
    }

    public boolean crossesAntimeridian() {
        return minLon > maxLon;
    }

    private static double wrapLongitude(double lon) {
        if (lon > 180.0) {
            return lon - 360.0;
        }
        if (lon < -180.0) {
            return lon + 360.0;
        }
        return lon;
    }
}
