package com.incident.dedup.geo;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Great-circle distance, time delta and linear-decay proximity scores.
 *
 * <p>All functions are total: invalid input yields {@code +infinity} for raw measurements
 * and {@code 0.0} for proximity scores, never an exception.</p>
 */
public final class GeoTimeMetrics {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_PER_DEGREE = 111.32;

    private static final double MILLIS_PER_HOUR = 60.0 * 60.0 * 1000.0;

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private GeoTimeMetrics() {
        // Utility class
    }

    /**
     * True iff both values are finite, within range, and not the (0,0) "unknown" sentinel.
     */
    public static boolean isValidCoordinate(Double lat, Double lon) {
        if (lat == null || lon == null) {
            return false;
        }
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            return false;
        }
        if (lat < -90.0 || lat > 90.0 || lon < -180.0 || lon > 180.0) {
            return false;
        }
        return !(lat == 0.0 && lon == 0.0);
    }

    /**
     * Haversine distance in kilometers, or {@code +infinity} if either point is invalid.
     */
    public static double distanceKm(Double lat1, Double lon1, Double lat2, Double lon2) {
        if (!isValidCoordinate(lat1, lon1) || !isValidCoordinate(lat2, lon2)) {
            return Double.POSITIVE_INFINITY;
        }
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Absolute difference in hours, or {@code +infinity} if either timestamp is missing.
     */
    public static double timeDeltaHours(Instant t1, Instant t2) {
        if (t1 == null || t2 == null) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(t1.toEpochMilli() - t2.toEpochMilli()) / MILLIS_PER_HOUR;
    }

    /**
     * Absolute difference in hours between two textual timestamps,
     * or {@code +infinity} if either cannot be parsed.
     */
    public static double timeDeltaHours(String t1, String t2) {
        return timeDeltaHours(parseTimestamp(t1), parseTimestamp(t2));
    }

    /**
     * {@code max(0, 1 - delta/maxHours)}; 0 when maxHours is not positive or the delta is infinite.
     */
    public static double timeProximity(Instant t1, Instant t2, double maxHours) {
        if (maxHours <= 0) {
            return 0.0;
        }
        double delta = timeDeltaHours(t1, t2);
        if (Double.isInfinite(delta) || Double.isNaN(delta)) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - delta / maxHours);
    }

    public static double timeProximity(String t1, String t2, double maxHours) {
        return timeProximity(parseTimestamp(t1), parseTimestamp(t2), maxHours);
    }

    /**
     * {@code max(0, 1 - distance/maxKm)}; 0 when maxKm is not positive or the distance is infinite.
     */
    public static double spatialProximity(Double lat1, Double lon1, Double lat2, Double lon2, double maxKm) {
        if (maxKm <= 0) {
            return 0.0;
        }
        double distance = distanceKm(lat1, lon1, lat2, lon2);
        if (Double.isInfinite(distance) || Double.isNaN(distance)) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - distance / maxKm);
    }

    /**
     * Parses ISO-8601 instants, offset date-times, local date-times (as UTC) and plain dates
     * (midnight UTC). Returns null for blank or unparsable input.
     */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            Instant parsed = tryParse(parser, text);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
