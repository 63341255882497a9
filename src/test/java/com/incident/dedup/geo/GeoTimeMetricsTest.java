package com.incident.dedup.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GeoTimeMetricsTest {

    @Nested
    @DisplayName("Coordinate validity")
    class ValidityTests {

        @ParameterizedTest
        @CsvSource({
                "1.2, 103.8, true",
                "-90, 180, true",
                "0, 0, false",
                "91, 10, false",
                "10, -181, false",
                "0, 12.5, true"
        })
        @DisplayName("Should validate range and reject the (0,0) sentinel")
        void testIsValidCoordinate(double lat, double lon, boolean expected) {
            assertEquals(expected, GeoTimeMetrics.isValidCoordinate(lat, lon));
        }

        @Test
        @DisplayName("Should reject null and non-finite values")
        void testNullAndNaN() {
            assertFalse(GeoTimeMetrics.isValidCoordinate(null, 10.0));
            assertFalse(GeoTimeMetrics.isValidCoordinate(10.0, null));
            assertFalse(GeoTimeMetrics.isValidCoordinate(Double.NaN, 10.0));
            assertFalse(GeoTimeMetrics.isValidCoordinate(10.0, Double.POSITIVE_INFINITY));
        }
    }

    @Nested
    @DisplayName("Distance")
    class DistanceTests {

        @Test
        @DisplayName("One degree of latitude is about 111.19 km")
        void testOneDegreeLatitude() {
            assertEquals(111.19, GeoTimeMetrics.distanceKm(10.0, 50.0, 11.0, 50.0), 0.01);
        }

        @Test
        @DisplayName("Should compute short distances in the Singapore Strait")
        void testShortDistance() {
            assertEquals(7.86, GeoTimeMetrics.distanceKm(1.2, 103.8, 1.25, 103.85), 0.05);
        }

        @Test
        @DisplayName("Should be symmetric and zero for identical points")
        void testSymmetryAndIdentity() {
            double ab = GeoTimeMetrics.distanceKm(12.5, 43.3, 13.1, 42.9);
            double ba = GeoTimeMetrics.distanceKm(13.1, 42.9, 12.5, 43.3);
            assertEquals(ab, ba, 1e-9);
            assertEquals(0.0, GeoTimeMetrics.distanceKm(12.5, 43.3, 12.5, 43.3), 1e-9);
        }

        @Test
        @DisplayName("Invalid points yield infinity")
        void testInvalidIsInfinite() {
            assertTrue(Double.isInfinite(GeoTimeMetrics.distanceKm(0.0, 0.0, 1.0, 1.0)));
            assertTrue(Double.isInfinite(GeoTimeMetrics.distanceKm(1.0, 1.0, null, 1.0)));
        }
    }

    @Nested
    @DisplayName("Time delta and proximity")
    class TimeTests {

        @Test
        @DisplayName("Should compute absolute hours regardless of order")
        void testTimeDelta() {
            Instant a = Instant.parse("2024-03-01T10:00:00Z");
            Instant b = Instant.parse("2024-03-01T16:30:00Z");
            assertEquals(6.5, GeoTimeMetrics.timeDeltaHours(a, b), 1e-9);
            assertEquals(6.5, GeoTimeMetrics.timeDeltaHours(b, a), 1e-9);
        }

        @Test
        @DisplayName("Missing or unparsable timestamps yield infinity")
        void testMissingTimestamp() {
            assertTrue(Double.isInfinite(GeoTimeMetrics.timeDeltaHours((Instant) null, Instant.now())));
            assertTrue(Double.isInfinite(GeoTimeMetrics.timeDeltaHours("yesterday", "2024-03-01T10:00:00Z")));
        }

        @Test
        @DisplayName("Proximity decays linearly and floors at zero")
        void testTimeProximity() {
            Instant a = Instant.parse("2024-03-01T00:00:00Z");
            assertEquals(1.0, GeoTimeMetrics.timeProximity(a, a, 48), 1e-9);
            assertEquals(0.75, GeoTimeMetrics.timeProximity(a, a.plusSeconds(12 * 3600), 48), 1e-9);
            assertEquals(0.0, GeoTimeMetrics.timeProximity(a, a.plusSeconds(72 * 3600), 48), 1e-9);
        }

        @Test
        @DisplayName("Non-positive maximum yields zero proximity")
        void testNonPositiveMax() {
            Instant a = Instant.parse("2024-03-01T00:00:00Z");
            assertEquals(0.0, GeoTimeMetrics.timeProximity(a, a, 0), 1e-9);
            assertEquals(0.0, GeoTimeMetrics.spatialProximity(1.2, 103.8, 1.2, 103.8, -5), 1e-9);
        }

        @Test
        @DisplayName("Spatial proximity of invalid coordinates is zero")
        void testSpatialProximityInvalid() {
            assertEquals(0.0, GeoTimeMetrics.spatialProximity(0.0, 0.0, 1.2, 103.8, 50), 1e-9);
            assertEquals(1.0, GeoTimeMetrics.spatialProximity(1.2, 103.8, 1.2, 103.8, 50), 1e-9);
        }
    }

    @Nested
    @DisplayName("Timestamp parsing")
    class ParseTests {

        @ParameterizedTest
        @CsvSource({
                "2024-03-01T10:00:00Z, 2024-03-01T10:00:00Z",
                "2024-03-01T12:00:00+02:00, 2024-03-01T10:00:00Z",
                "2024-03-01T10:00:00, 2024-03-01T10:00:00Z",
                "2024-03-01, 2024-03-01T00:00:00Z"
        })
        @DisplayName("Should accept ISO forms, treating zone-less values as UTC")
        void testFormats(String text, String expected) {
            assertEquals(Instant.parse(expected), GeoTimeMetrics.parseTimestamp(text));
        }

        @Test
        @DisplayName("Should return null for blank or unparsable text")
        void testUnparsable() {
            assertNull(GeoTimeMetrics.parseTimestamp(null));
            assertNull(GeoTimeMetrics.parseTimestamp("  "));
            assertNull(GeoTimeMetrics.parseTimestamp("03/01/2024"));
        }
    }
}
