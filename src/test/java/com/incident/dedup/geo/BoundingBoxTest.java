package com.incident.dedup.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    @Test
    @DisplayName("Box around a point contains points within the radius")
    void testAroundContainsNearbyPoints() {
        BoundingBox box = BoundingBox.around(1.2, 103.8, 50);

        assertTrue(box.contains(1.2, 103.8));
        assertTrue(box.contains(1.5, 104.0));
        assertFalse(box.contains(2.0, 103.8));
        assertFalse(box.contains(null, 103.8));
        assertFalse(box.crossesAntimeridian());
    }

    @Test
    @DisplayName("Latitude half-width is maxKm / 111.32")
    void testLatitudeSpan() {
        BoundingBox box = BoundingBox.around(10.0, 50.0, 111.32);
        assertEquals(9.0, box.minLat(), 1e-9);
        assertEquals(11.0, box.maxLat(), 1e-9);
    }

    @Test
    @DisplayName("Box near the antimeridian wraps longitude")
    void testAntimeridianWrap() {
        BoundingBox box = BoundingBox.around(-17.0, 179.9, 50);

        assertTrue(box.crossesAntimeridian());
        assertTrue(box.contains(-17.0, -179.9));
        assertTrue(box.contains(-17.0, 179.95));
        assertFalse(box.contains(-17.0, 170.0));
    }

    @Test
    @DisplayName("Should reject a non-positive radius")
    void testRejectsNonPositiveRadius() {
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.around(1.0, 1.0, 0));
    }

    @Test
    @DisplayName("Time window is closed on both ends")
    void testTimeWindow() {
        Instant center = Instant.parse("2024-03-01T12:00:00Z");
        TimeWindow window = TimeWindow.around(center, 48);

        assertEquals(Instant.parse("2024-02-28T12:00:00Z"), window.start());
        assertEquals(Instant.parse("2024-03-03T12:00:00Z"), window.end());
        assertTrue(window.contains(window.start()));
        assertTrue(window.contains(window.end()));
        assertFalse(window.contains(window.end().plusSeconds(1)));
        assertFalse(window.contains(null));
    }
}
