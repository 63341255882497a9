package com.incident.dedup.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceCacheTest {

    @Nested
    @DisplayName("CaffeineReferenceCache")
    class CaffeineTests {

        private ReferenceCache cache;

        @BeforeEach
        void setUp() {
            cache = ReferenceCache.create(CacheConfig.defaults());
        }

        @Test
        @DisplayName("Should create a Caffeine cache when enabled")
        void testFactory() {
            assertInstanceOf(CaffeineReferenceCache.class, cache);
        }

        @Test
        @DisplayName("Should return cached reference ids and count hits and misses")
        void testPutAndGet() {
            cache.put(new ReferenceKey.ByImo("9123456"), "vessel-1");

            assertEquals("vessel-1", cache.get(new ReferenceKey.ByImo("9123456")).orElseThrow());
            assertTrue(cache.get(new ReferenceKey.ByImo("9999999")).isEmpty());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("IMO and name keys never collide")
        void testNamespaces() {
            cache.put(new ReferenceKey.ByName("9123456"), "vessel-by-name");

            assertTrue(cache.get(new ReferenceKey.ByImo("9123456")).isEmpty());
            assertEquals("vessel-by-name", cache.get(new ReferenceKey.ByName("9123456")).orElseThrow());
        }

        @Test
        @DisplayName("Invalidating a reference id removes all its aliases")
        void testInvalidateByReference() {
            cache.put(new ReferenceKey.ByImo("9123456"), "vessel-1");
            cache.put(new ReferenceKey.ByName("OCEANSTAR"), "vessel-1");
            cache.put(new ReferenceKey.ByName("DELTA"), "vessel-2");

            cache.invalidate("vessel-1");

            assertTrue(cache.get(new ReferenceKey.ByImo("9123456")).isEmpty());
            assertTrue(cache.get(new ReferenceKey.ByName("OCEANSTAR")).isEmpty());
            assertEquals("vessel-2", cache.get(new ReferenceKey.ByName("DELTA")).orElseThrow());
        }

        @Test
        @DisplayName("Invalidating everything empties the cache")
        void testInvalidateAll() {
            cache.put(new ReferenceKey.ByName("DELTA"), "vessel-2");

            cache.invalidateAll();

            assertTrue(cache.get(new ReferenceKey.ByName("DELTA")).isEmpty());
            assertEquals(0, cache.getStats().size());
        }

        @Test
        @DisplayName("Unknown reference ids are ignored")
        void testInvalidateUnknown() {
            assertDoesNotThrow(() -> cache.invalidate("unknown"));
        }
    }

    @Nested
    @DisplayName("NoOpReferenceCache")
    class NoOpTests {

        @Test
        @DisplayName("Disabled config yields a cache that stores nothing")
        void testDisabled() {
            ReferenceCache cache = ReferenceCache.create(CacheConfig.disabled());
            cache.put(new ReferenceKey.ByName("DELTA"), "vessel-2");

            assertInstanceOf(NoOpReferenceCache.class, cache);
            assertTrue(cache.get(new ReferenceKey.ByName("DELTA")).isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Test
    @DisplayName("Config rejects non-positive sizes")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        assertThrows(NullPointerException.class, () -> new ReferenceKey.ByImo(null));
    }
}
