package com.incident.dedup.cache;

/**
 * Configuration of the per-invocation reference cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live of each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 5,000 entries, one hour TTL, enabled. A run never outlives its cache.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 3_600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
