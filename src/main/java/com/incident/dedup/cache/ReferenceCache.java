package com.incident.dedup.cache;

import java.util.Optional;

/**
 * Short-lived cache from normalized identifiers to resolved reference-entity ids.
 * A pure speed optimization: clearing it never changes outcomes.
 */
public interface ReferenceCache {

    Optional<String> get(ReferenceKey key);

    void put(ReferenceKey key, String referenceId);

    /**
     * Invalidates every key that resolved to the given reference id.
     */
    void invalidate(String referenceId);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates a fresh cache for one invocation.
     */
    static ReferenceCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineReferenceCache(config) : new NoOpReferenceCache();
    }
}
