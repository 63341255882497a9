package com.incident.dedup.cache;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpReferenceCache implements ReferenceCache {

    @Override
    public Optional<String> get(ReferenceKey key) {
        return Optional.empty();
    }

    @Override
    public void put(ReferenceKey key, String referenceId) {
        // no-op
    }

    @Override
    public void invalidate(String referenceId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
