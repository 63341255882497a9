package com.incident.dedup.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed reference cache with a reverse index from reference id to keys,
 * so every alias of a reference entity can be invalidated at once.
 */
public class CaffeineReferenceCache implements ReferenceCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineReferenceCache.class);

    private final Cache<ReferenceKey, String> cache;
    private final ConcurrentMap<String, Set<ReferenceKey>> keysByReference = new ConcurrentHashMap<>();

    public CaffeineReferenceCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .executor(Runnable::run)
                .removalListener((ReferenceKey key, String referenceId, RemovalCause cause) -> {
                    if (key != null && referenceId != null) {
                        unindex(key, referenceId);
                    }
                })
                .build();
        log.debug("cache.created maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(ReferenceKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(ReferenceKey key, String referenceId) {
        cache.put(key, referenceId);
        keysByReference.computeIfAbsent(referenceId, id -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(String referenceId) {
        Set<ReferenceKey> keys = keysByReference.remove(referenceId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("cache.invalidated referenceId={} keys={}", referenceId, keys.size());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        keysByReference.clear();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    private void unindex(ReferenceKey key, String referenceId) {
        Set<ReferenceKey> keys = keysByReference.get(referenceId);
        if (keys != null) {
            keys.remove(key);
        }
    }
}
