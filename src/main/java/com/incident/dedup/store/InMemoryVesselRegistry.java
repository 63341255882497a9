package com.incident.dedup.store;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory vessel registry. Counts lookups so callers can observe cache effectiveness.
 */
public class InMemoryVesselRegistry implements VesselRegistry {

    private final Map<String, String> byImo = new ConcurrentHashMap<>();
    private final Map<String, String> byName = new ConcurrentHashMap<>();
    private final AtomicLong lookups = new AtomicLong();
    private final AtomicLong registered = new AtomicLong();

    @Override
    public Optional<String> findByImo(String imo) {
        lookups.incrementAndGet();
        return Optional.ofNullable(byImo.get(imo));
    }

    @Override
    public Optional<String> findByName(String normalizedName) {
        lookups.incrementAndGet();
        return Optional.ofNullable(byName.get(normalizedName));
    }

    @Override
    public synchronized String register(String name, String normalizedName, String imo) {
        String id = UUID.randomUUID().toString();
        registered.incrementAndGet();
        if (imo != null && !imo.isBlank()) {
            byImo.putIfAbsent(imo, id);
        }
        if (normalizedName != null && !normalizedName.isEmpty()) {
            byName.putIfAbsent(normalizedName, id);
        }
        return id;
    }

    public long getLookupCount() {
        return lookups.get();
    }

    public long getRegisteredCount() {
        return registered.get();
    }
}
