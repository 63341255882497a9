package com.incident.dedup.ingest;

import com.incident.dedup.cache.ReferenceCache;
import com.incident.dedup.cache.ReferenceKey;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.metrics.MetricsService;
import com.incident.dedup.similarity.ImoSimilarity;
import com.incident.dedup.similarity.VesselNameSimilarity;
import com.incident.dedup.store.VesselRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves a record's vessel to a reference vessel id: by IMO first, then by normalized name,
 * registering the vessel when neither is known. Lookups go through a per-invocation cache.
 */
public class VesselReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(VesselReferenceResolver.class);

    private final VesselRegistry registry;
    private final ReferenceCache cache;
    private final VesselNameSimilarity vesselNames;
    private final MetricsService metricsService;

    public VesselReferenceResolver(VesselRegistry registry, ReferenceCache cache,
                                   VesselNameSimilarity vesselNames, MetricsService metricsService) {
        this.registry = registry;
        this.cache = cache;
        this.vesselNames = vesselNames;
        this.metricsService = metricsService;
    }

    /**
     * Returns the reference vessel id, or empty when the record carries neither IMO nor name.
     *
     * <p>Each key is answered from the cache or, on a miss, from the matching registry index,
     * and only that index's answer is cached under it. The IMO always wins over the name, so
     * the outcome is the same with the cache cleared or disabled.</p>
     */
    public Optional<String> resolve(RawRecord record) {
        String imo = ImoSimilarity.toImoString(record.getVesselImo());
        String normalizedName = record.hasVesselName() ? vesselNames.normalize(record.getVesselName()) : "";
        if (imo == null && normalizedName.isEmpty()) {
            return Optional.empty();
        }

        if (imo != null) {
            Optional<String> byImo = lookup(new ReferenceKey.ByImo(imo), () -> registry.findByImo(imo));
            if (byImo.isPresent()) {
                return byImo;
            }
        }
        if (!normalizedName.isEmpty()) {
            Optional<String> byName = lookup(new ReferenceKey.ByName(normalizedName),
                    () -> registry.findByName(normalizedName));
            if (byName.isPresent()) {
                return byName;
            }
        }

        String created = registry.register(record.getVesselName(), normalizedName, imo);
        log.info("vessel.registered id={} name={} imo={}", created, record.getVesselName(), imo);
        if (imo != null) {
            cache.put(new ReferenceKey.ByImo(imo), created);
        }
        if (!normalizedName.isEmpty()) {
            cache.put(new ReferenceKey.ByName(normalizedName), created);
        }
        return Optional.of(created);
    }

    private Optional<String> lookup(ReferenceKey key, Supplier<Optional<String>> registryLookup) {
        Optional<String> hit = cache.get(key);
        if (hit.isPresent()) {
            metricsService.recordCacheHit();
            return hit;
        }
        metricsService.recordCacheMiss();
        Optional<String> found = registryLookup.get();
        found.ifPresent(id -> cache.put(key, id));
        return found;
    }
}
