package com.incident.dedup.cache;

import java.util.Objects;

/**
 * Typed key of the per-run reference cache. Each variant is its own namespace, so an IMO
 * number can never collide with a vessel name that happens to spell the same digits.
 */
public interface ReferenceKey {

    /**
     * Vessel looked up by IMO number.
     */
    record ByImo(String imo) implements ReferenceKey {
        public ByImo {
            Objects.requireNonNull(imo, "imo is required");
        }
    }

    /**
     * Vessel looked up by normalized name.
     */
    record ByName(String normalizedName) implements ReferenceKey {
        public ByName {
            Objects.requireNonNull(normalizedName, "normalizedName is required");
        }
    }
}
