package com.incident.dedup.store;

import java.util.Optional;

/**
 * Reference table of known vessels, keyed by IMO number and normalized name.
 */
public interface VesselRegistry {

    Optional<String> findByImo(String imo);

    Optional<String> findByName(String normalizedName);

    /**
     * Registers a new vessel and returns its reference id.
     *
     * @param name           the vessel name as reported
     * @param normalizedName the normalized name used for lookups
     * @param imo            the IMO number, may be null
     */
    String register(String name, String normalizedName, String imo);
}
