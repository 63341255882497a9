package com.incident.dedup.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVesselRegistryTest {

    @Test
    @DisplayName("Registered vessel is found by IMO and by normalized name")
    void testRegisterAndFind() {
        InMemoryVesselRegistry registry = new InMemoryVesselRegistry();

        String id = registry.register("MV OCEAN STAR", "OCEANSTAR", "9123456");

        assertEquals(id, registry.findByImo("9123456").orElseThrow());
        assertEquals(id, registry.findByName("OCEANSTAR").orElseThrow());
        assertTrue(registry.findByName("DELTA").isEmpty());
        assertEquals(3, registry.getLookupCount());
        assertEquals(1, registry.getRegisteredCount());
    }

    @Test
    @DisplayName("Vessel without IMO is indexed by name only")
    void testRegisterWithoutImo() {
        InMemoryVesselRegistry registry = new InMemoryVesselRegistry();

        String id = registry.register("DELTA", "DELTA", null);

        assertEquals(id, registry.findByName("DELTA").orElseThrow());
        assertTrue(registry.findByImo("").isEmpty());
    }
}
