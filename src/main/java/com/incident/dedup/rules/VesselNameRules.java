package com.incident.dedup.rules;

import java.util.List;

import static com.incident.dedup.rules.NormalizationRule.strip;

/**
 * Normalization rules for vessel names: strip vessel-class prefixes/suffixes
 * ("M/V", "MOTOR VESSEL", "M/T", "TANKER", ...) and then every non-alphanumeric character.
 */
public final class VesselNameRules {

    private VesselNameRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getRules());
    }

    public static List<NormalizationRule> getRules() {
        return List.of(
                // Multi-word class names go first so "MOTOR VESSEL" is not left as "MOTOR"
                strip("vessel-motor-vessel", "\\bMOTOR\\s+VESSEL\\b", 10),
                strip("vessel-motor-tanker", "\\bMOTOR\\s+TANKER\\b", 10),
                // MV, M/V, M.V. and the tanker forms as standalone tokens
                strip("vessel-mv", "\\bM[./]?V\\b\\.?", 20),
                strip("vessel-mt", "\\bM[./]?T\\b\\.?", 20),
                strip("vessel-word", "\\bVESSEL\\b", 30),
                strip("vessel-tanker", "\\bTANKER\\b", 30),
                strip("non-alphanumeric", "[^A-Z0-9]", 100)
        );
    }
}
