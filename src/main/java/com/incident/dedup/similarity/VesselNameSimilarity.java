package com.incident.dedup.similarity;

import com.incident.dedup.rules.NormalizationEngine;
import com.incident.dedup.rules.VesselNameRules;

/**
 * Vessel-name similarity on normalized names.
 *
 * <p>Missing or blank names score 0. Names whose normalized forms are equal score 1,
 * including two non-blank names that both reduce to "" (for example "M/V" and "TANKER").
 * Otherwise the score is the Levenshtein similarity of the normalized forms.</p>
 */
public class VesselNameSimilarity implements SimilarityAlgorithm {

    private final NormalizationEngine normalizer;
    private final LevenshteinSimilarity levenshtein;

    public VesselNameSimilarity() {
        this(VesselNameRules.createDefaultEngine());
    }

    public VesselNameSimilarity(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
        this.levenshtein = new LevenshteinSimilarity();
    }

    @Override
    public double compute(String name1, String name2) {
        if (isBlank(name1) || isBlank(name2)) {
            return 0.0;
        }
        String normalized1 = normalize(name1);
        String normalized2 = normalize(name2);
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        return levenshtein.compute(normalized1, normalized2);
    }

    /**
     * Uppercased name without vessel-class prefixes and non-alphanumeric characters.
     */
    public String normalize(String name) {
        return normalizer.normalize(name);
    }

    @Override
    public String getName() {
        return "VesselName";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
