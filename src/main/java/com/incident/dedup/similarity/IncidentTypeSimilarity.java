package com.incident.dedup.similarity;

/**
 * Incident-type similarity: 1 for equal names, {@value #SYNONYM_SCORE} for names in the same
 * synonym group, otherwise token overlap. Missing types score 0.
 */
public class IncidentTypeSimilarity implements SimilarityAlgorithm {

    public static final double SYNONYM_SCORE = 0.8;

    private final IncidentTypeSynonyms synonyms;
    private final TokenOverlapSimilarity tokenOverlap;

    public IncidentTypeSimilarity() {
        this(IncidentTypeSynonyms.defaults());
    }

    public IncidentTypeSimilarity(IncidentTypeSynonyms synonyms) {
        this.synonyms = synonyms;
        this.tokenOverlap = new TokenOverlapSimilarity();
    }

    @Override
    public double compute(String type1, String type2) {
        if (type1 == null || type2 == null || type1.isBlank() || type2.isBlank()) {
            return 0.0;
        }
        String normalized1 = IncidentTypeSynonyms.normalize(type1);
        String normalized2 = IncidentTypeSynonyms.normalize(type2);
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        if (synonyms.sameGroup(normalized1, normalized2)) {
            return SYNONYM_SCORE;
        }
        return tokenOverlap.compute(normalized1, normalized2);
    }

    @Override
    public String getName() {
        return "IncidentType";
    }
}
