package com.incident.dedup.matching;

import java.util.Set;

/**
 * Per-candidate signals the override rules decide on.
 *
 * @param time                    time proximity in [0,1]
 * @param spatial                 spatial proximity in [0,1]
 * @param vesselSimilarity        1 on an IMO match, else vessel-name similarity (0 when unknown)
 * @param incidentTypeSimilarity  incident-type similarity in [0,1]
 * @param sharedKeywordSignatures keyword signatures found in both reports
 */
public record MatchSignals(
        double time,
        double spatial,
        double vesselSimilarity,
        double incidentTypeSimilarity,
        Set<String> sharedKeywordSignatures
) {
    public MatchSignals {
        sharedKeywordSignatures = sharedKeywordSignatures != null ? Set.copyOf(sharedKeywordSignatures) : Set.of();
    }

    public boolean hasSharedKeywordSignature() {
        return !sharedKeywordSignatures.isEmpty();
    }
}
