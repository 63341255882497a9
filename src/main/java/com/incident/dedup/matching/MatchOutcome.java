package com.incident.dedup.matching;

import com.incident.dedup.core.model.MatchState;
import com.incident.dedup.core.model.SimilarityScore;

/**
 * Terminal result of matching one incoming record against canonical incidents.
 *
 * @param state               {@link MatchState#MATCHED} or {@link MatchState#NO_MATCH}
 * @param canonicalIncidentId the matched incident, null on no match
 * @param score               composite score of the selected candidate, null on no match
 * @param override            override outcome of the selected candidate, null on no match
 * @param reason              why the outcome was reached
 * @param candidatesEvaluated number of candidates returned by the store
 */
public record MatchOutcome(
        MatchState state,
        String canonicalIncidentId,
        SimilarityScore score,
        OverrideOutcome override,
        String reason,
        int candidatesEvaluated
) {
    public static MatchOutcome matched(String canonicalIncidentId, SimilarityScore score,
                                       OverrideOutcome override, String reason, int candidatesEvaluated) {
        return new MatchOutcome(MatchState.MATCHED, canonicalIncidentId, score, override, reason, candidatesEvaluated);
    }

    public static MatchOutcome noMatch(String reason, int candidatesEvaluated) {
        return new MatchOutcome(MatchState.NO_MATCH, null, null, null, reason, candidatesEvaluated);
    }

    public boolean isMatched() {
        return state == MatchState.MATCHED;
    }
}
