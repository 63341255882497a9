package com.incident.dedup.dedup;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one deduplication pass. Serialized field names are a stable contract for dashboards.
 *
 * <p>Always holds {@code mergesSucceeded + mergeErrors == mergesAttempted},
 * {@code mergesAttempted <= potentialMatchesChecked} and
 * {@code highConfidenceMatches + mediumConfidenceMatches <= potentialMatchesChecked}.</p>
 */
public record DeduplicationSummary(
        @JsonProperty("runId") String runId,
        @JsonProperty("recordsAnalyzed") int recordsAnalyzed,
        @JsonProperty("sourceCount") int sourceCount,
        @JsonProperty("potentialMatchesChecked") int potentialMatchesChecked,
        @JsonProperty("highConfidenceMatches") int highConfidenceMatches,
        @JsonProperty("mediumConfidenceMatches") int mediumConfidenceMatches,
        @JsonProperty("mergesAttempted") int mergesAttempted,
        @JsonProperty("mergesSucceeded") int mergesSucceeded,
        @JsonProperty("mergeErrors") int mergeErrors,
        @JsonProperty("dryRun") boolean dryRun,
        @JsonProperty("plannedMerges") List<PlannedMerge> plannedMerges
) {
    public DeduplicationSummary {
        plannedMerges = plannedMerges != null ? List.copyOf(plannedMerges) : List.of();
    }
}
