package com.incident.dedup.dedup;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incident.dedup.core.model.ConfidenceBand;

/**
 * A merge selected by a pass, reported in dry runs instead of being written.
 */
public record PlannedMerge(
        @JsonProperty("primaryRecordId") String primaryRecordId,
        @JsonProperty("secondaryRecordId") String secondaryRecordId,
        @JsonProperty("primarySource") String primarySource,
        @JsonProperty("secondarySource") String secondarySource,
        @JsonProperty("score") double score,
        @JsonProperty("band") ConfidenceBand band
) {
}
