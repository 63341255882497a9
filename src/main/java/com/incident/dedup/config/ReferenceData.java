package com.incident.dedup.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Hand-tuned reference tables used by the scoring and ranking components.
 *
 * @param sourcePriorities          reliability rank per source name (higher is more reliable)
 * @param defaultSourcePriority     rank for sources missing from the table
 * @param incidentTypeSynonymGroups incident-type names treated as the same category
 * @param keywordSignatures         keyword lists per signature name, matched in descriptions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferenceData(
        @JsonProperty("sourcePriorities") Map<String, Integer> sourcePriorities,
        @JsonProperty("defaultSourcePriority") int defaultSourcePriority,
        @JsonProperty("incidentTypeSynonymGroups") List<List<String>> incidentTypeSynonymGroups,
        @JsonProperty("keywordSignatures") Map<String, List<String>> keywordSignatures
) {
    public ReferenceData {
        sourcePriorities = sourcePriorities != null ? Map.copyOf(sourcePriorities) : Map.of();
        incidentTypeSynonymGroups = incidentTypeSynonymGroups != null
                ? incidentTypeSynonymGroups.stream().map(List::copyOf).toList()
                : List.of();
        keywordSignatures = keywordSignatures != null ? Map.copyOf(keywordSignatures) : Map.of();
        if (defaultSourcePriority < 0) {
            throw new IllegalArgumentException("defaultSourcePriority must be >= 0");
        }
    }
}
