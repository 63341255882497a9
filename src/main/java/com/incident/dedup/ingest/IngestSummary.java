package com.incident.dedup.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one ingest batch.
 */
public record IngestSummary(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("processed") int processed,
        @JsonProperty("matched") int matched,
        @JsonProperty("created") int created,
        @JsonProperty("errors") int errors,
        @JsonIgnore List<IngestResult> results
) {
    public IngestSummary {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static IngestSummary of(String batchId, List<IngestResult> results) {
        int matched = 0;
        int created = 0;
        int errors = 0;
        for (IngestResult result : results) {
            if (result.isError()) {
                errors++;
            } else if (result.matched()) {
                matched++;
            } else {
                created++;
            }
        }
        return new IngestSummary(batchId, results.size(), matched, created, errors, results);
    }
}
