package com.incident.dedup.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable ledger entry for one cross-source merge.
 */
public record MergeRecord(
        String id,
        String primaryRecordId,
        String secondaryRecordId,
        String primarySource,
        String secondarySource,
        double confidenceScore,
        ConfidenceBand band,
        String triggeredBy,
        String reasoning,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(primaryRecordId, "primaryRecordId is required");
        Objects.requireNonNull(secondaryRecordId, "secondaryRecordId is required");
        Objects.requireNonNull(band, "band is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (primaryRecordId.equals(secondaryRecordId)) {
            throw new IllegalArgumentException("A record cannot be merged into itself: " + primaryRecordId);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String primaryRecordId;
        private String secondaryRecordId;
        private String primarySource;
        private String secondarySource;
        private double confidenceScore;
        private ConfidenceBand band;
        private String triggeredBy;
        private String reasoning;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder primaryRecordId(String primaryRecordId) {
            this.primaryRecordId = primaryRecordId;
            return this;
        }

        public Builder secondaryRecordId(String secondaryRecordId) {
            this.secondaryRecordId = secondaryRecordId;
            return this;
        }

        public Builder primarySource(String primarySource) {
            this.primarySource = primarySource;
            return this;
        }

        public Builder secondarySource(String secondarySource) {
            this.secondarySource = secondarySource;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder band(ConfidenceBand band) {
            this.band = band;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MergeRecord build() {
            return new MergeRecord(
                    id, primaryRecordId, secondaryRecordId, primarySource, secondarySource,
                    confidenceScore, band, triggeredBy, reasoning, timestamp
            );
        }
    }
}
