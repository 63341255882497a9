package com.incident.dedup.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One incident report as ingested from a single source.
 *
 * <p>Instances are immutable; updates are expressed by building a modified copy with
 * {@link #builder(RawRecord)}. Coordinates and the event time are nullable because
 * sources frequently omit them.</p>
 */
public final class RawRecord implements IncidentFacts {
    private final String id;
    private final String source;
    private final String referenceId;

    private final Instant occurredAt;
    private final Double latitude;
    private final Double longitude;
    private final String title;
    private final String description;
    private final String region;
    private final String location;
    private final String incidentTypeName;
    private final String vesselName;
    private final String vesselType;
    private final String vesselFlag;
    private final String vesselImo;
    private final String vesselStatus;
    private final String updateText;
    private final String rawPayload;

    private final MergeStatus mergeStatus;
    private final String mergedIntoId;
    private final String canonicalIncidentId;
    private final String vesselReferenceId;
    private final ProcessingStatus processingStatus;
    private final Set<String> mergedSources;
    private final Set<String> mergedRecordIds;
    private final String processingNotes;
    private final Instant lastMergedAt;
    private final Instant modifiedAt;

    private RawRecord(Builder builder) {
        this.id = builder.id;
        this.source = builder.source;
        this.referenceId = builder.referenceId;
        this.occurredAt = builder.occurredAt;
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.title = builder.title;
        this.description = builder.description;
        this.region = builder.region;
        this.location = builder.location;
        this.incidentTypeName = builder.incidentTypeName;
        this.vesselName = builder.vesselName;
        this.vesselType = builder.vesselType;
        this.vesselFlag = builder.vesselFlag;
        this.vesselImo = builder.vesselImo;
        this.vesselStatus = builder.vesselStatus;
        this.updateText = builder.updateText;
        this.rawPayload = builder.rawPayload;
        this.mergeStatus = builder.mergeStatus != null ? builder.mergeStatus : MergeStatus.NONE;
        this.mergedIntoId = builder.mergedIntoId;
        this.canonicalIncidentId = builder.canonicalIncidentId;
        this.vesselReferenceId = builder.vesselReferenceId;
        this.processingStatus = builder.processingStatus != null ? builder.processingStatus : ProcessingStatus.NEW;
        this.mergedSources = Collections.unmodifiableSet(new LinkedHashSet<>(builder.mergedSources));
        this.mergedRecordIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.mergedRecordIds));
        this.processingNotes = builder.processingNotes;
        this.lastMergedAt = builder.lastMergedAt;
        this.modifiedAt = builder.modifiedAt != null ? builder.modifiedAt : Instant.now();
    }

    @Override
    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getReferenceId() {
        return referenceId;
    }

    @Override
    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public Double getLatitude() {
        return latitude;
    }

    @Override
    public Double getLongitude() {
        return longitude;
    }

    @Override
    public String getTitle() {
        return title;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public String getRegion() {
        return region;
    }

    public String getLocation() {
        return location;
    }

    @Override
    public String getIncidentTypeName() {
        return incidentTypeName;
    }

    @Override
    public String getVesselName() {
        return vesselName;
    }

    public String getVesselType() {
        return vesselType;
    }

    public String getVesselFlag() {
        return vesselFlag;
    }

    @Override
    public String getVesselImo() {
        return vesselImo;
    }

    public String getVesselStatus() {
        return vesselStatus;
    }

    public String getUpdateText() {
        return updateText;
    }

    public String getRawPayload() {
        return rawPayload;
    }

    public MergeStatus getMergeStatus() {
        return mergeStatus;
    }

    public String getMergedIntoId() {
        return mergedIntoId;
    }

    public String getCanonicalIncidentId() {
        return canonicalIncidentId;
    }

    public String getVesselReferenceId() {
        return vesselReferenceId;
    }

    public ProcessingStatus getProcessingStatus() {
        return processingStatus;
    }

    /**
     * Source names folded into this record, including its own once it has become a primary.
     */
    public Set<String> getMergedSources() {
        return mergedSources;
    }

    /**
     * Ids of secondary records folded into this record.
     */
    public Set<String> getMergedRecordIds() {
        return mergedRecordIds;
    }

    public String getProcessingNotes() {
        return processingNotes;
    }

    public Instant getLastMergedAt() {
        return lastMergedAt;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public boolean isMergedInto() {
        return mergeStatus == MergeStatus.MERGED_INTO;
    }

    public boolean hasVesselName() {
        return vesselName != null && !vesselName.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawRecord that = (RawRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RawRecord{" +
                "id='" + id + '\'' +
                ", source='" + source + '\'' +
                ", referenceId='" + referenceId + '\'' +
                ", occurredAt=" + occurredAt +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", vesselName='" + vesselName + '\'' +
                ", incidentTypeName='" + incidentTypeName + '\'' +
                ", mergeStatus=" + mergeStatus +
                ", mergedIntoId='" + mergedIntoId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(RawRecord record) {
        return new Builder()
                .id(record.id)
                .source(record.source)
                .referenceId(record.referenceId)
                .occurredAt(record.occurredAt)
                .latitude(record.latitude)
                .longitude(record.longitude)
                .title(record.title)
                .description(record.description)
                .region(record.region)
                .location(record.location)
                .incidentTypeName(record.incidentTypeName)
                .vesselName(record.vesselName)
                .vesselType(record.vesselType)
                .vesselFlag(record.vesselFlag)
                .vesselImo(record.vesselImo)
                .vesselStatus(record.vesselStatus)
                .updateText(record.updateText)
                .rawPayload(record.rawPayload)
                .mergeStatus(record.mergeStatus)
                .mergedIntoId(record.mergedIntoId)
                .canonicalIncidentId(record.canonicalIncidentId)
                .vesselReferenceId(record.vesselReferenceId)
                .processingStatus(record.processingStatus)
                .mergedSources(record.mergedSources)
                .mergedRecordIds(record.mergedRecordIds)
                .processingNotes(record.processingNotes)
                .lastMergedAt(record.lastMergedAt)
                .modifiedAt(record.modifiedAt);
    }

    public static class Builder {
        private String id;
        private String source;
        private String referenceId;
        private Instant occurredAt;
        private Double latitude;
        private Double longitude;
        private String title;
        private String description;
        private String region;
        private String location;
        private String incidentTypeName;
        private String vesselName;
        private String vesselType;
        private String vesselFlag;
        private String vesselImo;
        private String vesselStatus;
        private String updateText;
        private String rawPayload;
        private MergeStatus mergeStatus;
        private String mergedIntoId;
        private String canonicalIncidentId;
        private String vesselReferenceId;
        private ProcessingStatus processingStatus;
        private Set<String> mergedSources = new LinkedHashSet<>();
        private Set<String> mergedRecordIds = new LinkedHashSet<>();
        private String processingNotes;
        private Instant lastMergedAt;
        private Instant modifiedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder referenceId(String referenceId) {
            this.referenceId = referenceId;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder latitude(Double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(Double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder coordinates(Double latitude, Double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder incidentTypeName(String incidentTypeName) {
            this.incidentTypeName = incidentTypeName;
            return this;
        }

        public Builder vesselName(String vesselName) {
            this.vesselName = vesselName;
            return this;
        }

        public Builder vesselType(String vesselType) {
            this.vesselType = vesselType;
            return this;
        }

        public Builder vesselFlag(String vesselFlag) {
            this.vesselFlag = vesselFlag;
            return this;
        }

        public Builder vesselImo(String vesselImo) {
            this.vesselImo = vesselImo;
            return this;
        }

        public Builder vesselStatus(String vesselStatus) {
            this.vesselStatus = vesselStatus;
            return this;
        }

        public Builder updateText(String updateText) {
            this.updateText = updateText;
            return this;
        }

        public Builder rawPayload(String rawPayload) {
            this.rawPayload = rawPayload;
            return this;
        }

        public Builder mergeStatus(MergeStatus mergeStatus) {
            this.mergeStatus = mergeStatus;
            return this;
        }

        public Builder mergedIntoId(String mergedIntoId) {
            this.mergedIntoId = mergedIntoId;
            return this;
        }

        public Builder mergeState(MergeState state) {
            this.mergeStatus = state.status();
            this.mergedIntoId = state.mergedIntoId();
            return this;
        }

        public Builder canonicalIncidentId(String canonicalIncidentId) {
            this.canonicalIncidentId = canonicalIncidentId;
            return this;
        }

        public Builder vesselReferenceId(String vesselReferenceId) {
            this.vesselReferenceId = vesselReferenceId;
            return this;
        }

        public Builder processingStatus(ProcessingStatus processingStatus) {
            this.processingStatus = processingStatus;
            return this;
        }

        public Builder mergedSources(Set<String> mergedSources) {
            this.mergedSources = mergedSources != null ? new LinkedHashSet<>(mergedSources) : new LinkedHashSet<>();
            return this;
        }

        public Builder mergedRecordIds(Set<String> mergedRecordIds) {
            this.mergedRecordIds = mergedRecordIds != null ? new LinkedHashSet<>(mergedRecordIds) : new LinkedHashSet<>();
            return this;
        }

        public Builder processingNotes(String processingNotes) {
            this.processingNotes = processingNotes;
            return this;
        }

        public Builder lastMergedAt(Instant lastMergedAt) {
            this.lastMergedAt = lastMergedAt;
            return this;
        }

        public Builder modifiedAt(Instant modifiedAt) {
            this.modifiedAt = modifiedAt;
            return this;
        }

        public RawRecord build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(source, "source is required");
            MergeStatus status = mergeStatus != null ? mergeStatus : MergeStatus.NONE;
            if (status == MergeStatus.MERGED_INTO && (mergedIntoId == null || mergedIntoId.isBlank())) {
                throw new IllegalArgumentException("mergedIntoId is required when mergeStatus is MERGED_INTO");
            }
            if (status != MergeStatus.MERGED_INTO && mergedIntoId != null) {
                throw new IllegalArgumentException("mergedIntoId is only allowed when mergeStatus is MERGED_INTO");
            }
            if (id.equals(mergedIntoId)) {
                throw new IllegalArgumentException("Record cannot be merged into itself: " + id);
            }
            return new RawRecord(this);
        }
    }
}
