package com.incident.dedup.merge;

import com.incident.dedup.core.model.MergeStatus;
import com.incident.dedup.core.model.RawRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Partial update for a primary record. A null field means "leave unchanged".
 * Conflicts are informational and never applied. The modification time is stamped onto the
 * record only when the update writes at least one field; it is not itself a changed field.
 */
public final class FieldUpdateSet {
    private final String title;
    private final String description;
    private final String updateText;
    private final String location;
    private final String region;
    private final String incidentTypeName;
    private final String vesselName;
    private final String vesselType;
    private final String vesselFlag;
    private final String vesselImo;
    private final String vesselStatus;
    private final Double latitude;
    private final Double longitude;
    private final String canonicalIncidentId;
    private final boolean markMerged;
    private final Instant lastMergedAt;
    private final Set<String> mergedSources;
    private final Set<String> mergedRecordIds;
    private final String processingNotes;
    private final List<MergeConflict> conflicts;
    private final Instant modifiedAt;

    private FieldUpdateSet(Builder builder) {
        this.title = builder.title;
        this.description = builder.description;
        this.updateText = builder.updateText;
        this.location = builder.location;
        this.region = builder.region;
        this.incidentTypeName = builder.incidentTypeName;
        this.vesselName = builder.vesselName;
        this.vesselType = builder.vesselType;
        this.vesselFlag = builder.vesselFlag;
        this.vesselImo = builder.vesselImo;
        this.vesselStatus = builder.vesselStatus;
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.canonicalIncidentId = builder.canonicalIncidentId;
        this.markMerged = builder.markMerged;
        this.lastMergedAt = builder.lastMergedAt;
        this.mergedSources = builder.mergedSources != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.mergedSources)) : null;
        this.mergedRecordIds = builder.mergedRecordIds != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.mergedRecordIds)) : null;
        this.processingNotes = builder.processingNotes;
        this.conflicts = List.copyOf(builder.conflicts);
        this.modifiedAt = builder.modifiedAt;
    }

    public static FieldUpdateSet empty() {
        return builder().build();
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getUpdateText() {
        return updateText;
    }

    public String getLocation() {
        return location;
    }

    public String getRegion() {
        return region;
    }

    public String getIncidentTypeName() {
        return incidentTypeName;
    }

    public String getVesselName() {
        return vesselName;
    }

    public String getVesselType() {
        return vesselType;
    }

    public String getVesselFlag() {
        return vesselFlag;
    }

    public String getVesselImo() {
        return vesselImo;
    }

    public String getVesselStatus() {
        return vesselStatus;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public String getCanonicalIncidentId() {
        return canonicalIncidentId;
    }

    public boolean isMarkMerged() {
        return markMerged;
    }

    public Instant getLastMergedAt() {
        return lastMergedAt;
    }

    public Set<String> getMergedSources() {
        return mergedSources;
    }

    public Set<String> getMergedRecordIds() {
        return mergedRecordIds;
    }

    public String getProcessingNotes() {
        return processingNotes;
    }

    public List<MergeConflict> getConflicts() {
        return conflicts;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    /**
     * Names of the fields this update would write.
     */
    public List<String> changedFields() {
        List<String> fields = new ArrayList<>();
        if (title != null) fields.add("title");
        if (description != null) fields.add("description");
        if (updateText != null) fields.add("updateText");
        if (location != null) fields.add("location");
        if (region != null) fields.add("region");
        if (incidentTypeName != null) fields.add("incidentTypeName");
        if (vesselName != null) fields.add("vesselName");
        if (vesselType != null) fields.add("vesselType");
        if (vesselFlag != null) fields.add("vesselFlag");
        if (vesselImo != null) fields.add("vesselImo");
        if (vesselStatus != null) fields.add("vesselStatus");
        if (latitude != null && longitude != null) fields.add("coordinates");
        if (canonicalIncidentId != null) fields.add("canonicalIncidentId");
        if (markMerged) fields.add("mergeStatus");
        if (lastMergedAt != null) fields.add("lastMergedAt");
        if (mergedSources != null) fields.add("mergedSources");
        if (mergedRecordIds != null) fields.add("mergedRecordIds");
        if (processingNotes != null) fields.add("processingNotes");
        return fields;
    }

    public boolean isEmpty() {
        return changedFields().isEmpty();
    }

    /**
     * Returns a copy of {@code record} with every non-null field of this update written over it.
     * A record already merged into another keeps its merge status. Without a modification time
     * the record keeps its own.
     */
    public RawRecord applyTo(RawRecord record) {
        RawRecord.Builder builder = RawRecord.builder(record);
        if (title != null) builder.title(title);
        if (description != null) builder.description(description);
        if (updateText != null) builder.updateText(updateText);
        if (location != null) builder.location(location);
        if (region != null) builder.region(region);
        if (incidentTypeName != null) builder.incidentTypeName(incidentTypeName);
        if (vesselName != null) builder.vesselName(vesselName);
        if (vesselType != null) builder.vesselType(vesselType);
        if (vesselFlag != null) builder.vesselFlag(vesselFlag);
        if (vesselImo != null) builder.vesselImo(vesselImo);
        if (vesselStatus != null) builder.vesselStatus(vesselStatus);
        if (latitude != null && longitude != null) builder.coordinates(latitude, longitude);
        if (canonicalIncidentId != null) builder.canonicalIncidentId(canonicalIncidentId);
        if (markMerged && !record.isMergedInto()) builder.mergeStatus(MergeStatus.MERGED);
        if (lastMergedAt != null) builder.lastMergedAt(lastMergedAt);
        if (mergedSources != null) builder.mergedSources(mergedSources);
        if (mergedRecordIds != null) builder.mergedRecordIds(mergedRecordIds);
        if (processingNotes != null) builder.processingNotes(processingNotes);
        if (modifiedAt != null && !isEmpty()) builder.modifiedAt(modifiedAt);
        return builder.build();
    }

    @Override
    public String toString() {
        return "FieldUpdateSet{fields=" + changedFields() + ", conflicts=" + conflicts + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String description;
        private String updateText;
        private String location;
        private String region;
        private String incidentTypeName;
        private String vesselName;
        private String vesselType;
        private String vesselFlag;
        private String vesselImo;
        private String vesselStatus;
        private Double latitude;
        private Double longitude;
        private String canonicalIncidentId;
        private boolean markMerged;
        private Instant lastMergedAt;
        private Set<String> mergedSources;
        private Set<String> mergedRecordIds;
        private String processingNotes;
        private final List<MergeConflict> conflicts = new ArrayList<>();
        private Instant modifiedAt;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder updateText(String updateText) {
            this.updateText = updateText;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
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

        public Builder coordinates(Double latitude, Double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder canonicalIncidentId(String canonicalIncidentId) {
            this.canonicalIncidentId = canonicalIncidentId;
            return this;
        }

        public Builder markMerged(boolean markMerged) {
            this.markMerged = markMerged;
            return this;
        }

        public Builder lastMergedAt(Instant lastMergedAt) {
            this.lastMergedAt = lastMergedAt;
            return this;
        }

        public Builder mergedSources(Set<String> mergedSources) {
            this.mergedSources = mergedSources;
            return this;
        }

        public Builder mergedRecordIds(Set<String> mergedRecordIds) {
            this.mergedRecordIds = mergedRecordIds;
            return this;
        }

        public Builder processingNotes(String processingNotes) {
            this.processingNotes = processingNotes;
            return this;
        }

        public Builder conflict(MergeConflict conflict) {
            this.conflicts.add(conflict);
            return this;
        }

        public Builder modifiedAt(Instant modifiedAt) {
            this.modifiedAt = modifiedAt;
            return this;
        }

        public FieldUpdateSet build() {
            return new FieldUpdateSet(this);
        }
    }
}
