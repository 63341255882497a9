package com.incident.dedup.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * De-duplicated incident exposed to downstream consumers.
 * Built from a primary raw record and enriched by the records merged into it.
 */
public final class CanonicalIncident implements IncidentFacts {
    private final String id;
    private final Instant occurredAt;
    private final Double latitude;
    private final Double longitude;
    private final String title;
    private final String description;
    private final String region;
    private final String incidentTypeName;
    private final String vesselName;
    private final String vesselImo;
    private final String primaryRecordId;

    public CanonicalIncident(String id, Instant occurredAt, Double latitude, Double longitude,
                             String title, String description, String region,
                             String incidentTypeName, String vesselName, String vesselImo,
                             String primaryRecordId) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.occurredAt = occurredAt;
        this.latitude = latitude;
        this.longitude = longitude;
        this.title = title;
        this.description = description;
        this.region = region;
        this.incidentTypeName = incidentTypeName;
        this.vesselName = vesselName;
        this.vesselImo = vesselImo;
        this.primaryRecordId = primaryRecordId;
    }

    /**
     * Materializes a canonical incident from the record that first reported it.
     */
    public static CanonicalIncident fromRecord(String id, RawRecord record) {
        return new CanonicalIncident(id, record.getOccurredAt(), record.getLatitude(), record.getLongitude(),
                record.getTitle(), record.getDescription(), record.getRegion(),
                record.getIncidentTypeName(), record.getVesselName(), record.getVesselImo(),
                record.getId());
    }

    @Override
    public String getId() {
        return id;
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

    @Override
    public String getIncidentTypeName() {
        return incidentTypeName;
    }

    @Override
    public String getVesselName() {
        return vesselName;
    }

    @Override
    public String getVesselImo() {
        return vesselImo;
    }

    public String getPrimaryRecordId() {
        return primaryRecordId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalIncident that = (CanonicalIncident) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalIncident{" +
                "id='" + id + '\'' +
                ", occurredAt=" + occurredAt +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", incidentTypeName='" + incidentTypeName + '\'' +
                ", vesselName='" + vesselName + '\'' +
                '}';
    }
}
