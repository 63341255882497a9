package com.incident.dedup.core.model;

import java.time.Instant;

/**
 * Event facts shared by raw records and canonical incidents.
 * The composite scorer compares any two {@code IncidentFacts}, so a new report can be
 * scored against another report or against an already materialized canonical incident.
 */
public interface IncidentFacts {

    /**
     * Store-assigned identifier.
     */
    String getId();

    Instant getOccurredAt();

    Double getLatitude();

    Double getLongitude();

    String getTitle();

    String getDescription();

    String getIncidentTypeName();

    String getVesselName();

    String getVesselImo();
}
