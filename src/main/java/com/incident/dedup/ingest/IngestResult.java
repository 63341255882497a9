package com.incident.dedup.ingest;

import com.incident.dedup.core.model.ProcessingStatus;

/**
 * Per-record outcome of an ingest batch.
 *
 * @param recordId            the ingested record
 * @param canonicalIncidentId the incident it was linked to, null on error
 * @param matched             true if linked to an existing incident, false if a new one was created
 * @param vesselReferenceId   the resolved reference vessel, may be null
 * @param status              the processing status written back
 * @param error               failure message when {@code status} is ERROR
 */
public record IngestResult(
        String recordId,
        String canonicalIncidentId,
        boolean matched,
        String vesselReferenceId,
        ProcessingStatus status,
        String error
) {
    public static IngestResult failed(String recordId, String error) {
        return new IngestResult(recordId, null, false, null, ProcessingStatus.ERROR, error);
    }

    public boolean isError() {
        return status == ProcessingStatus.ERROR;
    }
}
