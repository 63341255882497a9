package com.incident.dedup.core.model;

/**
 * Ingest pipeline status of a raw record.
 */
public enum ProcessingStatus {
    NEW,
    PROCESSING,
    READY,
    COMPLETE,
    ERROR
}
