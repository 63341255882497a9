package com.incident.dedup.merge;

/**
 * Thrown inside a merge when a conditional merge-state write finds the record already changed.
 */
public class MergeConflictException extends RuntimeException {

    private final String recordId;

    public MergeConflictException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
