package com.incident.dedup.dedup;

/**
 * Run-level failure of a deduplication pass, raised when the record window cannot be loaded.
 */
public class DeduplicationRunException extends RuntimeException {

    private final String runId;

    public DeduplicationRunException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
