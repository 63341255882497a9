package com.incident.dedup.lock;

/**
 * Thrown when a record lock cannot be acquired within the configured budget.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
