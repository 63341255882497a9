package com.incident.dedup.store;

/**
 * Infrastructure failure of the backing incident store (unreachable, rejected write, missing record).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
