package com.incident.dedup.store;

/**
 * Outcome of a conditional merge-state write.
 */
public enum MergeStateUpdateResult {
    /**
     * The record was in the expected prior state and now carries the new state.
     */
    APPLIED,

    /**
     * The record's current state differed from the expected prior state; nothing was written.
     */
    CONFLICT,

    /**
     * No record with the given id exists.
     */
    NOT_FOUND
}
