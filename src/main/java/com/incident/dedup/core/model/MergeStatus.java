package com.incident.dedup.core.model;

/**
 * Linkage state of a raw record with respect to cross-source merging.
 * Records are never physically deleted; merged-away records stay as an audit trail.
 */
public enum MergeStatus {
    /**
     * Not involved in any merge yet.
     */
    NONE,

    /**
     * A primary record that has absorbed at least one secondary.
     */
    MERGED,

    /**
     * A secondary record absorbed into a primary. Terminal for merge purposes.
     */
    MERGED_INTO
}
