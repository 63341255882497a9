package com.incident.dedup.metrics;

/**
 * Result of one merge attempt, as counted by metrics.
 */
public enum MergeOutcome {
    SUCCEEDED,
    /**
     * The secondary's merge state changed under us (lost race).
     */
    CONFLICT,
    /**
     * A write failed and the completed writes were compensated.
     */
    ROLLED_BACK,
    /**
     * Lock timeout, integrity violation or another failure before any write.
     */
    FAILED
}
