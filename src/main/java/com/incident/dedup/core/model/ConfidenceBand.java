package com.incident.dedup.core.model;

/**
 * Reporting label for a pair that met the merge threshold.
 * Both bands follow the same merge path; the label only feeds summaries and metrics.
 */
public enum ConfidenceBand {
    /**
     * Score at or above the high-confidence threshold (0.80 by default).
     */
    HIGH,

    /**
     * Score at or above the merge threshold but below the high-confidence threshold.
     */
    MEDIUM;

    public static ConfidenceBand of(double score, double highConfidenceThreshold) {
        return score >= highConfidenceThreshold ? HIGH : MEDIUM;
    }
}
