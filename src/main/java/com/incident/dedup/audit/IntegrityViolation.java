package com.incident.dedup.audit;

/**
 * A merge-linkage defect found by {@link MergeIntegrityChecker}.
 *
 * @param recordId     the offending record
 * @param mergedIntoId its merge target
 * @param kind         what is wrong
 */
public record IntegrityViolation(String recordId, String mergedIntoId, Kind kind) {

    public enum Kind {
        /**
         * The target is itself merged into another record.
         */
        CHAINED_MERGE,
        /**
         * The record points at itself.
         */
        SELF_MERGE,
        /**
         * The target record does not exist.
         */
        DANGLING_TARGET
    }
}
