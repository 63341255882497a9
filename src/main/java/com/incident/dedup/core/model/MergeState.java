package com.incident.dedup.core.model;

import java.util.Objects;

/**
 * Linkage state written by a conditional merge-state update.
 *
 * @param status       the new merge status
 * @param mergedIntoId the primary's id; set iff status is {@link MergeStatus#MERGED_INTO}
 */
public record MergeState(MergeStatus status, String mergedIntoId) {

    public MergeState {
        Objects.requireNonNull(status, "status is required");
        if (status == MergeStatus.MERGED_INTO && (mergedIntoId == null || mergedIntoId.isBlank())) {
            throw new IllegalArgumentException("mergedIntoId is required for MERGED_INTO");
        }
        if (status != MergeStatus.MERGED_INTO && mergedIntoId != null) {
            throw new IllegalArgumentException("mergedIntoId is only allowed for MERGED_INTO");
        }
    }

    public static MergeState mergedInto(String primaryId) {
        return new MergeState(MergeStatus.MERGED_INTO, primaryId);
    }

    public static MergeState none() {
        return new MergeState(MergeStatus.NONE, null);
    }
}
