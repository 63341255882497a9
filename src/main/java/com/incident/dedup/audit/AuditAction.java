package com.incident.dedup.audit;

/**
 * Auditable actions of the deduplication engine.
 */
public enum AuditAction {
    RECORD_MERGED,
    MERGE_CONFLICT,
    MERGE_ROLLED_BACK,
    CANONICAL_LINK_CONFLICT,
    INTEGRITY_VIOLATION,
    MATCH_FOUND,
    CANONICAL_INCIDENT_CREATED
}
