package com.track.resolution.audit;

/**
 * Types of events recorded in the generic audit log.
 */
public enum AuditAction {
    QUERY_ISSUED,
    RETRIEVAL_FAILED,
    EXTRACTION_FAILED,
    CACHE_ERROR,
    ESCALATED,
    CANDIDATE_VETOED,
    DISPOSITION_RECORDED
}
