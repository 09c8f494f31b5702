package com.track.resolution.core.model;

/**
 * Terminal classification of a source track.
 */
public enum DispositionType {
    MATCHED,
    FLAGGED_FOR_REVIEW,
    UNMATCHED
}
