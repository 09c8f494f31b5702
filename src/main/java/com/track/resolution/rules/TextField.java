package com.track.resolution.rules;

/**
 * The kind of text a normalization rule is scoped to.
 */
public enum TextField {
    TITLE,
    ARTIST,
    MIX_LABEL,
    QUERY
}
