package com.track.resolution.adjudication;

/**
 * States of the per-track adjudication state machine.
 *
 * <pre>
 * PLANNING -&gt; RETRIEVING -&gt; EXTRACTING -&gt; SCORING -&gt; DECIDING -&gt; {MATCHED, FLAGGED_FOR_REVIEW, UNMATCHED}
 *    ^            ^  (escalate)   |            |
 *    |            +---------------+            |
 *    +---------------- next rank --------------+
 * </pre>
 */
public enum AdjudicationState {
    PLANNING,
    RETRIEVING,
    EXTRACTING,
    SCORING,
    DECIDING,
    MATCHED,
    FLAGGED_FOR_REVIEW,
    UNMATCHED;

    public boolean isTerminal() {
        return this == MATCHED || this == FLAGGED_FOR_REVIEW || this == UNMATCHED;
    }
}
