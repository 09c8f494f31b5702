package com.track.resolution.extract;

import com.track.resolution.core.model.Candidate;

import java.util.List;

/**
 * Candidates read from one response, the strategy that produced them, and the
 * failures of any strategy that claimed the payload but could not read it.
 *
 * @param candidates candidates in listing order, unique by catalog id
 * @param strategy   name of the producing strategy, or null if none produced any
 * @param failures   "strategy: reason" entries
 */
public record ExtractionOutcome(List<Candidate> candidates, String strategy, List<String> failures) {

    public ExtractionOutcome {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean failed() {
        return candidates.isEmpty() && !failures.isEmpty();
    }
}
