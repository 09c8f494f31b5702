package com.track.resolution.extract;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.RawResponse;

import java.util.List;

/**
 * One way of reading candidates out of a raw response.
 * The set of strategies is closed and tried in a fixed priority order.
 */
public interface ExtractionStrategy {

    /**
     * Short name used in logs and audit entries.
     */
    String name();

    /**
     * Cheap structural test on the payload; no parsing beyond a substring check.
     */
    boolean appliesTo(RawResponse response);

    /**
     * Extracts candidates. An empty list means the payload was readable but listed nothing.
     *
     * @throws ExtractionException if the payload is malformed
     */
    List<Candidate> extract(RawResponse response) throws ExtractionException;
}
