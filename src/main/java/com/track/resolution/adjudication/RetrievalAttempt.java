package com.track.resolution.adjudication;

import com.track.resolution.core.model.RawResponse;

import java.util.List;

/**
 * Final response for one (query, strategy) pair together with the failures of
 * earlier attempts.
 *
 * @param response the response served, from the cache or the last attempt
 * @param failures failure reasons of attempts that did not succeed, in order
 */
public record RetrievalAttempt(RawResponse response, List<String> failures) {

    public RetrievalAttempt {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean succeeded() {
        return response.success();
    }
}
