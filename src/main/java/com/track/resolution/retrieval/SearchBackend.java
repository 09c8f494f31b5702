package com.track.resolution.retrieval;

/**
 * A third-party web search engine used by {@link EngineFallbackSearchStrategy}.
 */
public interface SearchBackend {

    String name();

    /**
     * Runs one search and returns the result page, whatever its status code.
     *
     * @throws RetrievalException on transport failure
     */
    HttpPage search(String queryText) throws RetrievalException;
}
