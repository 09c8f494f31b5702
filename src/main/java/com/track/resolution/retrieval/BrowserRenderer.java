package com.track.resolution.retrieval;

import java.net.URI;
import java.time.Duration;

/**
 * Renders a page in a scriptable browser and returns the resulting HTML.
 */
public interface BrowserRenderer extends AutoCloseable {

    /**
     * Whether a browser can be started in this environment.
     */
    boolean isAvailable();

    String render(URI uri, Duration timeout) throws RetrievalException;

    @Override
    default void close() {
    }
}
