package com.track.resolution.tracing;

import java.util.Map;

/**
 * Tracing integration point. The default {@link NoOpTracingService} does nothing,
 * so the library runs without any tracing dependency on the classpath.
 *
 * <p>Span names used by the pipeline: {@code track.adjudicate} (one per track) and
 * {@code track.retrieve} (one per strategy fetch).</p>
 */
public interface TracingService {

    String ADJUDICATE_SPAN = "track.adjudicate";
    String RETRIEVE_SPAN = "track.retrieve";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
