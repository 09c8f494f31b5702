package com.track.resolution.tracing;

/**
 * A unit of work in a trace, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("track.adjudicate")) {
 *     span.setAttribute("track.id", track.id());
 *     span.addEvent("escalated");
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
