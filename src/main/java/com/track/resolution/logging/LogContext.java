package com.track.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forTrack(runId, track.id())) {
 *     log.info("track.disposed type={}", disposition.type());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String TRACK_ID = "trackId";
    public static final String STRATEGY = "strategy";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    public static LogContext forTrack(String runId, String trackId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(TRACK_ID, trackId);
        return ctx;
    }

    /**
     * Run id bound to the calling thread, or null outside a run.
     */
    public static String currentRunId() {
        return MDC.get(RUN_ID);
    }

    /**
     * Track id bound to the calling thread, or null outside a track.
     */
    public static String currentTrackId() {
        return MDC.get(TRACK_ID);
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
