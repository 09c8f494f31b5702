package com.track.resolution.api;

import com.track.resolution.adjudication.CancellationToken;
import com.track.resolution.core.model.Disposition;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle on a submitted batch of tracks. Every submitted track receives a disposition,
 * cancelled ones included.
 */
public class ResolutionRun {

    private final String runId;
    private final int trackCount;
    private final CancellationToken token;
    private final CompletableFuture<RunResult> completion;
    private final AtomicInteger completed;

    ResolutionRun(String runId, int trackCount, CancellationToken token,
                  CompletableFuture<RunResult> completion, AtomicInteger completed) {
        this.runId = runId;
        this.trackCount = trackCount;
        this.token = token;
        this.completion = completion;
        this.completed = completed;
    }

    public String getRunId() {
        return runId;
    }

    public int getTrackCount() {
        return trackCount;
    }

    public int getCompletedCount() {
        return completed.get();
    }

    /**
     * Requests cooperative cancellation. Tracks not yet decided end as
     * unmatched with reason {@value Disposition#CANCELLED}.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public CompletableFuture<RunResult> completion() {
        return completion;
    }

    /**
     * Blocks until every track has a disposition.
     */
    public RunResult await() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Resolution run " + runId + " failed", e.getCause());
        }
    }

    public RunResult await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Resolution run " + runId + " failed", e.getCause());
        }
    }
}
