package com.track.resolution.adjudication;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by all adjudications of a run.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Resolution run cancelled");
        }
    }

    /**
     * A token that is never cancelled by anyone else.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
