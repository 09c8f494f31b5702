package com.track.resolution.retrieval;

/**
 * A fetch failed: timeout, connection error, HTTP error status or browser failure.
 * Strategies convert it into a failed {@link com.track.resolution.core.model.RawResponse}.
 */
public class RetrievalException extends Exception {

    private final int statusCode;

    public RetrievalException(String message) {
        this(message, -1, null);
    }

    public RetrievalException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RetrievalException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private RetrievalException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status code, or -1 when the failure happened before a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * True for responses search backends use to throttle clients.
     */
    public boolean isRateLimited() {
        return statusCode == 429 || statusCode == 403 || statusCode == 202;
    }
}
