package com.track.resolution.extract;

/**
 * Raised by an extraction strategy when a payload it claimed cannot be read.
 * Never escapes {@link CandidateExtractor}.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
