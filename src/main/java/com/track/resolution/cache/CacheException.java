package com.track.resolution.cache;

/**
 * Thrown when the cache storage cannot be read or written.
 * Never fatal: callers switch to bypass mode.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
