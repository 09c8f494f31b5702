package com.track.resolution.retrieval;

/**
 * A fetched page.
 */
public record HttpPage(String url, int statusCode, String contentType, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
