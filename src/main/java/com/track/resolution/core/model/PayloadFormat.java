package com.track.resolution.core.model;

import java.util.Locale;

/**
 * Shape of a raw response payload.
 */
public enum PayloadFormat {
    HTML,
    JSON,
    EMPTY;

    /**
     * Detects the payload format from a content type header and the body itself.
     */
    public static PayloadFormat detect(String contentType, String body) {
        if (body == null || body.isBlank()) {
            return EMPTY;
        }
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json")) {
            return JSON;
        }
        String head = body.stripLeading();
        if (head.startsWith("{") || head.startsWith("[")) {
            return JSON;
        }
        return HTML;
    }
}
