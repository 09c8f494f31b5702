package com.track.resolution.extract;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A catalog track link of the form {@code /track/{slug}/{id}}.
 *
 * @param slug the URL slug
 * @param id   the numeric catalog id
 */
public record CatalogTrackUrl(String slug, String id) {

    public static final String DEFAULT_BASE_URL = "https://www.beatport.com";

    private static final Pattern TRACK_PATH = Pattern.compile("/track/([^/?#\"'\\s]+)/(\\d+)");
    private static final Pattern REDIRECT_PARAM = Pattern.compile("[?&](?:uddg|u|url|q)=([^&]+)");

    /**
     * Recognizes a track link, unwrapping search-engine redirect hrefs
     * ({@code //duckduckgo.com/l/?uddg=https%3A%2F%2F...}).
     */
    public static Optional<CatalogTrackUrl> parse(String href) {
        if (href == null || href.isBlank()) {
            return Optional.empty();
        }
        Optional<CatalogTrackUrl> direct = match(href);
        if (direct.isPresent()) {
            return direct;
        }
        Matcher redirect = REDIRECT_PARAM.matcher(href);
        while (redirect.find()) {
            String decoded = decode(redirect.group(1));
            Optional<CatalogTrackUrl> wrapped = match(decoded);
            if (wrapped.isPresent()) {
                return wrapped;
            }
        }
        return Optional.empty();
    }

    public static boolean isTrackLink(String href) {
        return parse(href).isPresent();
    }

    public String toUrl(String baseUrl) {
        return baseUrl + "/track/" + slug + "/" + id;
    }

    public String toUrl() {
        return toUrl(DEFAULT_BASE_URL);
    }

    private static Optional<CatalogTrackUrl> match(String text) {
        Matcher m = TRACK_PATH.matcher(text);
        if (m.find()) {
            return Optional.of(new CatalogTrackUrl(m.group(1), m.group(2)));
        }
        return Optional.empty();
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escape sequence; match against the raw text instead
            return value;
        }
    }
}
