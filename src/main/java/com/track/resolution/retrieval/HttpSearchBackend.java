package com.track.resolution.retrieval;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Search backend reached with a GET on a URL template containing {@code {query}}.
 */
public class HttpSearchBackend implements SearchBackend {

    public static final String DUCKDUCKGO_HTML = "https://html.duckduckgo.com/html/?q={query}&kl=us-en";
    public static final String DUCKDUCKGO_LITE = "https://lite.duckduckgo.com/lite/?q={query}&kl=us-en";
    public static final String BING = "https://www.bing.com/search?q={query}&setlang=en-US";

    private final String name;
    private final String urlTemplate;
    private final HttpPageClient client;

    public HttpSearchBackend(String name, String urlTemplate, HttpPageClient client) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate is required");
        this.client = Objects.requireNonNull(client, "client is required");
        if (!urlTemplate.contains("{query}")) {
            throw new IllegalArgumentException("urlTemplate must contain {query}: " + urlTemplate);
        }
    }

    /**
     * DuckDuckGo HTML, DuckDuckGo Lite, then Bing.
     */
    public static List<SearchBackend> defaults(HttpPageClient client) {
        return List.of(
                new HttpSearchBackend("duckduckgo-html", DUCKDUCKGO_HTML, client),
                new HttpSearchBackend("duckduckgo-lite", DUCKDUCKGO_LITE, client),
                new HttpSearchBackend("bing", BING, client)
        );
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public HttpPage search(String queryText) throws RetrievalException {
        String encoded = URLEncoder.encode(queryText, StandardCharsets.UTF_8);
        return client.get(URI.create(urlTemplate.replace("{query}", encoded)));
    }

    @Override
    public String toString() {
        return "HttpSearchBackend{" + name + '}';
    }
}
