package com.track.resolution.retrieval;

import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Single HTTP request against the catalog's own search page.
 *
 * <pre>
 * DirectSearchStrategy direct = DirectSearchStrategy.builder()
 *     .baseUrl("https://www.beatport.com")
 *     .client(new HttpPageClient())
 *     .build();
 * </pre>
 */
public class DirectSearchStrategy implements RetrievalStrategy {
    private static final Logger log = LoggerFactory.getLogger(DirectSearchStrategy.class);

    public static final String DEFAULT_BASE_URL = "https://www.beatport.com";
    public static final String DEFAULT_SEARCH_PATH = "/search?q=";

    private final String baseUrl;
    private final String searchPath;
    private final HttpPageClient client;

    private DirectSearchStrategy(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.searchPath = builder.searchPath != null ? builder.searchPath : DEFAULT_SEARCH_PATH;
        this.client = builder.client != null ? builder.client : new HttpPageClient();
    }

    @Override
    public StrategyType type() {
        return StrategyType.DIRECT_SEARCH;
    }

    @Override
    public RawResponse fetch(Query query) {
        URI uri = searchUri(query.text());
        long start = System.nanoTime();
        try {
            HttpPage page = client.get(uri);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            if (!page.isSuccess()) {
                log.debug("Direct search for '{}' returned HTTP {}", query.text(), page.statusCode());
                return RawResponse.failure(query, type(), "HTTP " + page.statusCode(), latency);
            }
            return RawResponse.success(query, type(), PayloadFormat.detect(page.contentType(), page.body()),
                    page.body(), page.url(), latency);
        } catch (RetrievalException e) {
            log.debug("Direct search for '{}' failed: {}", query.text(), e.getMessage());
            return RawResponse.failure(query, type(), e.getMessage(), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    URI searchUri(String text) {
        return URI.create(baseUrl + searchPath + URLEncoder.encode(text, StandardCharsets.UTF_8));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String searchPath;
        private HttpPageClient client;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder searchPath(String searchPath) {
            this.searchPath = searchPath;
            return this;
        }

        public Builder client(HttpPageClient client) {
            this.client = client;
            return this;
        }

        public DirectSearchStrategy build() {
            return new DirectSearchStrategy(this);
        }
    }
}
