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
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Renders the catalog search page in a browser to obtain JavaScript-populated results.
 * Concurrent browser contexts are capped independently of the per-strategy rate limit.
 */
public class BrowserAutomationSearchStrategy implements RetrievalStrategy {
    private static final Logger log = LoggerFactory.getLogger(BrowserAutomationSearchStrategy.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CONTEXTS = 2;

    private final BrowserRenderer renderer;
    private final String searchUrlPrefix;
    private final Duration timeout;
    private final Semaphore contexts;

    public BrowserAutomationSearchStrategy(BrowserRenderer renderer) {
        this(renderer, DirectSearchStrategy.DEFAULT_BASE_URL + DirectSearchStrategy.DEFAULT_SEARCH_PATH,
                DEFAULT_TIMEOUT, DEFAULT_MAX_CONTEXTS);
    }

    public BrowserAutomationSearchStrategy(BrowserRenderer renderer, String searchUrlPrefix,
                                           Duration timeout, int maxContexts) {
        if (maxContexts <= 0) {
            throw new IllegalArgumentException("maxContexts must be > 0");
        }
        this.renderer = Objects.requireNonNull(renderer, "renderer is required");
        this.searchUrlPrefix = Objects.requireNonNull(searchUrlPrefix, "searchUrlPrefix is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.contexts = new Semaphore(maxContexts, true);
    }

    @Override
    public StrategyType type() {
        return StrategyType.BROWSER_AUTOMATION;
    }

    @Override
    public boolean isAvailable() {
        return renderer.isAvailable();
    }

    @Override
    public RawResponse fetch(Query query) {
        long start = System.nanoTime();
        if (!renderer.isAvailable()) {
            return RawResponse.failure(query, type(), "browser unavailable", Duration.ZERO);
        }
        URI uri = URI.create(searchUrlPrefix + URLEncoder.encode(query.text(), StandardCharsets.UTF_8));
        try {
            if (!contexts.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return RawResponse.failure(query, type(), "no browser context free within " + timeout,
                        elapsed(start));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RawResponse.failure(query, type(), "interrupted waiting for a browser context", elapsed(start));
        }
        try {
            String html = renderer.render(uri, timeout);
            return RawResponse.success(query, type(), PayloadFormat.detect("text/html", html), html,
                    uri.toString(), elapsed(start));
        } catch (RetrievalException e) {
            log.debug("Browser search for '{}' failed: {}", query.text(), e.getMessage());
            return RawResponse.failure(query, type(), e.getMessage(), elapsed(start));
        } finally {
            contexts.release();
        }
    }

    int availableContexts() {
        return contexts.availablePermits();
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
