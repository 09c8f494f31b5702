package com.track.resolution.retrieval;

import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Searches the catalog through third-party search engines.
 *
 * <p>Backends are tried in a fixed rotation order; each backend runs site-restricted query
 * variants until one lists a catalog track link. The first such page is returned. A backend
 * that errors or throttles us is put in cooldown in the {@link EngineHealthRegistry} and
 * skipped by later queries. When every backend fails the fetch fails; when backends answer
 * without catalog links the last answer is returned as an empty success.</p>
 */
public class EngineFallbackSearchStrategy implements RetrievalStrategy {
    private static final Logger log = LoggerFactory.getLogger(EngineFallbackSearchStrategy.class);

    public static final String DEFAULT_CATALOG_DOMAIN = "beatport.com";

    private final List<SearchBackend> backends;
    private final EngineHealthRegistry health;
    private final String catalogDomain;
    private final Pattern trackLink;

    public EngineFallbackSearchStrategy(List<SearchBackend> backends, EngineHealthRegistry health) {
        this(backends, health, DEFAULT_CATALOG_DOMAIN);
    }

    public EngineFallbackSearchStrategy(List<SearchBackend> backends, EngineHealthRegistry health,
                                        String catalogDomain) {
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("at least one search backend is required");
        }
        this.backends = List.copyOf(backends);
        this.health = Objects.requireNonNull(health, "health is required");
        this.catalogDomain = Objects.requireNonNull(catalogDomain, "catalogDomain is required");
        this.trackLink = Pattern.compile(Pattern.quote(catalogDomain) + "(?:/|%2F)track(?:/|%2F)[^/\"'%]+(?:/|%2F)\\d+",
                Pattern.CASE_INSENSITIVE);
    }

    @Override
    public StrategyType type() {
        return StrategyType.ENGINE_FALLBACK;
    }

    @Override
    public RawResponse fetch(Query query) {
        long start = System.nanoTime();
        HttpPage lastEmpty = null;
        int attempted = 0;

        for (SearchBackend backend : backends) {
            if (!health.isHealthy(backend.name())) {
                log.debug("Skipping unhealthy backend {}", backend.name());
                continue;
            }
            attempted++;
            try {
                for (String variant : variants(query.text())) {
                    HttpPage page = backend.search(variant);
                    if (!page.isSuccess()) {
                        throw new RetrievalException(backend.name() + " returned HTTP " + page.statusCode(),
                                page.statusCode());
                    }
                    if (trackLink.matcher(page.body()).find()) {
                        log.debug("Backend {} found catalog links for '{}'", backend.name(), variant);
                        return RawResponse.success(query, type(), PayloadFormat.HTML, page.body(), page.url(),
                                elapsed(start));
                    }
                    lastEmpty = page;
                }
            } catch (RetrievalException e) {
                health.markFailing(backend.name(), e.getMessage());
            }
        }

        if (lastEmpty != null) {
            return RawResponse.success(query, type(), PayloadFormat.HTML, lastEmpty.body(), lastEmpty.url(),
                    elapsed(start));
        }
        String reason = attempted == 0
                ? "all search backends unhealthy"
                : "all search backends failed";
        return RawResponse.failure(query, type(), reason, elapsed(start));
    }

    @Override
    public boolean isAvailable() {
        return backends.stream().anyMatch(b -> health.isHealthy(b.name()));
    }

    /**
     * Quoted track-page search, unquoted track-page search, then the whole domain.
     */
    List<String> variants(String text) {
        String unquoted = text.replace("\"", "").trim();
        return List.of(
                "site:" + catalogDomain + "/track \"" + unquoted + "\"",
                "site:" + catalogDomain + "/track " + unquoted,
                "site:" + catalogDomain + " " + unquoted
        );
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
