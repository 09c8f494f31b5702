package com.track.resolution.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.track.resolution.adjudication.Adjudicator;
import com.track.resolution.adjudication.CancellationToken;
import com.track.resolution.adjudication.RetrievalCoordinator;
import com.track.resolution.audit.AuditAction;
import com.track.resolution.audit.AuditTrail;
import com.track.resolution.cache.CacheConfig;
import com.track.resolution.cache.CacheException;
import com.track.resolution.cache.CaffeineResponseCache;
import com.track.resolution.cache.FailSafeResponseCache;
import com.track.resolution.cache.FileResponseCache;
import com.track.resolution.cache.NoOpResponseCache;
import com.track.resolution.cache.ResponseCache;
import com.track.resolution.core.model.Disposition;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.extract.CandidateExtractor;
import com.track.resolution.extract.CatalogMarkupExtractionStrategy;
import com.track.resolution.extract.HydrationStateExtractionStrategy;
import com.track.resolution.extract.SearchEngineListingExtractionStrategy;
import com.track.resolution.guard.GuardChain;
import com.track.resolution.logging.LogContext;
import com.track.resolution.metrics.MetricsService;
import com.track.resolution.metrics.NoOpMetricsService;
import com.track.resolution.query.QueryPlanner;
import com.track.resolution.retrieval.BrowserAutomationSearchStrategy;
import com.track.resolution.retrieval.BrowserRenderer;
import com.track.resolution.retrieval.DirectSearchStrategy;
import com.track.resolution.retrieval.EngineFallbackSearchStrategy;
import com.track.resolution.retrieval.EngineHealthRegistry;
import com.track.resolution.retrieval.HttpPageClient;
import com.track.resolution.retrieval.HttpSearchBackend;
import com.track.resolution.retrieval.PlaywrightBrowserRenderer;
import com.track.resolution.retrieval.RateLimiter;
import com.track.resolution.retrieval.RetrievalStrategy;
import com.track.resolution.review.InMemoryReviewQueue;
import com.track.resolution.review.ReviewQueue;
import com.track.resolution.rules.NormalizationEngine;
import com.track.resolution.rules.TrackNormalizationRules;
import com.track.resolution.scoring.TrackScorer;
import com.track.resolution.tracing.NoOpTracingService;
import com.track.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for resolving source tracks against the catalog.
 * Tracks are independent and adjudicated concurrently on a fixed pool of worker threads.
 *
 * <p>Example usage:</p>
 * <pre>
 * try (TrackResolver resolver = TrackResolver.builder()
 *         .config(MatchingConfig.builder().browserAutomationEnabled(false).build())
 *         .build()) {
 *     RunResult result = resolver.resolve(tracks);
 *     result.ofType(DispositionType.FLAGGED_FOR_REVIEW).forEach(...);
 * }
 * </pre>
 */
public class TrackResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TrackResolver.class);

    private final MatchingConfig config;
    private final Adjudicator adjudicator;
    private final RetrievalCoordinator coordinator;
    private final ResponseCache cache;
    private final AuditTrail auditTrail;
    private final ReviewQueue reviewQueue;
    private final BrowserRenderer browserRenderer;
    private final ExecutorService workers;

    private TrackResolver(Builder builder) {
        this.config = builder.config;
        this.auditTrail = builder.auditTrail;
        this.reviewQueue = builder.reviewQueue;
        this.browserRenderer = builder.browserRenderer;

        FailSafeResponseCache failSafe = new FailSafeResponseCache(
                builder.cache != null ? builder.cache : createCache(config.getCacheConfig()));
        // cache operations run on the adjudicating thread, whose MDC names the run and track
        failSafe.onError(e -> auditTrail.record(AuditAction.CACHE_ERROR, LogContext.currentRunId(),
                LogContext.currentTrackId(), Map.of("reason", String.valueOf(e.getMessage()))));
        this.cache = failSafe;

        List<RetrievalStrategy> strategies = builder.strategies != null ? builder.strategies : createStrategies();
        if (strategies.isEmpty()) {
            log.warn("No retrieval strategy is enabled, every track will be unmatched");
        }

        NormalizationEngine normalizer = TrackNormalizationRules.createDefaultEngine();
        TrackScorer scorer = new TrackScorer(config.getScoringWeights(), normalizer, config.remixDetector());

        this.coordinator = RetrievalCoordinator.builder()
                .strategies(strategies)
                .cache(cache)
                .rateLimiter(builder.rateLimiter != null ? builder.rateLimiter : RateLimiter.defaults())
                .retryBackoff(config.getRetryBackoff())
                .metrics(builder.metrics)
                .tracing(builder.tracing)
                .build();

        this.adjudicator = Adjudicator.builder()
                .planner(new QueryPlanner(normalizer, config.getMaxQueryRanks()))
                .coordinator(coordinator)
                .extractor(builder.extractor != null ? builder.extractor : createExtractor())
                .scorer(scorer)
                .guards(GuardChain.standard(config.getGuardThresholds(), scorer))
                .minAcceptScore(config.getMinAcceptScore())
                .reviewFloor(config.getReviewFloor())
                .highConfidenceScore(config.getHighConfidenceScore())
                .escalationCandidateThreshold(config.getEscalationCandidateThreshold())
                .auditTrail(auditTrail)
                .reviewQueue(reviewQueue)
                .metrics(builder.metrics)
                .tracing(builder.tracing)
                .build();

        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "track-resolver-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("TrackResolver initialized: {}", config);
    }

    /**
     * Submits tracks for resolution and returns immediately.
     *
     * @throws IllegalArgumentException if two tracks share an id
     */
    public ResolutionRun submit(List<SourceTrack> tracks) {
        Set<String> ids = new HashSet<>();
        for (SourceTrack track : tracks) {
            if (!ids.add(track.id())) {
                throw new IllegalArgumentException("Duplicate track id: " + track.id());
            }
        }

        String runId = LogContext.generateRunId();
        CancellationToken token = new CancellationToken();
        AtomicInteger completed = new AtomicInteger();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("run.started tracks={}", tracks.size());
        }

        List<CompletableFuture<Disposition>> futures = new ArrayList<>(tracks.size());
        for (SourceTrack track : tracks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try (LogContext ctx = LogContext.forTrack(runId, track.id())) {
                    return adjudicator.adjudicate(runId, track, token);
                } finally {
                    completed.incrementAndGet();
                }
            }, workers));
        }

        CompletableFuture<RunResult> completion = CompletableFuture
                .allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Map<String, Disposition> dispositions = new LinkedHashMap<>();
                    for (int i = 0; i < tracks.size(); i++) {
                        dispositions.put(tracks.get(i).id(), futures.get(i).join());
                    }
                    RunResult result = new RunResult(runId, dispositions,
                            Duration.ofNanos(System.nanoTime() - start));
                    try (LogContext ctx = LogContext.forRun(runId)) {
                        log.info("run.completed {}", result);
                    }
                    return result;
                });

        return new ResolutionRun(runId, tracks.size(), token, completion, completed);
    }

    /**
     * Resolves tracks and blocks until every track has a disposition.
     */
    public RunResult resolve(List<SourceTrack> tracks) throws InterruptedException {
        return submit(tracks).await();
    }

    /**
     * Resolves a single track on the calling thread.
     */
    public Disposition resolve(SourceTrack track) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forTrack(runId, track.id())) {
            return adjudicator.adjudicate(runId, track, CancellationToken.none());
        }
    }

    public MatchingConfig getConfig() {
        return config;
    }

    public AuditTrail getAuditTrail() {
        return auditTrail;
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public ResponseCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        coordinator.close();
        if (browserRenderer != null) {
            browserRenderer.close();
        }
        log.info("TrackResolver closed");
    }

    private ResponseCache createCache(CacheConfig cacheConfig) {
        if (!cacheConfig.enabled()) {
            return new NoOpResponseCache();
        }
        if (cacheConfig.persistent()) {
            try {
                return new FileResponseCache(cacheConfig);
            } catch (CacheException e) {
                log.warn("Persistent cache unusable, continuing without cache: {}", e.getMessage());
                auditTrail.record(AuditAction.CACHE_ERROR, null, null,
                        Map.of("reason", String.valueOf(e.getMessage())));
                return new NoOpResponseCache();
            }
        }
        return new CaffeineResponseCache(cacheConfig);
    }

    private List<RetrievalStrategy> createStrategies() {
        HttpPageClient client = new HttpPageClient(config.getConnectTimeout(), config.getReadTimeout(),
                config.getUserAgent());
        List<RetrievalStrategy> strategies = new ArrayList<>();
        if (config.isDirectSearchEnabled()) {
            strategies.add(DirectSearchStrategy.builder()
                    .baseUrl(config.getCatalogBaseUrl())
                    .client(client)
                    .build());
        }
        if (config.isEngineFallbackEnabled()) {
            strategies.add(new EngineFallbackSearchStrategy(HttpSearchBackend.defaults(client),
                    new EngineHealthRegistry(config.getEngineCooldown()), catalogDomain(config.getCatalogBaseUrl())));
        }
        if (config.isBrowserAutomationEnabled() && browserRenderer != null) {
            strategies.add(new BrowserAutomationSearchStrategy(browserRenderer,
                    config.getCatalogBaseUrl() + DirectSearchStrategy.DEFAULT_SEARCH_PATH,
                    config.getBrowserTimeout(), config.getMaxBrowserContexts()));
        }
        return strategies;
    }

    private CandidateExtractor createExtractor() {
        ObjectMapper objectMapper = new ObjectMapper();
        String baseUrl = config.getCatalogBaseUrl();
        return new CandidateExtractor(List.of(
                new HydrationStateExtractionStrategy(objectMapper, baseUrl),
                new CatalogMarkupExtractionStrategy(objectMapper, baseUrl),
                new SearchEngineListingExtractionStrategy(baseUrl)));
    }

    static String catalogDomain(String baseUrl) {
        String host = URI.create(baseUrl).getHost();
        if (host == null) {
            return EngineFallbackSearchStrategy.DEFAULT_CATALOG_DOMAIN;
        }
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingConfig config = MatchingConfig.defaults();
        private List<RetrievalStrategy> strategies;
        private BrowserRenderer browserRenderer;
        private boolean browserRendererSet;
        private ResponseCache cache;
        private RateLimiter rateLimiter;
        private CandidateExtractor extractor;
        private AuditTrail auditTrail = new AuditTrail();
        private ReviewQueue reviewQueue = new InMemoryReviewQueue();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();

        public Builder config(MatchingConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replaces the strategies built from the configuration.
         */
        public Builder strategies(List<RetrievalStrategy> strategies) {
            this.strategies = List.copyOf(strategies);
            return this;
        }

        /**
         * Renderer for the browser strategy; defaults to a headless Playwright Chromium.
         */
        public Builder browserRenderer(BrowserRenderer browserRenderer) {
            this.browserRenderer = browserRenderer;
            this.browserRendererSet = true;
            return this;
        }

        /**
         * Replaces the cache built from the configuration.
         */
        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder extractor(CandidateExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder auditTrail(AuditTrail auditTrail) {
            this.auditTrail = auditTrail;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        /**
         * @throws ConfigurationException if the configuration or audit trail is missing
         */
        public TrackResolver build() {
            if (config == null) {
                throw new ConfigurationException("config is required");
            }
            if (auditTrail == null) {
                throw new ConfigurationException("auditTrail is required");
            }
            if (!browserRendererSet && strategies == null && config.isBrowserAutomationEnabled()) {
                browserRenderer = new PlaywrightBrowserRenderer(true, config.getUserAgent());
            }
            return new TrackResolver(this);
        }
    }
}
