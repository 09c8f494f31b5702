package com.track.resolution.api;

import com.track.resolution.cache.CacheConfig;
import com.track.resolution.guard.GuardThresholds;
import com.track.resolution.retrieval.HttpPageClient;
import com.track.resolution.rules.RemixDetector;
import com.track.resolution.scoring.ScoringWeights;

import java.time.Duration;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable configuration of a resolution run: thresholds, weights, retrieval
 * settings, worker pool and cache. Fixed for the lifetime of a {@link TrackResolver}.
 */
public class MatchingConfig {

    static final double DEFAULT_MIN_ACCEPT_SCORE = 72.0;
    static final double DEFAULT_REVIEW_FLOOR = 50.0;
    static final double DEFAULT_HIGH_CONFIDENCE_SCORE = 85.0;
    static final int DEFAULT_MAX_QUERY_RANKS = 5;
    static final int DEFAULT_ESCALATION_CANDIDATE_THRESHOLD = 5;
    static final int DEFAULT_WORKER_THREADS = 12;
    static final int DEFAULT_MAX_BROWSER_CONTEXTS = 2;
    static final Duration DEFAULT_CONNECT_TIMEOUT = HttpPageClient.DEFAULT_CONNECT_TIMEOUT;
    static final Duration DEFAULT_READ_TIMEOUT = HttpPageClient.DEFAULT_READ_TIMEOUT;
    static final Duration DEFAULT_BROWSER_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(500);
    static final Duration DEFAULT_ENGINE_COOLDOWN = Duration.ofMinutes(10);
    static final String DEFAULT_CATALOG_BASE_URL = "https://www.beatport.com";

    private final double minAcceptScore;
    private final double reviewFloor;
    private final double highConfidenceScore;
    private final ScoringWeights scoringWeights;
    private final GuardThresholds guardThresholds;
    private final String remixPattern;
    private final String neutralMixPattern;
    private final int maxQueryRanks;
    private final int escalationCandidateThreshold;
    private final boolean directSearchEnabled;
    private final boolean engineFallbackEnabled;
    private final boolean browserAutomationEnabled;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Duration browserTimeout;
    private final Duration retryBackoff;
    private final Duration engineCooldown;
    private final int maxBrowserContexts;
    private final String userAgent;
    private final String catalogBaseUrl;
    private final int workerThreads;
    private final CacheConfig cacheConfig;

    private MatchingConfig(Builder builder) {
        this.minAcceptScore = builder.minAcceptScore;
        this.reviewFloor = builder.reviewFloor;
        this.highConfidenceScore = builder.highConfidenceScore;
        this.scoringWeights = builder.scoringWeights;
        this.guardThresholds = builder.guardThresholds;
        this.remixPattern = builder.remixPattern;
        this.neutralMixPattern = builder.neutralMixPattern;
        this.maxQueryRanks = builder.maxQueryRanks;
        this.escalationCandidateThreshold = builder.escalationCandidateThreshold;
        this.directSearchEnabled = builder.directSearchEnabled;
        this.engineFallbackEnabled = builder.engineFallbackEnabled;
        this.browserAutomationEnabled = builder.browserAutomationEnabled;
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
        this.browserTimeout = builder.browserTimeout;
        this.retryBackoff = builder.retryBackoff;
        this.engineCooldown = builder.engineCooldown;
        this.maxBrowserContexts = builder.maxBrowserContexts;
        this.userAgent = builder.userAgent;
        this.catalogBaseUrl = builder.catalogBaseUrl;
        this.workerThreads = builder.workerThreads;
        this.cacheConfig = builder.cacheConfig;
    }

    public double getMinAcceptScore() {
        return minAcceptScore;
    }

    public double getReviewFloor() {
        return reviewFloor;
    }

    public double getHighConfidenceScore() {
        return highConfidenceScore;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public GuardThresholds getGuardThresholds() {
        return guardThresholds;
    }

    public String getRemixPattern() {
        return remixPattern;
    }

    public String getNeutralMixPattern() {
        return neutralMixPattern;
    }

    public int getMaxQueryRanks() {
        return maxQueryRanks;
    }

    public int getEscalationCandidateThreshold() {
        return escalationCandidateThreshold;
    }

    public boolean isDirectSearchEnabled() {
        return directSearchEnabled;
    }

    public boolean isEngineFallbackEnabled() {
        return engineFallbackEnabled;
    }

    public boolean isBrowserAutomationEnabled() {
        return browserAutomationEnabled;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getBrowserTimeout() {
        return browserTimeout;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public Duration getEngineCooldown() {
        return engineCooldown;
    }

    public int getMaxBrowserContexts() {
        return maxBrowserContexts;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getCatalogBaseUrl() {
        return catalogBaseUrl;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public RemixDetector remixDetector() {
        return new RemixDetector(remixPattern, neutralMixPattern);
    }

    public static MatchingConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a configuration from flat properties; missing keys keep their defaults.
     *
     * <pre>
     * matching.min-accept-score=75
     * retrieval.browser.enabled=false
     * cache.persistent=true
     * cache.directory=/var/cache/tracks
     * </pre>
     *
     * @throws ConfigurationException for unparseable or out-of-range values
     */
    public static MatchingConfig fromProperties(Properties props) {
        Builder b = builder();
        PropertyReader r = new PropertyReader(props);

        r.doubleValue("matching.min-accept-score", b::minAcceptScore);
        r.doubleValue("matching.review-floor", b::reviewFloor);
        r.doubleValue("matching.high-confidence-score", b::highConfidenceScore);
        r.intValue("matching.max-query-ranks", b::maxQueryRanks);
        r.stringValue("matching.remix-pattern", b::remixPattern);
        r.stringValue("matching.neutral-mix-pattern", b::neutralMixPattern);

        ScoringWeights w = ScoringWeights.defaultWeights();
        double titleWeight = r.doubleOr("matching.title-weight", w.titleWeight());
        double artistWeight = r.doubleOr("matching.artist-weight", w.artistWeight());
        double remixLimit = r.doubleOr("matching.remix-adjustment-limit", w.remixAdjustmentLimit());
        b.scoringWeights(titleWeight, artistWeight, remixLimit);

        GuardThresholds g = GuardThresholds.defaults();
        b.guardThresholds(
                r.doubleOr("guard.title-similarity-floor", g.titleSimilarityFloor()),
                r.doubleOr("guard.title-token-coverage", g.titleTokenCoverage()),
                r.doubleOr("guard.remix-conflict-similarity", g.remixConflictSimilarity()));

        r.intValue("retrieval.escalation-candidate-threshold", b::escalationCandidateThreshold);
        r.booleanValue("retrieval.direct.enabled", b::directSearchEnabled);
        r.booleanValue("retrieval.engine.enabled", b::engineFallbackEnabled);
        r.booleanValue("retrieval.browser.enabled", b::browserAutomationEnabled);
        r.millisValue("retrieval.connect-timeout-ms", b::connectTimeout);
        r.millisValue("retrieval.read-timeout-ms", b::readTimeout);
        r.millisValue("retrieval.browser.timeout-ms", b::browserTimeout);
        r.millisValue("retrieval.retry-backoff-ms", b::retryBackoff);
        r.intValue("retrieval.browser.max-contexts", b::maxBrowserContexts);
        r.stringValue("retrieval.user-agent", b::userAgent);
        r.stringValue("retrieval.catalog-base-url", b::catalogBaseUrl);
        r.secondsValue("retrieval.engine.cooldown-seconds", b::engineCooldown);

        r.intValue("pool.worker-threads", b::workerThreads);

        CacheConfig c = CacheConfig.defaults();
        boolean persistent = r.booleanOr("cache.persistent", false);
        String directory = props.getProperty("cache.directory");
        long defaultTtl = persistent ? CacheConfig.PERSISTENT_TTL_SECONDS : CacheConfig.DEFAULT_TTL_SECONDS;
        b.cacheConfig(
                r.intOr("cache.max-size", c.maxSize()),
                r.longOr("cache.ttl-seconds", defaultTtl),
                r.booleanOr("cache.enabled", true),
                persistent,
                directory);

        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double minAcceptScore = DEFAULT_MIN_ACCEPT_SCORE;
        private double reviewFloor = DEFAULT_REVIEW_FLOOR;
        private double highConfidenceScore = DEFAULT_HIGH_CONFIDENCE_SCORE;
        private ScoringWeights scoringWeights = ScoringWeights.defaultWeights();
        private GuardThresholds guardThresholds = GuardThresholds.defaults();
        private String remixPattern = RemixDetector.DEFAULT_REMIX_PATTERN;
        private String neutralMixPattern = RemixDetector.DEFAULT_NEUTRAL_PATTERN;
        private int maxQueryRanks = DEFAULT_MAX_QUERY_RANKS;
        private int escalationCandidateThreshold = DEFAULT_ESCALATION_CANDIDATE_THRESHOLD;
        private boolean directSearchEnabled = true;
        private boolean engineFallbackEnabled = true;
        private boolean browserAutomationEnabled = true;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration browserTimeout = DEFAULT_BROWSER_TIMEOUT;
        private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
        private Duration engineCooldown = DEFAULT_ENGINE_COOLDOWN;
        private int maxBrowserContexts = DEFAULT_MAX_BROWSER_CONTEXTS;
        private String userAgent = HttpPageClient.DEFAULT_USER_AGENT;
        private String catalogBaseUrl = DEFAULT_CATALOG_BASE_URL;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder minAcceptScore(double minAcceptScore) {
            validateScore(minAcceptScore, "minAcceptScore");
            this.minAcceptScore = minAcceptScore;
            return this;
        }

        public Builder reviewFloor(double reviewFloor) {
            validateScore(reviewFloor, "reviewFloor");
            this.reviewFloor = reviewFloor;
            return this;
        }

        public Builder highConfidenceScore(double highConfidenceScore) {
            validateScore(highConfidenceScore, "highConfidenceScore");
            this.highConfidenceScore = highConfidenceScore;
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new ConfigurationException("scoringWeights is required");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder scoringWeights(double titleWeight, double artistWeight, double remixAdjustmentLimit) {
            try {
                return scoringWeights(new ScoringWeights(titleWeight, artistWeight, remixAdjustmentLimit));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid scoring weights: " + e.getMessage(), e);
            }
        }

        public Builder guardThresholds(GuardThresholds guardThresholds) {
            if (guardThresholds == null) {
                throw new ConfigurationException("guardThresholds is required");
            }
            this.guardThresholds = guardThresholds;
            return this;
        }

        public Builder guardThresholds(double titleSimilarityFloor, double titleTokenCoverage,
                                       double remixConflictSimilarity) {
            try {
                return guardThresholds(new GuardThresholds(titleSimilarityFloor, titleTokenCoverage,
                        remixConflictSimilarity));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid guard thresholds: " + e.getMessage(), e);
            }
        }

        public Builder remixPattern(String remixPattern) {
            validatePattern(remixPattern, "remixPattern");
            this.remixPattern = remixPattern;
            return this;
        }

        public Builder neutralMixPattern(String neutralMixPattern) {
            validatePattern(neutralMixPattern, "neutralMixPattern");
            this.neutralMixPattern = neutralMixPattern;
            return this;
        }

        public Builder maxQueryRanks(int maxQueryRanks) {
            if (maxQueryRanks < 1 || maxQueryRanks > DEFAULT_MAX_QUERY_RANKS) {
                throw new ConfigurationException("maxQueryRanks must be between 1 and " + DEFAULT_MAX_QUERY_RANKS);
            }
            this.maxQueryRanks = maxQueryRanks;
            return this;
        }

        public Builder escalationCandidateThreshold(int escalationCandidateThreshold) {
            if (escalationCandidateThreshold < 0) {
                throw new ConfigurationException("escalationCandidateThreshold must be >= 0");
            }
            this.escalationCandidateThreshold = escalationCandidateThreshold;
            return this;
        }

        public Builder directSearchEnabled(boolean directSearchEnabled) {
            this.directSearchEnabled = directSearchEnabled;
            return this;
        }

        public Builder engineFallbackEnabled(boolean engineFallbackEnabled) {
            this.engineFallbackEnabled = engineFallbackEnabled;
            return this;
        }

        public Builder browserAutomationEnabled(boolean browserAutomationEnabled) {
            this.browserAutomationEnabled = browserAutomationEnabled;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = positive(readTimeout, "readTimeout");
            return this;
        }

        public Builder browserTimeout(Duration browserTimeout) {
            this.browserTimeout = positive(browserTimeout, "browserTimeout");
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            if (retryBackoff == null || retryBackoff.isNegative()) {
                throw new ConfigurationException("retryBackoff must be >= 0");
            }
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder engineCooldown(Duration engineCooldown) {
            this.engineCooldown = positive(engineCooldown, "engineCooldown");
            return this;
        }

        public Builder maxBrowserContexts(int maxBrowserContexts) {
            if (maxBrowserContexts <= 0) {
                throw new ConfigurationException("maxBrowserContexts must be positive");
            }
            this.maxBrowserContexts = maxBrowserContexts;
            return this;
        }

        public Builder userAgent(String userAgent) {
            if (userAgent == null || userAgent.isBlank()) {
                throw new ConfigurationException("userAgent must not be blank");
            }
            this.userAgent = userAgent;
            return this;
        }

        public Builder catalogBaseUrl(String catalogBaseUrl) {
            if (catalogBaseUrl == null || !catalogBaseUrl.matches("https?://[^\\s]+")) {
                throw new ConfigurationException("catalogBaseUrl must be an http(s) URL, got " + catalogBaseUrl);
            }
            this.catalogBaseUrl = catalogBaseUrl.endsWith("/")
                    ? catalogBaseUrl.substring(0, catalogBaseUrl.length() - 1)
                    : catalogBaseUrl;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new ConfigurationException("workerThreads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new ConfigurationException("cacheConfig is required");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder cacheConfig(int maxSize, long ttlSeconds, boolean enabled, boolean persistent,
                                   String directory) {
            try {
                return cacheConfig(new CacheConfig(maxSize, ttlSeconds, enabled, persistent, directory));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid cache configuration: " + e.getMessage(), e);
            }
        }

        /**
         * @throws ConfigurationException if thresholds are not ordered
         *         {@code reviewFloor <= minAcceptScore <= highConfidenceScore}
         */
        public MatchingConfig build() {
            if (reviewFloor > minAcceptScore) {
                throw new ConfigurationException("reviewFloor must be <= minAcceptScore");
            }
            if (minAcceptScore > highConfidenceScore) {
                throw new ConfigurationException("minAcceptScore must be <= highConfidenceScore");
            }
            return new MatchingConfig(this);
        }

        private static void validateScore(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
                throw new ConfigurationException(name + " must be between 0 and 100");
            }
        }

        private static void validatePattern(String regex, String name) {
            if (regex == null || regex.isBlank()) {
                throw new ConfigurationException(name + " must not be blank");
            }
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException(name + " is not a valid regular expression: "
                        + e.getDescription(), e);
            }
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ConfigurationException(name + " must be positive");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "MatchingConfig{" +
                "minAcceptScore=" + minAcceptScore +
                ", reviewFloor=" + reviewFloor +
                ", highConfidenceScore=" + highConfidenceScore +
                ", scoringWeights=" + scoringWeights +
                ", guardThresholds=" + guardThresholds +
                ", maxQueryRanks=" + maxQueryRanks +
                ", escalationCandidateThreshold=" + escalationCandidateThreshold +
                ", direct=" + directSearchEnabled +
                ", engine=" + engineFallbackEnabled +
                ", browser=" + browserAutomationEnabled +
                ", workerThreads=" + workerThreads +
                ", cacheConfig=" + cacheConfig +
                '}';
    }
}
