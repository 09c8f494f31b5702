package com.track.resolution.api;

import com.track.resolution.cache.CacheConfig;
import com.track.resolution.guard.GuardThresholds;
import com.track.resolution.scoring.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchingConfig Tests")
class MatchingConfigTest {

    private static Properties props(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    // ============ Defaults Tests ============

    @Test
    @DisplayName("Should create default config")
    void testDefaults() {
        MatchingConfig config = MatchingConfig.defaults();

        assertEquals(72.0, config.getMinAcceptScore());
        assertEquals(50.0, config.getReviewFloor());
        assertEquals(85.0, config.getHighConfidenceScore());
        assertEquals(ScoringWeights.defaultWeights(), config.getScoringWeights());
        assertEquals(GuardThresholds.defaults(), config.getGuardThresholds());
        assertEquals(5, config.getMaxQueryRanks());
        assertEquals(5, config.getEscalationCandidateThreshold());
        assertTrue(config.isDirectSearchEnabled());
        assertTrue(config.isEngineFallbackEnabled());
        assertTrue(config.isBrowserAutomationEnabled());
        assertEquals(Duration.ofMillis(500), config.getRetryBackoff());
        assertEquals(12, config.getWorkerThreads());
        assertEquals(CacheConfig.defaults(), config.getCacheConfig());
        assertEquals("https://www.beatport.com", config.getCatalogBaseUrl());
    }

    // ============ Builder Validation Tests ============

    @Nested
    @DisplayName("Builder validation")
    class BuilderTests {

        @ParameterizedTest
        @DisplayName("Should reject scores outside 0-100")
        @CsvSource({"-1", "100.5", "NaN"})
        void testScoreRange(double value) {
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().minAcceptScore(value));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().reviewFloor(value));
        }

        @Test
        @DisplayName("Thresholds must be ordered review floor, accept, high confidence")
        void testThresholdOrdering() {
            assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.builder().reviewFloor(80).build());
            assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.builder().minAcceptScore(90).build());
            assertDoesNotThrow(() -> MatchingConfig.builder().reviewFloor(72).minAcceptScore(72).build());
        }

        @Test
        @DisplayName("Every retrieval strategy may be switched off")
        void testStrategiesDisabled() {
            MatchingConfig config = MatchingConfig.builder()
                    .directSearchEnabled(false)
                    .engineFallbackEnabled(false)
                    .browserAutomationEnabled(false)
                    .build();

            assertFalse(config.isDirectSearchEnabled());
            assertFalse(config.isEngineFallbackEnabled());
            assertFalse(config.isBrowserAutomationEnabled());
        }

        @Test
        @DisplayName("Invalid weights and thresholds surface as configuration errors")
        void testNestedValidation() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.builder().scoringWeights(0.4, 0.4, 15));
            assertTrue(e.getMessage().startsWith("Invalid scoring weights"));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());

            assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.builder().guardThresholds(40, 1.5, 80));
            assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.builder().cacheConfig(100, 60, true, true, " "));
        }

        @Test
        @DisplayName("Should reject invalid patterns")
        void testPatterns() {
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().remixPattern("(remix"));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().neutralMixPattern(" "));
        }

        @Test
        @DisplayName("Should reject non-positive durations and sizes")
        void testPositiveValues() {
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().readTimeout(Duration.ZERO));
            assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.builder().retryBackoff(Duration.ofMillis(-1)));
            assertDoesNotThrow(() -> MatchingConfig.builder().retryBackoff(Duration.ZERO));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().workerThreads(0));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().maxBrowserContexts(0));
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().maxQueryRanks(6));
        }

        @Test
        @DisplayName("Catalog base URL is normalized without trailing slash")
        void testCatalogBaseUrl() {
            assertEquals("https://catalog.test",
                    MatchingConfig.builder().catalogBaseUrl("https://catalog.test/").build().getCatalogBaseUrl());
            assertThrows(ConfigurationException.class, () -> MatchingConfig.builder().catalogBaseUrl("catalog.test"));
        }
    }

    // ============ Properties Tests ============

    @Nested
    @DisplayName("Properties")
    class PropertiesTests {

        @Test
        @DisplayName("Should load a properties file from the classpath")
        void testLoadFromClasspath() throws IOException {
            Properties props = new Properties();
            try (InputStream in = MatchingConfigTest.class.getResourceAsStream("/track-resolution.properties")) {
                assertNotNull(in);
                props.load(in);
            }

            MatchingConfig config = MatchingConfig.fromProperties(props);

            assertEquals(75.0, config.getMinAcceptScore());
            assertEquals(55.0, config.getReviewFloor());
            assertEquals(90.0, config.getHighConfidenceScore());
            assertEquals(3, config.getMaxQueryRanks());
            assertEquals(new ScoringWeights(0.55, 0.30, 15.0), config.getScoringWeights());
            assertEquals(new GuardThresholds(45.0, 0.5, 80.0), config.getGuardThresholds());
            assertFalse(config.isBrowserAutomationEnabled());
            assertTrue(config.isEngineFallbackEnabled());
            assertEquals(Duration.ofMillis(250), config.getRetryBackoff());
            assertEquals(Duration.ofMinutes(2), config.getEngineCooldown());
            assertEquals("https://catalog.example.org", config.getCatalogBaseUrl());
            assertEquals(4, config.getWorkerThreads());

            CacheConfig cache = config.getCacheConfig();
            assertTrue(cache.persistent());
            assertEquals("/var/cache/track-resolution", cache.directory());
            assertEquals(CacheConfig.PERSISTENT_TTL_SECONDS, cache.ttlSeconds());
        }

        @Test
        @DisplayName("Missing and blank keys keep their defaults")
        void testEmptyProperties() {
            MatchingConfig config = MatchingConfig.fromProperties(props("matching.min-accept-score", "  "));

            assertEquals(72.0, config.getMinAcceptScore());
            assertEquals(CacheConfig.defaults(), config.getCacheConfig());
        }

        @ParameterizedTest
        @DisplayName("Unparseable values name the offending key")
        @CsvSource({
                "matching.min-accept-score,high",
                "pool.worker-threads,4.5",
                "retrieval.direct.enabled,maybe",
                "retrieval.read-timeout-ms,soon"
        })
        void testParseErrors(String key, String value) {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.fromProperties(props(key, value)));
            assertTrue(e.getMessage().startsWith(key), e.getMessage());
        }

        @Test
        @DisplayName("Persistent cache without directory is rejected")
        void testPersistentWithoutDirectory() {
            assertThrows(ConfigurationException.class,
                    () -> MatchingConfig.fromProperties(props("cache.persistent", "true")));
        }

        @Test
        @DisplayName("Null properties are rejected")
        void testNullProperties() {
            assertThrows(ConfigurationException.class, () -> MatchingConfig.fromProperties(null));
        }
    }
}
