package com.track.resolution.cache;

import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResponseCacheTest {

    private static final Query QUERY = new Query("Never Sleep Again Solomun", StrategyType.DIRECT_SEARCH, 1);
    private static final CacheKey KEY = CacheKey.of(QUERY);

    private static RawResponse response(String body) {
        return RawResponse.success(QUERY, StrategyType.DIRECT_SEARCH, PayloadFormat.JSON, body,
                "https://catalog.test/search?q=never", Duration.ofMillis(120));
    }

    @Test
    @DisplayName("Cache keys normalize case, quotes and whitespace")
    void testCacheKey() {
        CacheKey other = CacheKey.of(new Query("\"never sleep  again\" SOLOMUN", StrategyType.DIRECT_SEARCH, 4));

        assertEquals(KEY, other);
        assertEquals("direct|never sleep again solomun", KEY.asString());
        assertNotEquals(KEY, CacheKey.of(QUERY.withStrategy(StrategyType.ENGINE_FALLBACK)));
    }

    @Nested
    @DisplayName("NoOpResponseCache")
    class NoOpTests {

        @Test
        @DisplayName("Should store nothing")
        void testStoresNothing() {
            NoOpResponseCache cache = new NoOpResponseCache();

            assertFalse(cache.putIfAbsent(KEY, response("{}")));
            assertTrue(cache.get(KEY).isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CaffeineResponseCache")
    class CaffeineTests {

        @Test
        @DisplayName("First writer wins")
        void testFirstWriterWins() {
            CaffeineResponseCache cache = new CaffeineResponseCache(CacheConfig.defaults());

            assertTrue(cache.putIfAbsent(KEY, response("{\"first\":true}")));
            assertFalse(cache.putIfAbsent(KEY, response("{\"second\":true}")));

            assertEquals("{\"first\":true}", cache.get(KEY).orElseThrow().body());
            assertEquals(1, cache.getStats().rejectedWrites());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            CaffeineResponseCache cache = new CaffeineResponseCache(CacheConfig.defaults());

            assertTrue(cache.get(KEY).isEmpty());
            cache.putIfAbsent(KEY, response("{}"));
            assertTrue(cache.get(KEY).isPresent());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(1, stats.size());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("invalidateAll empties the cache")
        void testInvalidateAll() {
            CaffeineResponseCache cache = new CaffeineResponseCache(CacheConfig.defaults());
            cache.putIfAbsent(KEY, response("{}"));

            cache.invalidateAll();

            assertTrue(cache.get(KEY).isEmpty());
        }
    }

    @Nested
    @DisplayName("FileResponseCache")
    class FileTests {

        @TempDir
        Path directory;

        @Test
        @DisplayName("Entries survive a new cache instance")
        void testPersistence() {
            FileResponseCache cache = new FileResponseCache(directory, Duration.ofHours(1));
            assertTrue(cache.putIfAbsent(KEY, response("{\"results\":[]}")));

            FileResponseCache reopened = new FileResponseCache(CacheConfig.persistent(directory.toString()));
            RawResponse cached = reopened.get(KEY).orElseThrow();

            assertTrue(cached.fromCache());
            assertTrue(cached.success());
            assertEquals("{\"results\":[]}", cached.body());
            assertEquals(PayloadFormat.JSON, cached.format());
            assertEquals(QUERY, cached.query());
            assertEquals(Duration.ofMillis(120), cached.latency());
            assertEquals(1, reopened.getStats().size());
        }

        @Test
        @DisplayName("First writer wins on disk")
        void testFirstWriterWins() {
            FileResponseCache cache = new FileResponseCache(directory, Duration.ofHours(1));

            assertTrue(cache.putIfAbsent(KEY, response("{\"first\":true}")));
            assertFalse(cache.putIfAbsent(KEY, response("{\"second\":true}")));

            assertEquals("{\"first\":true}", cache.get(KEY).orElseThrow().body());
            assertEquals(1, cache.getStats().rejectedWrites());
        }

        @Test
        @DisplayName("Expired entries are misses and are removed")
        void testExpiry() {
            FileResponseCache cache = new FileResponseCache(directory, Duration.ofHours(1));
            RawResponse old = new RawResponse(QUERY, StrategyType.DIRECT_SEARCH, PayloadFormat.JSON, "{}",
                    null, true, null, Instant.now().minus(Duration.ofHours(2)), Duration.ZERO, false);
            cache.putIfAbsent(KEY, old);

            assertEquals(Optional.empty(), cache.get(KEY));
            assertFalse(Files.exists(cache.fileFor(KEY)));
            assertEquals(1, cache.getStats().evictionCount());
        }

        @Test
        @DisplayName("Corrupt entries raise CacheException")
        void testCorruptEntry() throws Exception {
            FileResponseCache cache = new FileResponseCache(directory, Duration.ofHours(1));
            Files.writeString(cache.fileFor(KEY), "{not json");

            assertThrows(CacheException.class, () -> cache.get(KEY));
        }

        @Test
        @DisplayName("invalidateAll deletes every entry")
        void testInvalidateAll() {
            FileResponseCache cache = new FileResponseCache(directory, Duration.ofHours(1));
            cache.putIfAbsent(KEY, response("{}"));

            cache.invalidateAll();

            assertEquals(0, cache.getStats().size());
            assertTrue(cache.get(KEY).isEmpty());
        }
    }

    @Nested
    @DisplayName("FailSafeResponseCache")
    @ExtendWith(MockitoExtension.class)
    class FailSafeTests {

        @Mock
        private ResponseCache broken;

        @Test
        @DisplayName("Storage failures switch to bypass and notify once")
        void testBypass() {
            when(broken.get(any())).thenThrow(new CacheException("disk gone"));
            FailSafeResponseCache cache = new FailSafeResponseCache(broken);
            AtomicInteger notified = new AtomicInteger();
            cache.onError(e -> notified.incrementAndGet());

            assertTrue(cache.get(KEY).isEmpty());
            assertTrue(cache.get(KEY).isEmpty());
            assertFalse(cache.putIfAbsent(KEY, response("{}")));

            assertTrue(cache.isBypassed());
            assertEquals(1, notified.get());
            assertEquals(CacheStats.empty(), cache.getStats());
            verify(broken, times(1)).get(any());
            verify(broken, never()).putIfAbsent(any(), any());
        }

        @Test
        @DisplayName("A healthy delegate is used as is")
        void testPassThrough() {
            FailSafeResponseCache cache = new FailSafeResponseCache(new CaffeineResponseCache(CacheConfig.defaults()));

            assertTrue(cache.putIfAbsent(KEY, response("{}")));
            assertTrue(cache.get(KEY).isPresent());
            assertFalse(cache.isBypassed());
        }
    }

    @Test
    @DisplayName("Config rejects invalid values")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true, false, null));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true, false, null));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 10, true, true, " "));
        assertFalse(CacheConfig.disabled().enabled());
        assertEquals(CacheConfig.PERSISTENT_TTL_SECONDS, CacheConfig.persistent("/tmp/x").ttlSeconds());
    }
}
