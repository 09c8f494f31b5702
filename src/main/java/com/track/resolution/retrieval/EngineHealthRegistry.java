package com.track.resolution.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Remembers search backends that recently failed or throttled us, so they are skipped
 * until a cooldown expires. Kept apart from the response cache.
 */
public class EngineHealthRegistry {
    private static final Logger log = LoggerFactory.getLogger(EngineHealthRegistry.class);

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(10);

    private final Cache<String, String> failing;

    public EngineHealthRegistry() {
        this(DEFAULT_COOLDOWN);
    }

    public EngineHealthRegistry(Duration cooldown) {
        this.failing = Caffeine.newBuilder()
                .expireAfterWrite(cooldown)
                .build();
    }

    public boolean isHealthy(String backend) {
        return failing.getIfPresent(backend) == null;
    }

    public void markFailing(String backend, String reason) {
        if (failing.asMap().put(backend, reason) == null) {
            log.warn("Search backend {} marked unhealthy: {}", backend, reason);
        }
    }

    public void markHealthy(String backend) {
        failing.invalidate(backend);
    }

    /**
     * Backends currently in cooldown, with the reason they were marked.
     */
    public Map<String, String> failingBackends() {
        return Map.copyOf(failing.asMap());
    }
}
