package com.track.resolution.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Persistent response cache that survives across runs.
 * Each entry is one JSON file named by the SHA-256 of the cache key. Entries are written
 * to a temporary file and moved into place, so a reader never sees a partial entry.
 */
public class FileResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(FileResponseCache.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong rejectedWrites = new AtomicLong();

    public FileResponseCache(CacheConfig config) {
        this(Paths.get(config.directory()), Duration.ofSeconds(config.ttlSeconds()));
    }

    public FileResponseCache(Path directory, Duration ttl) {
        this.directory = directory;
        this.ttl = ttl;
        this.objectMapper = new ObjectMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheException("Cannot create cache directory " + directory, e);
        }
        log.info("FileResponseCache initialized: directory={}, ttl={}", directory, ttl);
    }

    @Override
    public Optional<RawResponse> get(CacheKey key) {
        Path file = fileFor(key);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            misses.incrementAndGet();
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheException("Cannot read cache entry " + file, e);
        }

        StoredResponse stored;
        try {
            stored = objectMapper.readValue(json, StoredResponse.class);
        } catch (IOException e) {
            throw new CacheException("Corrupt cache entry " + file, e);
        }
        if (!key.asString().equals(stored.key())) {
            misses.incrementAndGet();
            log.warn("Cache entry {} belongs to another key, ignoring", file.getFileName());
            return Optional.empty();
        }
        Instant fetchedAt = Instant.ofEpochMilli(stored.fetchedAtMillis());
        if (fetchedAt.plus(ttl).isBefore(Instant.now())) {
            expirations.incrementAndGet();
            misses.incrementAndGet();
            delete(file);
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(stored.toResponse());
    }

    @Override
    public boolean putIfAbsent(CacheKey key, RawResponse response) {
        Path file = fileFor(key);
        if (Files.exists(file)) {
            rejectedWrites.incrementAndGet();
            return false;
        }
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "entry-", ".tmp");
            Files.writeString(temp, objectMapper.writeValueAsString(StoredResponse.from(key, response)),
                    StandardCharsets.UTF_8);
            Files.move(temp, file);
            return true;
        } catch (FileAlreadyExistsException e) {
            rejectedWrites.incrementAndGet();
            log.debug("Cache entry for {} written concurrently, keeping first write", key.asString());
            delete(temp);
            return false;
        } catch (IOException e) {
            delete(temp);
            throw new CacheException("Cannot write cache entry " + file, e);
        }
    }

    @Override
    public void invalidateAll() {
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).forEach(this::delete);
        } catch (IOException e) {
            throw new CacheException("Cannot list cache directory " + directory, e);
        }
    }

    @Override
    public CacheStats getStats() {
        long size;
        try (Stream<Path> files = Files.list(directory)) {
            size = files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            throw new CacheException("Cannot list cache directory " + directory, e);
        }
        return new CacheStats(hits.get(), misses.get(), expirations.get(), size, rejectedWrites.get());
    }

    Path fileFor(CacheKey key) {
        return directory.resolve(sha256(key.asString()) + SUFFIX);
    }

    private void delete(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new CacheException("Cannot delete cache file " + file, e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredResponse(
            String key,
            String queryText,
            int queryRank,
            String strategy,
            String format,
            String body,
            String sourceUrl,
            long fetchedAtMillis,
            long latencyMillis
    ) {
        static StoredResponse from(CacheKey key, RawResponse response) {
            return new StoredResponse(
                    key.asString(),
                    response.query().text(),
                    response.query().rank(),
                    response.strategy().tag(),
                    response.format().name(),
                    response.body(),
                    response.sourceUrl(),
                    response.fetchedAt().toEpochMilli(),
                    response.latency().toMillis());
        }

        RawResponse toResponse() {
            StrategyType type = StrategyType.fromTag(strategy);
            return new RawResponse(new Query(queryText, type, queryRank), type, PayloadFormat.valueOf(format),
                    body, sourceUrl, true, null, Instant.ofEpochMilli(fetchedAtMillis),
                    Duration.ofMillis(latencyMillis), true);
        }
    }
}
