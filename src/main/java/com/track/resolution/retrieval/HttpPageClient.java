package com.track.resolution.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Thin GET client shared by the HTTP strategies, with browser-like headers and fixed timeouts.
 */
public class HttpPageClient {
    private static final Logger log = LoggerFactory.getLogger(HttpPageClient.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(8);
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/124.0 Safari/537.36";

    private final HttpClient httpClient;
    private final Duration readTimeout;
    private final String userAgent;

    public HttpPageClient() {
        this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, DEFAULT_USER_AGENT);
    }

    public HttpPageClient(Duration connectTimeout, Duration readTimeout, String userAgent) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.readTimeout = readTimeout;
        this.userAgent = userAgent;
    }

    /**
     * Fetches a page. Any status code is returned; only transport failures throw.
     */
    public HttpPage get(URI uri) throws RetrievalException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(readTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            log.debug("GET {} -> {} ({} chars)", uri, response.statusCode(), response.body().length());
            return new HttpPage(uri.toString(), response.statusCode(), contentType, response.body());
        } catch (HttpTimeoutException e) {
            throw new RetrievalException("Timed out fetching " + uri, e);
        } catch (IOException e) {
            throw new RetrievalException("I/O error fetching " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalException("Interrupted fetching " + uri, e);
        }
    }
}
