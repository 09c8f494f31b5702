package com.track.resolution.retrieval;

import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable in-memory retrieval strategy for tests. Records every query it receives.
 */
public class FakeRetrievalStrategy implements RetrievalStrategy {

    private final StrategyType type;
    private final Function<Query, RawResponse> responder;
    private final List<Query> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;

    public FakeRetrievalStrategy(StrategyType type, Function<Query, RawResponse> responder) {
        this.type = type;
        this.responder = responder;
    }

    /**
     * Answers every query with a JSON body chosen from the query.
     */
    public static FakeRetrievalStrategy json(StrategyType type, Function<Query, String> body) {
        return new FakeRetrievalStrategy(type, q -> ok(q, type, "application/json", body.apply(q)));
    }

    /**
     * Answers every query with an HTML body chosen from the query.
     */
    public static FakeRetrievalStrategy html(StrategyType type, Function<Query, String> body) {
        return new FakeRetrievalStrategy(type, q -> ok(q, type, "text/html", body.apply(q)));
    }

    public static FakeRetrievalStrategy failing(StrategyType type, String reason) {
        return new FakeRetrievalStrategy(type, q -> RawResponse.failure(q, type, reason, Duration.ofMillis(1)));
    }

    public static RawResponse ok(Query query, StrategyType type, String contentType, String body) {
        return RawResponse.success(query, type, PayloadFormat.detect(contentType, body), body,
                "https://catalog.test/search?q=" + query.text(), Duration.ofMillis(1));
    }

    @Override
    public StrategyType type() {
        return type;
    }

    @Override
    public RawResponse fetch(Query query) {
        calls.incrementAndGet();
        received.add(query);
        return responder.apply(query);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public FakeRetrievalStrategy available(boolean available) {
        this.available = available;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public List<Query> received() {
        return List.copyOf(received);
    }
}
