package com.track.resolution.retrieval;

import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;

/**
 * A way of fetching catalog search results for a query.
 *
 * <p>{@link #fetch(Query)} never throws for network, HTTP or format errors; it returns a
 * failed {@link RawResponse} instead. {@link #isAvailable()} is a capability check: an
 * unavailable strategy is skipped by escalation and the pipeline carries on with reduced recall.</p>
 */
public interface RetrievalStrategy {

    StrategyType type();

    RawResponse fetch(Query query);

    default boolean isAvailable() {
        return true;
    }
}
