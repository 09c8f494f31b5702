package com.track.resolution.extract;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw responses into candidates by trying each extraction strategy in priority
 * order. The first strategy that applies and yields candidates wins.
 *
 * <p>Never throws: a malformed payload yields no candidates and a logged reason.</p>
 */
public class CandidateExtractor {
    private static final Logger log = LoggerFactory.getLogger(CandidateExtractor.class);

    private final List<ExtractionStrategy> strategies;

    /**
     * Creates an extractor with the standard strategy order: hydration state,
     * catalog markup, search engine listing.
     */
    public CandidateExtractor() {
        this(List.of(
                new HydrationStateExtractionStrategy(),
                new CatalogMarkupExtractionStrategy(),
                new SearchEngineListingExtractionStrategy()));
    }

    public CandidateExtractor(List<ExtractionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public List<Candidate> extract(RawResponse response) {
        return extractWithOutcome(response).candidates();
    }

    public ExtractionOutcome extractWithOutcome(RawResponse response) {
        if (response == null || !response.success() || response.isEmpty()) {
            return new ExtractionOutcome(List.of(), null, List.of());
        }

        List<String> failures = new ArrayList<>();
        for (ExtractionStrategy strategy : strategies) {
            if (!strategy.appliesTo(response)) {
                continue;
            }
            try {
                List<Candidate> extracted = strategy.extract(response);
                if (!extracted.isEmpty()) {
                    List<Candidate> unique = dedupe(extracted);
                    log.debug("{} extracted {} candidates for '{}' ({})", strategy.name(), unique.size(),
                            response.query().text(), response.strategy().tag());
                    return new ExtractionOutcome(unique, strategy.name(), failures);
                }
            } catch (ExtractionException e) {
                log.debug("{} could not read response for '{}': {}", strategy.name(),
                        response.query().text(), e.getMessage());
                failures.add(strategy.name() + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("{} failed unexpectedly for '{}': {}", strategy.name(),
                        response.query().text(), e.toString());
                failures.add(strategy.name() + ": " + e);
            }
        }
        if (!failures.isEmpty()) {
            log.debug("No candidates extracted for '{}': {}", response.query().text(), failures);
        }
        return new ExtractionOutcome(List.of(), null, failures);
    }

    public List<ExtractionStrategy> getStrategies() {
        return strategies;
    }

    private static List<Candidate> dedupe(List<Candidate> candidates) {
        Map<String, Candidate> byId = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            byId.putIfAbsent(candidate.catalogId(), candidate);
        }
        return new ArrayList<>(byId.values());
    }
}
