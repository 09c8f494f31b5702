package com.track.resolution.guard;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.rules.NormalizationEngine;
import com.track.resolution.rules.TextField;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Vetoes candidates whose title lacks too many of the source title's significant words.
 * Stop words and single characters are not significant; word order does not matter.
 */
public class TitleTokenCoverageGuard implements Guard {

    public static final String NAME = "title_token_coverage";

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "and", "or", "in", "on", "at", "to", "for", "is", "it",
            "de", "la", "le", "el", "les", "der", "die", "das", "y", "et", "feat", "ft");

    private final double minCoverage;
    private final NormalizationEngine normalizer;

    public TitleTokenCoverageGuard(double minCoverage, NormalizationEngine normalizer) {
        this.minCoverage = minCoverage;
        this.normalizer = normalizer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GuardResult evaluate(SourceTrack track, ScoredCandidate candidate) {
        Set<String> required = significantTokens(track.title());
        if (required.isEmpty()) {
            return GuardResult.pass();
        }
        Set<String> present = new HashSet<>(Arrays.asList(
                normalizer.normalize(candidate.candidate().title(), TextField.TITLE).split(" ")));
        long found = required.stream().filter(present::contains).count();
        double coverage = (double) found / required.size();
        if (coverage < minCoverage) {
            return GuardResult.veto(NAME, String.format("%d of %d title words present (%.2f < %.2f)",
                    found, required.size(), coverage, minCoverage));
        }
        return GuardResult.pass();
    }

    Set<String> significantTokens(String title) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : normalizer.normalize(title, TextField.TITLE).split(" ")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
