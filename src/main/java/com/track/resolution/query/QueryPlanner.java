package com.track.resolution.query;

import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.rules.NormalizationEngine;
import com.track.resolution.rules.TextField;
import com.track.resolution.rules.TrackNormalizationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Produces the ordered search queries for a track, most specific first.
 *
 * <ol start="0">
 *   <li>title + all artists + remix label</li>
 *   <li>title + primary artist + remix label</li>
 *   <li>title + primary artist</li>
 *   <li>title without qualifiers and punctuation + primary artist</li>
 *   <li>title without qualifiers and punctuation + primary artist surname</li>
 * </ol>
 *
 * <p>Planning is deterministic and offline. Identical strings at different ranks are kept;
 * the response cache absorbs the repeated fetch.</p>
 */
public class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    public static final int MAX_RANKS = 5;

    private final NormalizationEngine normalizer;
    private final int maxRanks;

    public QueryPlanner() {
        this(TrackNormalizationRules.createDefaultEngine(), MAX_RANKS);
    }

    public QueryPlanner(NormalizationEngine normalizer, int maxRanks) {
        if (maxRanks < 1 || maxRanks > MAX_RANKS) {
            throw new IllegalArgumentException("maxRanks must be between 1 and " + MAX_RANKS);
        }
        this.normalizer = normalizer;
        this.maxRanks = maxRanks;
    }

    public List<Query> plan(SourceTrack track) {
        String title = normalizer.sanitize(track.title(), TextField.QUERY);
        String strippedTitle = normalizer.sanitize(track.title(), TextField.TITLE);
        String primary = normalizer.sanitize(track.primaryArtist(), TextField.QUERY);
        String allArtists = String.join(" ", track.artists().stream()
                .map(a -> normalizer.sanitize(a, TextField.QUERY))
                .toList());
        String remix = track.hasRemixLabel() ? " (" + normalizer.sanitize(track.remixLabel(), TextField.QUERY) + ")" : "";

        List<Supplier<String>> ranks = List.of(
                () -> title + remix + " " + allArtists,
                () -> title + remix + " " + primary,
                () -> title + " " + primary,
                () -> strippedTitle + " " + normalizer.sanitize(track.primaryArtist(), TextField.ARTIST),
                () -> strippedTitle + " " + surname(track.primaryArtist())
        );

        List<Query> queries = new ArrayList<>(maxRanks);
        for (int rank = 0; rank < maxRanks; rank++) {
            String text = ranks.get(rank).get().trim().replaceAll("\\s+", " ");
            queries.add(new Query(text, StrategyType.DIRECT_SEARCH, rank));
        }
        log.debug("Planned {} queries for track {}: {}", queries.size(), track.id(),
                queries.stream().map(Query::text).toList());
        return queries;
    }

    public int getMaxRanks() {
        return maxRanks;
    }

    private String surname(String artist) {
        String cleaned = normalizer.sanitize(artist, TextField.ARTIST);
        int space = cleaned.lastIndexOf(' ');
        return space < 0 ? cleaned : cleaned.substring(space + 1);
    }
}
