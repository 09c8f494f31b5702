package com.track.resolution.scoring;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.ScoreBreakdown;
import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.rules.MixLabelParser;
import com.track.resolution.rules.NormalizationEngine;
import com.track.resolution.rules.RemixDetector;
import com.track.resolution.rules.TextField;
import com.track.resolution.rules.TrackNormalizationRules;
import com.track.resolution.similarity.SimilarityAlgorithm;
import com.track.resolution.similarity.TokenSetSimilarity;
import com.track.resolution.similarity.TokenSortSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a catalog candidate against a source track.
 * Scoring is a pure function of its two inputs and the weights fixed at construction.
 *
 * <ul>
 *   <li>title similarity: word-order-insensitive edit-distance ratio of cleaned titles</li>
 *   <li>artist similarity: each source artist's best token-set match among the candidate's
 *       credits, averaged</li>
 *   <li>remix adjustment: bonus scaled by label similarity when both sides carry a label,
 *       full penalty when only one does, nothing when neither does</li>
 *   <li>year adjustment: a small bonus when the candidate's release year equals the source's
 *       year hint or is one year off</li>
 * </ul>
 */
public class TrackScorer {
    private static final Logger log = LoggerFactory.getLogger(TrackScorer.class);

    public static final double EXACT_YEAR_BONUS = 2.0;
    public static final double NEAR_YEAR_BONUS = 1.0;

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");

    private final ScoringWeights weights;
    private final NormalizationEngine normalizer;
    private final RemixDetector remixDetector;
    private final SimilarityAlgorithm titleSimilarity;
    private final SimilarityAlgorithm artistSimilarity;
    private final SimilarityAlgorithm labelSimilarity;

    public TrackScorer() {
        this(ScoringWeights.defaultWeights());
    }

    public TrackScorer(ScoringWeights weights) {
        this(weights, TrackNormalizationRules.createDefaultEngine(), new RemixDetector());
    }

    public TrackScorer(ScoringWeights weights, NormalizationEngine normalizer, RemixDetector remixDetector) {
        this.weights = weights;
        this.normalizer = normalizer;
        this.remixDetector = remixDetector;
        this.titleSimilarity = new TokenSortSimilarity();
        this.artistSimilarity = new TokenSetSimilarity();
        this.labelSimilarity = new TokenSetSimilarity();
    }

    public ScoredCandidate score(SourceTrack track, Candidate candidate) {
        double title = titleSimilarity(track.title(), candidate.title());
        double artist = artistSimilarity(track.artists(), candidate.creditedArtists());
        double remix = remixAdjustment(track.remixLabel(), candidate.mixLabel());
        double year = yearAdjustment(track.releaseYear(), candidate.releaseDate());

        double composite = weights.titleWeight() * title + weights.artistWeight() * artist + remix + year;
        composite = round(Math.max(0.0, Math.min(100.0, composite)));

        ScoreBreakdown breakdown = new ScoreBreakdown(round(title), round(artist), round(remix), year);
        log.debug("Scored '{}' against '{}' ({}): {} {}",
                candidate.displayTitle(), track.displayTitle(), candidate.catalogId(), composite, breakdown);
        return new ScoredCandidate(candidate, composite, breakdown);
    }

    /**
     * Title similarity on the 0-100 scale after stripping featuring credits, bracketed
     * qualifiers and punctuation.
     */
    public double titleSimilarity(String sourceTitle, String candidateTitle) {
        String a = normalizer.normalize(sourceTitle, TextField.TITLE);
        String b = normalizer.normalize(candidateTitle, TextField.TITLE);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return titleSimilarity.percent(a, b);
    }

    public double artistSimilarity(List<String> sourceArtists, List<String> candidateArtists) {
        if (sourceArtists.isEmpty() || candidateArtists.isEmpty()) {
            return 0.0;
        }
        List<String> candidates = candidateArtists.stream()
                .map(a -> normalizer.normalize(a, TextField.ARTIST))
                .filter(a -> !a.isEmpty())
                .toList();
        if (candidates.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (String source : sourceArtists) {
            String normalized = normalizer.normalize(source, TextField.ARTIST);
            double best = 0.0;
            for (String candidate : candidates) {
                best = Math.max(best, artistSimilarity.percent(normalized, candidate));
            }
            total += best;
        }
        return total / sourceArtists.size();
    }

    /**
     * Similarity of two mix labels on the 0-100 scale. Labels naming different version types
     * ("Keinemusik Dub" vs "Keinemusik Remix") score 0. Otherwise mix vocabulary is ignored when
     * both labels name someone ("Keinemusik Remix" vs "Adam Port Extended Remix" compares the names).
     */
    public double labelSimilarity(String label1, String label2) {
        String a = normalizer.normalize(label1, TextField.MIX_LABEL);
        String b = normalizer.normalize(label2, TextField.MIX_LABEL);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (mixTypesDiffer(a, b)) {
            return 0.0;
        }
        String strippedA = MixLabelParser.stripMixKeywords(a);
        String strippedB = MixLabelParser.stripMixKeywords(b);
        if (!strippedA.isEmpty() && !strippedB.isEmpty()) {
            return labelSimilarity.percent(strippedA, strippedB);
        }
        return labelSimilarity.percent(a, b);
    }

    public double remixAdjustment(String sourceLabel, String candidateLabel) {
        Optional<String> source = remixDetector.significantLabel(sourceLabel);
        Optional<String> candidate = remixDetector.significantLabel(candidateLabel);
        double limit = weights.remixAdjustmentLimit();
        if (source.isPresent() && candidate.isPresent()) {
            return limit * labelSimilarity(source.get(), candidate.get()) / 100.0;
        }
        if (source.isPresent() || candidate.isPresent()) {
            return -limit;
        }
        return 0.0;
    }

    /**
     * True when both labels name a version type and the types differ, e.g. remix vs dub.
     * A label without a type word ("Keinemusik Mix") never conflicts.
     */
    public boolean mixTypeConflict(String label1, String label2) {
        return mixTypesDiffer(normalizer.normalize(label1, TextField.MIX_LABEL),
                normalizer.normalize(label2, TextField.MIX_LABEL));
    }

    /**
     * Points for agreement between the source's year hint and the candidate's release date:
     * {@value #EXACT_YEAR_BONUS} for the same year, {@value #NEAR_YEAR_BONUS} for one year off,
     * nothing otherwise or when either side is unknown.
     */
    public double yearAdjustment(Integer sourceYear, String candidateReleaseDate) {
        if (sourceYear == null || candidateReleaseDate == null) {
            return 0.0;
        }
        Matcher m = YEAR.matcher(candidateReleaseDate);
        if (!m.find()) {
            return 0.0;
        }
        int distance = Math.abs(Integer.parseInt(m.group()) - sourceYear);
        if (distance == 0) {
            return EXACT_YEAR_BONUS;
        }
        return distance == 1 ? NEAR_YEAR_BONUS : 0.0;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public RemixDetector getRemixDetector() {
        return remixDetector;
    }

    public NormalizationEngine getNormalizer() {
        return normalizer;
    }

    private static boolean mixTypesDiffer(String normalizedA, String normalizedB) {
        Set<String> typesA = MixLabelParser.mixTypes(normalizedA);
        Set<String> typesB = MixLabelParser.mixTypes(normalizedB);
        return !typesA.isEmpty() && !typesB.isEmpty() && !typesA.equals(typesB);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
