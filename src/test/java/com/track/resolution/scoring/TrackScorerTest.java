package com.track.resolution.scoring;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrackScorer Tests")
class TrackScorerTest {

    private static final SourceTrack REMIX_SOURCE =
            SourceTrack.of("t1", "Never Sleep Again", List.of("Solomun"), "Keinemusik Remix");
    private static final SourceTrack PLAIN_SOURCE =
            SourceTrack.of("t2", "Lost In Time", List.of("Adam Port"));

    private TrackScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new TrackScorer();
    }

    private static Candidate candidate(String title, String mix, List<String> artists, List<String> remixers) {
        return Candidate.builder()
                .catalogId("c-" + title.hashCode())
                .title(title)
                .mixLabel(mix)
                .artists(artists)
                .remixers(remixers)
                .build();
    }

    @Nested
    @DisplayName("Composite score")
    class CompositeTests {

        @Test
        @DisplayName("The requested remix scores 100")
        void requestedRemix() {
            ScoredCandidate scored = scorer.score(REMIX_SOURCE, candidate("Never Sleep Again", "Keinemusik Remix",
                    List.of("Solomun"), List.of("Keinemusik")));

            assertEquals(100.0, scored.score());
            assertEquals(100.0, scored.breakdown().titleSimilarity());
            assertEquals(100.0, scored.breakdown().artistSimilarity());
            assertEquals(15.0, scored.breakdown().remixAdjustment());
        }

        @Test
        @DisplayName("A perfect match without labels tops out at title plus artist weight")
        void perfectUnlabelled() {
            ScoredCandidate scored = scorer.score(PLAIN_SOURCE,
                    candidate("Lost In Time", null, List.of("Adam Port"), List.of()));

            assertEquals(85.0, scored.score());
            assertEquals(0.0, scored.breakdown().remixAdjustment());
            assertEquals(85.0, scorer.getWeights().maxUnlabelledScore(), 1e-9);
        }

        @Test
        @DisplayName("A neutral label on the candidate is the same as no label")
        void neutralLabel() {
            ScoredCandidate scored = scorer.score(PLAIN_SOURCE,
                    candidate("Lost In Time", "Original Mix", List.of("Adam Port"), List.of()));

            assertEquals(85.0, scored.score());
        }

        @Test
        @DisplayName("A missing remix label costs the full adjustment")
        void missingRemixLabel() {
            ScoredCandidate original = scorer.score(REMIX_SOURCE,
                    candidate("Never Sleep Again", "Original Mix", List.of("Solomun"), List.of()));
            ScoredCandidate unexpected = scorer.score(PLAIN_SOURCE,
                    candidate("Lost In Time", "Keinemusik Remix", List.of("Adam Port"), List.of("Keinemusik")));

            assertEquals(70.0, original.score());
            assertEquals(-15.0, original.breakdown().remixAdjustment());
            assertEquals(70.0, unexpected.score());
        }

        @Test
        @DisplayName("A different remix gets only a small bonus")
        void differentRemix() {
            ScoredCandidate scored = scorer.score(REMIX_SOURCE, candidate("Never Sleep Again", "Adam Port Remix",
                    List.of("Solomun"), List.of("Adam Port")));

            assertTrue(scored.breakdown().remixAdjustment() > 0 && scored.breakdown().remixAdjustment() < 3,
                    "Got " + scored.breakdown());
            assertTrue(scored.score() < 90, "Got " + scored.score());
        }

        @Test
        @DisplayName("Another version type by the requested remixer earns no remix bonus")
        void otherMixTypeSameRemixer() {
            ScoredCandidate dub = scorer.score(REMIX_SOURCE, candidate("Never Sleep Again", "Keinemusik Dub",
                    List.of("Solomun"), List.of("Keinemusik")));

            assertEquals(0.0, dub.breakdown().remixAdjustment());
            assertEquals(85.0, dub.score());
        }

        @Test
        @DisplayName("A matching release year adds to the composite")
        void releaseYearBonus() {
            SourceTrack dated = new SourceTrack("t3", "Lost In Time", List.of("Adam Port"), null, 2019);
            Candidate sameYear = Candidate.builder()
                    .catalogId("11")
                    .title("Lost In Time")
                    .artists(List.of("Adam Port"))
                    .releaseDate("2019-05-24")
                    .build();

            ScoredCandidate scored = scorer.score(dated, sameYear);

            assertEquals(87.0, scored.score());
            assertEquals(2.0, scored.breakdown().yearAdjustment());
            assertEquals(85.0, scorer.score(PLAIN_SOURCE, sameYear).score());
        }

        @Test
        @DisplayName("Scores are clamped to 100")
        void clamped() {
            TrackScorer titleOnly = new TrackScorer(new ScoringWeights(1.0, 0.0, 15.0));
            ScoredCandidate scored = titleOnly.score(REMIX_SOURCE, candidate("Never Sleep Again", "Keinemusik Remix",
                    List.of("Someone"), List.of()));

            assertEquals(100.0, scored.score());
        }

        @Test
        @DisplayName("Scoring is deterministic")
        void deterministic() {
            Candidate c = candidate("Lost in Time", "Dixon Edit", List.of("Adam Port", "Aki"), List.of("Dixon"));

            ScoredCandidate first = scorer.score(PLAIN_SOURCE, c);
            ScoredCandidate second = new TrackScorer().score(PLAIN_SOURCE, c);

            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Component similarities")
    class ComponentTests {

        @ParameterizedTest
        @DisplayName("Title similarity ignores word order, case and qualifiers")
        @CsvSource({
                "Never Sleep Again,sleep never again,100.0",
                "Never Sleep Again (feat. Aki),Never Sleep Again,100.0",
                "Moonlight Shadow,Moonlite Shadows,87.5"
        })
        void titleSimilarity(String source, String candidate, double expected) {
            assertEquals(expected, scorer.titleSimilarity(source, candidate), 1e-9);
        }

        @Test
        @DisplayName("Empty titles have no similarity")
        void emptyTitle() {
            assertEquals(0.0, scorer.titleSimilarity("(Original Mix)", "Lost In Time"));
        }

        @Test
        @DisplayName("Artist similarity averages each source artist's best match")
        void artistAverage() {
            assertEquals(100.0, scorer.artistSimilarity(List.of("Adam Port"), List.of("Keinemusik", "adam port")));
            double partial = scorer.artistSimilarity(List.of("Adam Port", "Aki"), List.of("Adam Port"));
            assertTrue(partial > 55 && partial < 60, "Got " + partial);
            assertEquals(0.0, scorer.artistSimilarity(List.of("Adam Port"), List.of()));
        }

        @Test
        @DisplayName("Artist similarity treats a credit containing every source word as a full match")
        void artistTokenSet() {
            assertEquals(100.0, scorer.artistSimilarity(List.of("Adam Port"), List.of("Adam Port Collective")), 1e-9);
            assertTrue(scorer.titleSimilarity("Adam Port", "Adam Port Collective") < 100);
        }

        @Test
        @DisplayName("Label similarity compares remixer names")
        void labelSimilarity() {
            assertEquals(100.0, scorer.labelSimilarity("Keinemusik Remix", "Keinemusik RMX"), 1e-9);
            assertTrue(scorer.labelSimilarity("Keinemusik Remix", "Adam Port Remix") < 20);
            assertEquals(0.0, scorer.labelSimilarity("", "Keinemusik Remix"));
        }

        @Test
        @DisplayName("Label similarity is zero across version types")
        void labelSimilarityAcrossMixTypes() {
            assertEquals(0.0, scorer.labelSimilarity("Keinemusik Remix", "Keinemusik Dub"));
            assertEquals(0.0, scorer.labelSimilarity("Keinemusik Remix", "Keinemusik VIP"));
            assertEquals(100.0, scorer.labelSimilarity("Keinemusik Remix", "Keinemusik Extended Remix"), 1e-9);
            assertTrue(scorer.mixTypeConflict("Dixon Edit", "Dixon Rework"));
            assertFalse(scorer.mixTypeConflict("Dixon Rework", "Dixon Re-Work"));
        }

        @ParameterizedTest
        @DisplayName("Year adjustment rewards an exact or adjacent release year")
        @CsvSource({
                "2019,2019-05-24,2.0",
                "2019,2020-01-10,1.0",
                "2019,2018,1.0",
                "2019,2016-05-24,0.0",
                "2019,unknown,0.0"
        })
        void yearAdjustment(int sourceYear, String releaseDate, double expected) {
            assertEquals(expected, scorer.yearAdjustment(sourceYear, releaseDate));
        }

        @Test
        @DisplayName("Year adjustment needs both sides")
        void yearAdjustmentMissing() {
            assertEquals(0.0, scorer.yearAdjustment(null, "2019-05-24"));
            assertEquals(0.0, scorer.yearAdjustment(2019, null));
        }

        @Test
        @DisplayName("Remix adjustment follows label presence")
        void remixAdjustment() {
            assertEquals(15.0, scorer.remixAdjustment("Dixon Rework", "Dixon Re-Work"), 1e-9);
            assertEquals(-15.0, scorer.remixAdjustment(null, "Dixon Rework"));
            assertEquals(-15.0, scorer.remixAdjustment("Dixon Rework", "Extended Mix"));
            assertEquals(0.0, scorer.remixAdjustment("Original Mix", "Radio Edit"));
        }
    }

    // ============ Weights Tests ============

    @Test
    @DisplayName("Weights reject invalid combinations")
    void testWeightsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.4, 0.3, 15));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.7, 0.5, 15));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.5, 0.35, 20));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.5, -0.1, 15));
        assertEquals(new ScoringWeights(0.5, 0.35, 15), ScoringWeights.defaultWeights());
    }
}
