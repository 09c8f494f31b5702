package com.track.resolution.extract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.retrieval.CatalogPayloads;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Candidate extraction")
class CandidateExtractorTest {

    private static RawResponse response(StrategyType strategy, String body) {
        Query query = new Query("Never Sleep Again Solomun", strategy, 3);
        return RawResponse.success(query, strategy, PayloadFormat.detect(null, body), body,
                "https://catalog.test/search", Duration.ofMillis(5));
    }

    private static ObjectNode keinemusikRemix() {
        return CatalogPayloads.track("3", "Never Sleep Again", "Keinemusik Remix",
                List.of("Solomun"), List.of("Keinemusik"));
    }

    @Nested
    @DisplayName("Hydration state")
    class HydrationStateTests {

        private final HydrationStateExtractionStrategy strategy = new HydrationStateExtractionStrategy();

        @Test
        @DisplayName("Should read a JSON results payload")
        void testJsonResults() throws ExtractionException {
            RawResponse response = response(StrategyType.DIRECT_SEARCH, CatalogPayloads.results(keinemusikRemix()));

            assertTrue(strategy.appliesTo(response));
            List<Candidate> candidates = strategy.extract(response);

            assertEquals(1, candidates.size());
            Candidate c = candidates.get(0);
            assertEquals("3", c.catalogId());
            assertEquals("Never Sleep Again", c.title());
            assertEquals("Keinemusik Remix", c.mixLabel());
            assertEquals(List.of("Solomun"), c.artists());
            assertEquals(List.of("Keinemusik"), c.remixers());
            assertEquals("https://www.beatport.com/track/never-sleep-again/3", c.sourceUrl());
            assertEquals(3, c.queryRank());
            assertEquals(StrategyType.DIRECT_SEARCH, c.strategy());
        }

        @Test
        @DisplayName("Should read the __NEXT_DATA__ script of a rendered page")
        void testNextDataPage() throws ExtractionException {
            RawResponse response = response(StrategyType.BROWSER_AUTOMATION, CatalogPayloads.nextDataPage(
                    keinemusikRemix(), CatalogPayloads.track("1", "Never Sleep Again", "Original Mix", "Solomun")));

            assertEquals(PayloadFormat.HTML, response.format());
            assertTrue(strategy.appliesTo(response));
            List<Candidate> candidates = strategy.extract(response);

            assertEquals(List.of("3", "1"), candidates.stream().map(Candidate::catalogId).toList());
            assertEquals(StrategyType.BROWSER_AUTOMATION, candidates.get(1).strategy());
        }

        @Test
        @DisplayName("Should read every field through its aliases")
        void testAliases() throws ExtractionException {
            String json = "{\"props\":{\"pageProps\":{\"tracks\":[{"
                    + "\"track_id\":\"77\",\"track_name\":\"Cola (Extended Mix)\","
                    + "\"artist_name\":\"CamelPhat & Elderbrook\",\"label\":{\"name\":\"Defected\"},"
                    + "\"bpm\":\"122 BPM\",\"key\":{\"name\":\"F Minor\"},\"genre\":[{\"name\":\"House\"}],"
                    + "\"release\":\"Cola\",\"publish_date\":\"2017-06-16\","
                    + "\"url\":\"https://www.beatport.com/track/cola/77\"}]}}}";

            Candidate c = strategy.extract(response(StrategyType.DIRECT_SEARCH, json)).get(0);

            assertEquals("77", c.catalogId());
            assertEquals("Cola", c.title());
            assertEquals("Extended Mix", c.mixLabel());
            assertEquals(List.of("CamelPhat", "Elderbrook"), c.artists());
            assertEquals("Defected", c.recordLabel());
            assertEquals(122, c.bpm());
            assertEquals("F Minor", c.musicalKey());
            assertEquals("House", c.genre());
            assertEquals("Cola", c.releaseName());
            assertEquals("2017-06-16", c.releaseDate());
            assertEquals("https://www.beatport.com/track/cola/77", c.sourceUrl());
        }

        @Test
        @DisplayName("Rows without id or name are skipped")
        void testIncompleteRows() throws ExtractionException {
            String json = "{\"results\":[{\"name\":\"No Id\"},{\"id\":5,\"name\":\"Real\",\"bpm\":124.4},\"junk\"]}";

            List<Candidate> candidates = strategy.extract(response(StrategyType.DIRECT_SEARCH, json));

            assertEquals(1, candidates.size());
            assertEquals(124, candidates.get(0).bpm());
        }

        @Test
        @DisplayName("Malformed payloads raise ExtractionException")
        void testMalformed() {
            assertThrows(ExtractionException.class,
                    () -> strategy.extract(response(StrategyType.DIRECT_SEARCH, "{\"results\": [")));
            assertThrows(ExtractionException.class,
                    () -> strategy.extract(response(StrategyType.DIRECT_SEARCH,
                            "<html><body>__NEXT_DATA__ missing</body></html>")));
        }
    }

    @Nested
    @DisplayName("Catalog markup")
    class CatalogMarkupTests {

        private final CatalogMarkupExtractionStrategy strategy = new CatalogMarkupExtractionStrategy();

        @Test
        @DisplayName("Should read tagged listing rows")
        void testRows() throws ExtractionException {
            String html = "<html><body><ul>"
                    + "<li data-track-id=\"11\"><a href=\"/track/cola/11\"><span data-testid=\"track-title\">Cola</span></a>"
                    + "<span data-testid=\"track-mix\">Extended Mix</span>"
                    + "<div data-testid=\"track-artists\"><a href=\"/artist/camelphat/1\">CamelPhat</a>"
                    + "<a href=\"/artist/elderbrook/2\">Elderbrook</a></div>"
                    + "<span data-testid=\"track-bpm\">122 BPM</span>"
                    + "<a href=\"/label/defected/9\">Defected</a></li>"
                    + "</ul></body></html>";
            RawResponse response = response(StrategyType.DIRECT_SEARCH, html);

            assertTrue(strategy.appliesTo(response));
            List<Candidate> candidates = strategy.extract(response);

            assertEquals(1, candidates.size());
            Candidate c = candidates.get(0);
            assertEquals("11", c.catalogId());
            assertEquals("Cola", c.title());
            assertEquals("Extended Mix", c.mixLabel());
            assertEquals(List.of("CamelPhat", "Elderbrook"), c.artists());
            assertEquals("Defected", c.recordLabel());
            assertEquals(122, c.bpm());
            assertEquals("https://www.beatport.com/track/cola/11", c.sourceUrl());
        }

        @Test
        @DisplayName("Should read bare track links with artists from the same row")
        void testLinks() throws ExtractionException {
            String html = "<html><body><ul><li>"
                    + "<a href=\"/track/lost-in-time/21\">Lost In Time (Original Mix)</a> "
                    + "<a href=\"/artist/adam-port/5\">Adam Port</a>"
                    + "</li></ul></body></html>";

            Candidate c = strategy.extract(response(StrategyType.DIRECT_SEARCH, html)).get(0);

            assertEquals("21", c.catalogId());
            assertEquals("Lost In Time", c.title());
            assertEquals("Original Mix", c.mixLabel());
            assertEquals(List.of("Adam Port"), c.artists());
            assertEquals("https://www.beatport.com/track/lost-in-time/21", c.sourceUrl());
        }

        @Test
        @DisplayName("Should read JSON-LD recordings inside a graph")
        void testJsonLd() throws ExtractionException {
            String html = "<html><head><script type=\"application/ld+json\">"
                    + "{\"@context\":\"https://schema.org\",\"@graph\":[{\"@type\":\"MusicRecording\","
                    + "\"name\":\"Move (Keinemusik Remix)\",\"url\":\"https://www.beatport.com/track/move/31\","
                    + "\"byArtist\":[{\"name\":\"Adam Port\"},{\"name\":\"Keinemusik\"}],"
                    + "\"recordLabel\":{\"name\":\"Keinemusik\"},\"inAlbum\":{\"name\":\"Move\"},"
                    + "\"genre\":\"Afro House\",\"datePublished\":\"2024-05-01\"},{\"@type\":\"WebPage\"}]}"
                    + "</script></head><body></body></html>";

            List<Candidate> candidates = strategy.extract(response(StrategyType.BROWSER_AUTOMATION, html));

            assertEquals(1, candidates.size());
            Candidate c = candidates.get(0);
            assertEquals("31", c.catalogId());
            assertEquals("Move", c.title());
            assertEquals("Keinemusik Remix", c.mixLabel());
            assertEquals(List.of("Adam Port", "Keinemusik"), c.artists());
            assertEquals("Keinemusik", c.recordLabel());
            assertEquals("Move", c.releaseName());
            assertEquals("Afro House", c.genre());
            assertEquals("2024-05-01", c.releaseDate());
        }

        @Test
        @DisplayName("Only malformed JSON-LD raises ExtractionException")
        void testMalformedJsonLd() {
            String html = "<html><head><script type=\"application/ld+json\">{broken</script></head></html>";

            assertThrows(ExtractionException.class,
                    () -> strategy.extract(response(StrategyType.DIRECT_SEARCH, html)));
        }

        @Test
        @DisplayName("Does not apply to search engine pages or JSON")
        void testNotApplicable() {
            String html = CatalogPayloads.engineResultPage("/track/cola/77", "Cola");

            assertFalse(strategy.appliesTo(response(StrategyType.ENGINE_FALLBACK, html)));
            assertFalse(strategy.appliesTo(response(StrategyType.DIRECT_SEARCH, "{\"results\":[]}")));
        }
    }

    @Nested
    @DisplayName("Search engine listing")
    class SearchEngineListingTests {

        private final SearchEngineListingExtractionStrategy strategy = new SearchEngineListingExtractionStrategy();

        @Test
        @DisplayName("Should parse both result title forms behind redirect links")
        void testResultTitles() {
            String html = CatalogPayloads.engineResultPage(
                    "/track/never-sleep-again/3", "Solomun - Never Sleep Again (Keinemusik Remix) [Keinemusik] | Beatport",
                    "/track/cola/77", "Cola (Extended Mix) by CamelPhat, Elderbrook on Beatport");
            RawResponse response = response(StrategyType.ENGINE_FALLBACK, html);

            assertTrue(strategy.appliesTo(response));
            List<Candidate> candidates = strategy.extract(response);

            assertEquals(2, candidates.size());
            Candidate remix = candidates.get(0);
            assertEquals("3", remix.catalogId());
            assertEquals("Never Sleep Again", remix.title());
            assertEquals("Keinemusik Remix", remix.mixLabel());
            assertEquals(List.of("Solomun"), remix.artists());
            assertEquals("Keinemusik", remix.recordLabel());
            assertEquals("https://www.beatport.com/track/never-sleep-again/3", remix.sourceUrl());
            assertEquals(StrategyType.ENGINE_FALLBACK, remix.strategy());

            Candidate cola = candidates.get(1);
            assertEquals("Cola", cola.title());
            assertEquals("Extended Mix", cola.mixLabel());
            assertEquals(List.of("CamelPhat", "Elderbrook"), cola.artists());
        }

        @Test
        @DisplayName("Keeps the longest anchor text per track")
        void testLongestText() {
            String html = "<html><body>"
                    + "<a href=\"https://www.beatport.com/track/cola/77\">Cola</a>"
                    + "<a href=\"https://www.beatport.com/track/cola/77\">CamelPhat - Cola (Extended Mix)</a>"
                    + "<a href=\"https://www.beatport.com/track/cola/77\">https://www.beatport.com/track/cola/77 and more</a>"
                    + "</body></html>";

            List<Candidate> candidates = strategy.extract(response(StrategyType.ENGINE_FALLBACK, html));

            assertEquals(1, candidates.size());
            assertEquals(List.of("CamelPhat"), candidates.get(0).artists());
            assertEquals("Extended Mix", candidates.get(0).mixLabel());
        }

        @Test
        @DisplayName("Does not apply to catalog pages")
        void testNotApplicable() {
            assertFalse(strategy.appliesTo(response(StrategyType.DIRECT_SEARCH, "<html><a href=\"/track/a/1\">A</a></html>")));
        }
    }

    @Nested
    @DisplayName("Extractor")
    class ExtractorTests {

        private final CandidateExtractor extractor = new CandidateExtractor();

        @Test
        @DisplayName("Hydration state wins over markup in the same page")
        void testPriority() {
            String html = CatalogPayloads.nextDataPage(keinemusikRemix())
                    .replace("<div id=\"__next\"></div>",
                            "<div id=\"__next\"><li data-track-id=\"99\"><a href=\"/track/other/99\">Other</a></li></div>");

            ExtractionOutcome outcome = extractor.extractWithOutcome(response(StrategyType.DIRECT_SEARCH, html));

            assertEquals(HydrationStateExtractionStrategy.NAME, outcome.strategy());
            assertEquals(List.of("3"), outcome.candidates().stream().map(Candidate::catalogId).toList());
            assertFalse(outcome.failed());
        }

        @Test
        @DisplayName("Falls through to markup when hydration state lists nothing")
        void testFallThrough() {
            String html = "<html><body><script id=\"__NEXT_DATA__\" type=\"application/json\">{\"props\":{}}</script>"
                    + "<ul><li><a href=\"/track/cola/77\">Cola</a></li></ul></body></html>";

            ExtractionOutcome outcome = extractor.extractWithOutcome(response(StrategyType.DIRECT_SEARCH, html));

            assertEquals(CatalogMarkupExtractionStrategy.NAME, outcome.strategy());
            assertEquals("77", outcome.candidates().get(0).catalogId());
        }

        @Test
        @DisplayName("Duplicate catalog ids are collapsed")
        void testDedupe() {
            String json = CatalogPayloads.results(keinemusikRemix(), keinemusikRemix());

            assertEquals(1, extractor.extract(response(StrategyType.DIRECT_SEARCH, json)).size());
        }

        @Test
        @DisplayName("Malformed payloads are reported, never thrown")
        void testMalformedReported() {
            ExtractionOutcome outcome = extractor.extractWithOutcome(response(StrategyType.DIRECT_SEARCH, "{\"results\": ["));

            assertTrue(outcome.failed());
            assertTrue(outcome.candidates().isEmpty());
            assertEquals(1, outcome.failures().size());
            assertTrue(outcome.failures().get(0).startsWith("hydration_state: Malformed hydration state"));
        }

        @Test
        @DisplayName("Failed or empty responses yield nothing")
        void testFailedResponse() {
            Query query = new Query("x", StrategyType.DIRECT_SEARCH, 0);

            ExtractionOutcome outcome = extractor.extractWithOutcome(
                    RawResponse.failure(query, StrategyType.DIRECT_SEARCH, "HTTP 500", Duration.ZERO));

            assertTrue(outcome.candidates().isEmpty());
            assertFalse(outcome.failed());
            assertTrue(extractor.extract(null).isEmpty());
        }

        @Test
        @DisplayName("Unexpected strategy errors are contained")
        void testRuntimeErrorContained() {
            ExtractionStrategy exploding = new ExtractionStrategy() {
                @Override
                public String name() {
                    return "exploding";
                }

                @Override
                public boolean appliesTo(RawResponse response) {
                    return true;
                }

                @Override
                public List<Candidate> extract(RawResponse response) {
                    throw new IllegalStateException("boom");
                }
            };
            CandidateExtractor custom = new CandidateExtractor(List.of(exploding, new HydrationStateExtractionStrategy()));

            ExtractionOutcome outcome = custom.extractWithOutcome(
                    response(StrategyType.DIRECT_SEARCH, CatalogPayloads.results(keinemusikRemix())));

            assertEquals(1, outcome.candidates().size());
            assertEquals(List.of("exploding: java.lang.IllegalStateException: boom"), outcome.failures());
        }

        @Test
        @DisplayName("Requires at least one strategy")
        void testRequiresStrategy() {
            assertThrows(IllegalArgumentException.class, () -> new CandidateExtractor(List.of()));
        }
    }
}
