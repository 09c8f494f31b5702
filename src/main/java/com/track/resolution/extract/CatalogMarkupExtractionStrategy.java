package com.track.resolution.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads candidates from the catalog's rendered HTML: listing rows tagged with
 * {@code data-track-id}, bare {@code /track/} links, and JSON-LD
 * {@code MusicRecording} blocks on track pages.
 */
public class CatalogMarkupExtractionStrategy implements ExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(CatalogMarkupExtractionStrategy.class);

    public static final String NAME = "catalog_markup";

    private static final String ROW_SELECTOR = "[data-track-id]";
    private static final String LINK_SELECTOR = "a[href^=/track/], a[href*=beatport.com/track/]";
    private static final String JSON_LD_SELECTOR = "script[type=application/ld+json]";
    private static final String ROW_CONTAINER = "li, tr, article, [class*=row], [class*=Row], [class*=item], [class*=Item]";

    private final ObjectMapper objectMapper;
    private final String catalogBaseUrl;

    public CatalogMarkupExtractionStrategy() {
        this(new ObjectMapper(), CatalogTrackUrl.DEFAULT_BASE_URL);
    }

    public CatalogMarkupExtractionStrategy(ObjectMapper objectMapper, String catalogBaseUrl) {
        this.objectMapper = objectMapper;
        this.catalogBaseUrl = catalogBaseUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean appliesTo(RawResponse response) {
        if (response.format() != PayloadFormat.HTML || response.strategy() == StrategyType.ENGINE_FALLBACK) {
            return false;
        }
        String body = response.body();
        return body.contains("data-track-id") || body.contains("/track/") || body.contains("application/ld+json");
    }

    @Override
    public List<Candidate> extract(RawResponse response) throws ExtractionException {
        Document doc = Jsoup.parse(response.body(), catalogBaseUrl);
        Map<String, Candidate> byId = new LinkedHashMap<>();

        for (Element row : doc.select(ROW_SELECTOR)) {
            fromRow(row, response).ifPresent(c -> byId.putIfAbsent(c.catalogId(), c));
        }
        for (Element link : doc.select(LINK_SELECTOR)) {
            fromLink(link, response).ifPresent(c -> byId.putIfAbsent(c.catalogId(), c));
        }

        List<String> jsonLdErrors = new ArrayList<>();
        for (Element script : doc.select(JSON_LD_SELECTOR)) {
            try {
                for (Candidate c : fromJsonLd(objectMapper.readTree(script.data()), response)) {
                    byId.putIfAbsent(c.catalogId(), c);
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
                jsonLdErrors.add(e.getOriginalMessage());
            }
        }

        if (byId.isEmpty() && !jsonLdErrors.isEmpty()) {
            throw new ExtractionException("Malformed JSON-LD: " + jsonLdErrors.get(0));
        }
        return new ArrayList<>(byId.values());
    }

    private Optional<Candidate> fromRow(Element row, RawResponse response) {
        String id = row.attr("data-track-id").trim();
        Element link = row.selectFirst("a[href*=/track/]");
        String title = firstText(row, "[data-testid=track-title], .track-title, .buk-track-title");
        if (title == null && link != null) {
            title = link.text();
        }
        if (!CandidateFields.isUsable(id, title)) {
            return Optional.empty();
        }

        Candidate.Builder builder = CandidateFields.from(response).catalogId(id);
        CandidateFields.titled(builder, title,
                firstText(row, "[data-testid=track-mix], .mix-name, .buk-track-remixed"));

        String url = link != null ? link.absUrl("href") : null;
        return Optional.of(builder
                .artists(texts(row, "[data-testid=track-artists] a, .artists a, a[href^=/artist/]"))
                .remixers(texts(row, "[data-testid=track-remixers] a, .remixers a"))
                .recordLabel(firstText(row, "[data-testid=track-label], .label a, a[href^=/label/]"))
                .releaseName(firstText(row, "[data-testid=track-release], .release a, a[href^=/release/]"))
                .bpm(CandidateFields.parseBpm(firstText(row, "[data-testid=track-bpm], .bpm")))
                .musicalKey(firstText(row, "[data-testid=track-key], .key"))
                .genre(firstText(row, "[data-testid=track-genre], .genre a, .genre"))
                .releaseDate(firstText(row, "[data-testid=track-date], .release-date"))
                .sourceUrl(url != null && !url.isEmpty() ? url : null)
                .build());
    }

    private Optional<Candidate> fromLink(Element link, RawResponse response) {
        Optional<CatalogTrackUrl> url = CatalogTrackUrl.parse(link.attr("href"));
        if (url.isEmpty() || !CandidateFields.isUsable(url.get().id(), link.text())) {
            return Optional.empty();
        }
        Candidate.Builder builder = CandidateFields.from(response).catalogId(url.get().id());
        CandidateFields.titled(builder, link.text(), null);

        Element container = link.closest(ROW_CONTAINER);
        List<String> artists = container != null ? texts(container, "a[href^=/artist/]") : List.of();
        return Optional.of(builder
                .artists(artists)
                .sourceUrl(url.get().toUrl(catalogBaseUrl))
                .build());
    }

    private List<Candidate> fromJsonLd(JsonNode node, RawResponse response) {
        List<Candidate> found = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                found.addAll(fromJsonLd(element, response));
            }
            return found;
        }
        if (node.has("@graph")) {
            found.addAll(fromJsonLd(node.get("@graph"), response));
        }
        if (!"MusicRecording".equals(node.path("@type").asText())) {
            return found;
        }

        String url = node.path("url").asText(null);
        Optional<CatalogTrackUrl> trackUrl = CatalogTrackUrl.parse(url);
        String name = node.path("name").asText(null);
        if (trackUrl.isEmpty() || !CandidateFields.isUsable(trackUrl.get().id(), name)) {
            return found;
        }

        Candidate.Builder builder = CandidateFields.from(response).catalogId(trackUrl.get().id());
        CandidateFields.titled(builder, name, null);

        List<String> artists = new ArrayList<>();
        JsonNode byArtist = node.path("byArtist");
        if (byArtist.isArray()) {
            byArtist.forEach(a -> artists.add(a.path("name").asText("")));
        } else if (byArtist.isObject()) {
            artists.add(byArtist.path("name").asText(""));
        }

        found.add(builder
                .artists(CandidateFields.cleanAll(artists))
                .releaseName(CandidateFields.clean(node.path("inAlbum").path("name").asText(null)))
                .recordLabel(CandidateFields.clean(node.path("recordLabel").path("name").asText(null)))
                .genre(CandidateFields.clean(node.path("genre").asText(null)))
                .releaseDate(CandidateFields.clean(node.path("datePublished").asText(null)))
                .sourceUrl(trackUrl.get().toUrl(catalogBaseUrl))
                .build());
        return found;
    }

    private static String firstText(Element scope, String selector) {
        Element element = scope.selectFirst(selector);
        return element != null ? CandidateFields.clean(element.text()) : null;
    }

    private static List<String> texts(Element scope, String selector) {
        List<String> values = new ArrayList<>();
        for (Element element : scope.select(selector)) {
            values.add(element.text());
        }
        return CandidateFields.cleanAll(values);
    }
}
