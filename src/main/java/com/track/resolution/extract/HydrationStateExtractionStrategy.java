package com.track.resolution.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.rules.ArtistSplitter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the hydration state the catalog's web front end embeds in its pages
 * ({@code <script id="__NEXT_DATA__">}) or returns from its JSON endpoints.
 *
 * <p>Result arrays are looked up under
 * {@code props.pageProps.dehydratedState.queries[*].state.data} with the keys
 * {@code results}, {@code tracks}, {@code items} and {@code data} tried in order,
 * then under {@code pageProps.tracks}, {@code pageProps.results} and a top-level
 * {@code results}. Field names vary between API versions, so every field is read
 * through its known aliases.</p>
 */
public class HydrationStateExtractionStrategy implements ExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(HydrationStateExtractionStrategy.class);

    public static final String NAME = "hydration_state";

    private static final String SCRIPT_MARKER = "__NEXT_DATA__";
    private static final List<String> RESULT_KEYS = List.of("results", "tracks", "items", "data");

    private final ObjectMapper objectMapper;
    private final String catalogBaseUrl;

    public HydrationStateExtractionStrategy() {
        this(new ObjectMapper(), CatalogTrackUrl.DEFAULT_BASE_URL);
    }

    public HydrationStateExtractionStrategy(ObjectMapper objectMapper, String catalogBaseUrl) {
        this.objectMapper = objectMapper;
        this.catalogBaseUrl = catalogBaseUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean appliesTo(RawResponse response) {
        return response.format() == PayloadFormat.JSON
                || (response.format() == PayloadFormat.HTML && response.body().contains(SCRIPT_MARKER));
    }

    @Override
    public List<Candidate> extract(RawResponse response) throws ExtractionException {
        JsonNode root = readState(response);
        List<JsonNode> rows = locateTrackRows(root);
        log.debug("Hydration state lists {} track rows for '{}'", rows.size(), response.query().text());

        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode row : rows) {
            Candidate candidate = toCandidate(row, response);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private JsonNode readState(RawResponse response) throws ExtractionException {
        String json;
        if (response.format() == PayloadFormat.JSON) {
            json = response.body();
        } else {
            Element script = Jsoup.parse(response.body()).selectFirst("script#" + SCRIPT_MARKER);
            if (script == null) {
                throw new ExtractionException("No " + SCRIPT_MARKER + " script element in page");
            }
            json = script.data();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Malformed hydration state: " + e.getOriginalMessage(), e);
        }
    }

    List<JsonNode> locateTrackRows(JsonNode root) {
        List<JsonNode> rows = new ArrayList<>();
        JsonNode pageProps = root.path("props").path("pageProps");

        for (JsonNode query : pageProps.path("dehydratedState").path("queries")) {
            JsonNode data = query.path("state").path("data");
            if (data.isArray()) {
                addTrackRows(data, rows);
                continue;
            }
            for (String key : RESULT_KEYS) {
                JsonNode list = data.path(key);
                if (list.isArray() && list.size() > 0) {
                    addTrackRows(list, rows);
                    break;
                }
            }
        }
        if (!rows.isEmpty()) {
            return rows;
        }

        for (JsonNode fallback : List.of(pageProps.path("tracks"), pageProps.path("results"), root.path("results"))) {
            if (fallback.isArray() && fallback.size() > 0) {
                addTrackRows(fallback, rows);
                if (!rows.isEmpty()) {
                    return rows;
                }
            }
        }
        return rows;
    }

    private static void addTrackRows(JsonNode array, List<JsonNode> rows) {
        for (JsonNode node : array) {
            if (node.isObject() && looksLikeTrack(node)) {
                rows.add(node);
            }
        }
    }

    private static boolean looksLikeTrack(JsonNode node) {
        return text(node, "id", "track_id") != null && text(node, "name", "track_name", "title") != null;
    }

    private Candidate toCandidate(JsonNode row, RawResponse response) {
        String id = text(row, "id", "track_id");
        String name = text(row, "name", "track_name", "title");
        if (!CandidateFields.isUsable(id, name)) {
            return null;
        }

        Candidate.Builder builder = CandidateFields.from(response).catalogId(id);
        CandidateFields.titled(builder, name, text(row, "mix_name", "mix"));

        List<String> artists = names(row.path("artists"));
        if (artists.isEmpty()) {
            String credits = text(row, "artist_name", "artist");
            artists = credits != null ? ArtistSplitter.split(credits) : List.of();
        }

        String slug = text(row, "slug");
        String url = slug != null ? new CatalogTrackUrl(slug, id).toUrl(catalogBaseUrl) : text(row, "url");

        return builder
                .artists(CandidateFields.cleanAll(artists))
                .remixers(CandidateFields.cleanAll(names(row.path("remixers"))))
                .recordLabel(CandidateFields.clean(nested(row, "label", "label_name")))
                .releaseName(CandidateFields.clean(nested(row, "release", "release_name")))
                .bpm(bpm(row.path("bpm")))
                .musicalKey(CandidateFields.clean(musicalKey(row)))
                .genre(CandidateFields.clean(nested(row, "genre", "genre_name")))
                .releaseDate(text(row, "publish_date", "new_release_date", "release_date"))
                .sourceUrl(url)
                .build();
    }

    /**
     * First non-blank scalar among the aliases.
     */
    private static String text(JsonNode node, String... aliases) {
        for (String alias : aliases) {
            JsonNode value = node.get(alias);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String s = value.asText().trim();
                if (!s.isEmpty()) {
                    return s;
                }
            }
        }
        return null;
    }

    /**
     * Reads {@code field.name}, a plain {@code field} string, or the first element of a
     * {@code field} array, then the flat alias.
     */
    private static String nested(JsonNode node, String field, String flatAlias) {
        JsonNode value = node.path(field);
        if (value.isArray() && value.size() > 0) {
            value = value.get(0);
        }
        if (value.isObject()) {
            String name = text(value, "name");
            if (name != null) {
                return name;
            }
        } else if (value.isTextual() && !value.asText().isBlank()) {
            return value.asText();
        }
        return text(node, flatAlias);
    }

    private static String musicalKey(JsonNode row) {
        JsonNode key = row.path("key");
        if (key.isObject()) {
            String name = text(key, "name");
            if (name != null) {
                return name;
            }
        }
        return text(row, "key_name", "key");
    }

    private static List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        if (!array.isArray()) {
            return names;
        }
        for (JsonNode element : array) {
            if (element.isTextual()) {
                names.add(element.asText());
            } else if (element.isObject()) {
                String name = text(element, "name", "artist_name");
                if (name != null) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static Integer bpm(JsonNode value) {
        if (value.isNumber()) {
            return (int) Math.round(value.asDouble());
        }
        return value.isTextual() ? CandidateFields.parseBpm(value.asText()) : null;
    }
}
