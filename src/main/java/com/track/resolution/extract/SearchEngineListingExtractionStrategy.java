package com.track.resolution.extract;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.PayloadFormat;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.rules.ArtistSplitter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads catalog track links out of third-party search engine result pages.
 *
 * <p>Result titles mirror the catalog page title, either
 * {@code "Artists - Title (Mix) [Label]"} or
 * {@code "Title (Mix) by Artists on Beatport"}; the site suffix is dropped and the
 * remaining parts are split into fields.</p>
 */
public class SearchEngineListingExtractionStrategy implements ExtractionStrategy {

    public static final String NAME = "search_engine_listing";

    private static final Pattern SITE_SUFFIX = Pattern.compile(
            "\\s*(?:[|\\u2013\\u2014-]\\s*beatport.*|\\bon beatport.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_LABEL = Pattern.compile("\\s*\\[([^\\[\\]]+)]\\s*$");
    private static final Pattern BY_FORM = Pattern.compile("^(.+?)\\s+by\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final String ARTIST_SEPARATOR = " - ";

    private final String catalogBaseUrl;

    public SearchEngineListingExtractionStrategy() {
        this(CatalogTrackUrl.DEFAULT_BASE_URL);
    }

    public SearchEngineListingExtractionStrategy(String catalogBaseUrl) {
        this.catalogBaseUrl = catalogBaseUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean appliesTo(RawResponse response) {
        return response.format() == PayloadFormat.HTML && response.strategy() == StrategyType.ENGINE_FALLBACK;
    }

    @Override
    public List<Candidate> extract(RawResponse response) {
        Map<String, String> bestTitleById = new LinkedHashMap<>();
        Map<String, CatalogTrackUrl> urlsById = new LinkedHashMap<>();

        for (Element anchor : Jsoup.parse(response.body()).select("a[href]")) {
            Optional<CatalogTrackUrl> url = CatalogTrackUrl.parse(anchor.attr("href"));
            String text = CandidateFields.clean(anchor.text());
            if (url.isEmpty() || text == null || looksLikeUrl(text)) {
                continue;
            }
            String id = url.get().id();
            urlsById.putIfAbsent(id, url.get());
            String current = bestTitleById.get(id);
            if (current == null || text.length() > current.length()) {
                bestTitleById.put(id, text);
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, String> entry : bestTitleById.entrySet()) {
            Candidate.Builder builder = CandidateFields.from(response)
                    .catalogId(entry.getKey())
                    .sourceUrl(urlsById.get(entry.getKey()).toUrl(catalogBaseUrl));
            Candidate candidate = parseResultTitle(builder, entry.getValue());
            if (!candidate.title().isEmpty()) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    Candidate parseResultTitle(Candidate.Builder builder, String resultTitle) {
        String text = SITE_SUFFIX.matcher(resultTitle).replaceFirst("").trim();

        Matcher label = TRAILING_LABEL.matcher(text);
        if (label.find()) {
            builder.recordLabel(CandidateFields.clean(label.group(1)));
            text = text.substring(0, label.start()).trim();
        }

        List<String> artists = List.of();
        int separator = text.indexOf(ARTIST_SEPARATOR);
        Matcher by = BY_FORM.matcher(text);
        if (separator > 0) {
            artists = ArtistSplitter.split(text.substring(0, separator));
            text = text.substring(separator + ARTIST_SEPARATOR.length());
        } else if (by.matches()) {
            artists = ArtistSplitter.split(by.group(2));
            text = by.group(1);
        }

        CandidateFields.titled(builder, text, null);
        return builder.artists(CandidateFields.cleanAll(artists)).build();
    }

    private static boolean looksLikeUrl(String text) {
        return text.startsWith("http") || text.startsWith("www.") || text.contains("beatport.com/");
    }
}
