package com.track.resolution.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates a mix designation from a raw title.
 * Handles "Title (Keinemusik Remix)", "Title [Extended Mix]" and "Title - Radio Edit",
 * and collects featured artists written as "(feat. X)".
 */
public final class MixLabelParser {

    public static final Set<String> MIX_KEYWORDS = Set.of(
            "original", "extended", "club", "radio", "edit", "remix", "rmx", "dub", "vip",
            "rework", "refire", "reedit", "remake", "acapella", "instrumental", "mix", "version",
            "bootleg", "flip", "remaster", "remastered");

    /**
     * Mix vocabulary that names a distinct version of a recording, keyed to its canonical type.
     * Words such as "extended", "club" or "mix" only qualify a version and are absent.
     */
    public static final Map<String, String> MIX_TYPES = Map.ofEntries(
            Map.entry("remix", "remix"),
            Map.entry("rmx", "remix"),
            Map.entry("dub", "dub"),
            Map.entry("vip", "vip"),
            Map.entry("edit", "edit"),
            Map.entry("reedit", "edit"),
            Map.entry("rework", "rework"),
            Map.entry("refire", "refire"),
            Map.entry("remake", "remake"),
            Map.entry("bootleg", "bootleg"),
            Map.entry("flip", "flip"),
            Map.entry("acapella", "acapella"),
            Map.entry("instrumental", "instrumental"));

    private static final Pattern GROUP = Pattern.compile("[(\\[]([^()\\[\\]]+)[)\\]]");
    private static final Pattern DASH_SUFFIX = Pattern.compile("\\s[-\\u2013\\u2014]\\s([^-\\u2013\\u2014]+)$");
    private static final Pattern FEATURING = Pattern.compile(
            "^(?:feat\\.?|ft\\.?|featuring)\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}-]+");

    private MixLabelParser() {
        // Utility class
    }

    /**
     * Result of splitting a raw title.
     *
     * @param title            the title without mix or featuring groups
     * @param mixLabel         the mix designation, or null
     * @param featuredArtists  artists named in featuring groups, in order
     */
    public record ParsedTitle(String title, String mixLabel, List<String> featuredArtists) {
        public ParsedTitle {
            featuredArtists = featuredArtists != null ? List.copyOf(featuredArtists) : List.of();
        }
    }

    public static ParsedTitle parse(String rawTitle) {
        if (rawTitle == null || rawTitle.isBlank()) {
            return new ParsedTitle("", null, List.of());
        }
        String title = rawTitle.trim();
        String mixLabel = null;
        List<String> featured = new ArrayList<>();

        Matcher groups = GROUP.matcher(title);
        StringBuilder kept = new StringBuilder();
        int last = 0;
        while (groups.find()) {
            String content = groups.group(1).trim();
            Matcher feat = FEATURING.matcher(content);
            if (feat.matches()) {
                featured.addAll(ArtistSplitter.split(feat.group(1)));
            } else if (mixLabel == null && containsMixKeyword(content)) {
                mixLabel = content;
            } else {
                continue;
            }
            kept.append(title, last, groups.start());
            last = groups.end();
        }
        kept.append(title.substring(last));
        title = kept.toString().trim().replaceAll("\\s+", " ");

        if (mixLabel == null) {
            Matcher dash = DASH_SUFFIX.matcher(title);
            if (dash.find() && containsMixKeyword(dash.group(1))) {
                mixLabel = dash.group(1).trim();
                title = title.substring(0, dash.start()).trim();
            }
        }
        return new ParsedTitle(title, mixLabel, featured);
    }

    /**
     * True when any word of the text is mix vocabulary ("remix", "extended", "dub", ...).
     */
    public static boolean containsMixKeyword(String text) {
        if (text == null) {
            return false;
        }
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (MIX_KEYWORDS.contains(token.replace("-", ""))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops mix vocabulary from a normalized label, leaving the remixer name
     * ("keinemusik remix" becomes "keinemusik").
     */
    public static String stripMixKeywords(String normalizedLabel) {
        if (normalizedLabel == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String token : normalizedLabel.split("\\s+")) {
            if (!token.isEmpty() && !MIX_KEYWORDS.contains(token)) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(token);
            }
        }
        return sb.toString();
    }

    /**
     * Canonical version types named by a normalized label, e.g. {@code [remix]} for
     * "keinemusik extended remix" and {@code [dub]} for "keinemusik dub".
     */
    public static Set<String> mixTypes(String normalizedLabel) {
        Set<String> types = new TreeSet<>();
        if (normalizedLabel == null) {
            return types;
        }
        for (String token : normalizedLabel.split("\\s+")) {
            String type = MIX_TYPES.get(token.replace("-", ""));
            if (type != null) {
                types.add(type);
            }
        }
        return types;
    }
}
