package com.track.resolution.extract;

import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.RawResponse;
import com.track.resolution.rules.MixLabelParser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field clean-up shared by all extraction strategies: whitespace collapse and
 * isolation of the mix designation from the title.
 */
final class CandidateFields {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CandidateFields() {
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = WHITESPACE.matcher(value.replace('\u00a0', ' ')).replaceAll(" ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    static List<String> cleanAll(List<String> values) {
        List<String> cleaned = new ArrayList<>();
        for (String value : values) {
            String c = clean(value);
            if (c != null && !cleaned.contains(c)) {
                cleaned.add(c);
            }
        }
        return cleaned;
    }

    /**
     * Starts a builder carrying the originating query rank and strategy of the response.
     */
    static Candidate.Builder from(RawResponse response) {
        return Candidate.builder()
                .queryRank(response.query().rank())
                .strategy(response.strategy());
    }

    /**
     * Sets title and mix label. When the listing gives no separate mix field the
     * mix designation is parsed out of the title.
     */
    static Candidate.Builder titled(Candidate.Builder builder, String rawTitle, String rawMix) {
        String title = clean(rawTitle);
        String mix = clean(rawMix);
        if (title == null) {
            return builder.title("");
        }
        MixLabelParser.ParsedTitle parsed = MixLabelParser.parse(title);
        if (mix == null) {
            mix = parsed.mixLabel();
        }
        String bare = parsed.title().isEmpty() ? title : parsed.title();
        return builder.title(bare).mixLabel(mix);
    }

    static boolean isUsable(String catalogId, String title) {
        return catalogId != null && !catalogId.isBlank() && clean(title) != null;
    }

    static Integer parseBpm(String value) {
        String cleaned = clean(value);
        if (cleaned == null) {
            return null;
        }
        String digits = cleaned.replaceAll("[^0-9.]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return (int) Math.round(Double.parseDouble(digits));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
