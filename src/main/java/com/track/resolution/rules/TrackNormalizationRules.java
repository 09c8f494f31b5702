package com.track.resolution.rules;

import java.util.List;

/**
 * Built-in rules for track titles, artist names, mix labels and search text.
 */
public final class TrackNormalizationRules {

    private TrackNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getTitleRules());
        engine.addRules(getMixLabelRules());
        engine.addRules(getQueryRules());
        return engine;
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("dash-variants")
                        .pattern("[\\u2010-\\u2015\\u2212]")
                        .replacement("-")
                        .priority(1)
                        .build(),

                NormalizationRule.builder()
                        .name("typographic-quotes")
                        .pattern("[\\u2018\\u2019\\u201A\\u201B]")
                        .replacement("'")
                        .priority(1)
                        .build(),

                NormalizationRule.builder()
                        .name("urls")
                        .pattern("https?://\\S+")
                        .replacement(" ")
                        .priority(5)
                        .build(),

                // Everything that is not a letter, digit or space becomes a separator.
                // Apostrophes are dropped so "don't" compares as "dont".
                NormalizationRule.builder()
                        .name("apostrophes")
                        .pattern("'")
                        .replacement("")
                        .fields(TextField.TITLE, TextField.ARTIST, TextField.MIX_LABEL)
                        .priority(80)
                        .build(),

                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .fields(TextField.TITLE, TextField.ARTIST, TextField.MIX_LABEL)
                        .priority(90)
                        .build()
        );
    }

    public static List<NormalizationRule> getTitleRules() {
        return List.of(
                // [2-3] or "01. " style prefixes from DJ software exports
                NormalizationRule.builder()
                        .name("track-number-prefix")
                        .pattern("^\\s*(\\[\\d+(?:-\\d+)?\\]|\\d{1,3}[.)]\\s)\\s*")
                        .replacement("")
                        .fields(TextField.TITLE, TextField.QUERY)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("featuring-group")
                        .pattern("[(\\[]\\s*(feat\\.?|ft\\.?|featuring)\\s[^)\\]]*[)\\]]")
                        .replacement(" ")
                        .fields(TextField.TITLE)
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("featuring-suffix")
                        .pattern("\\s(feat\\.?|ft\\.?|featuring)\\s.*$")
                        .replacement("")
                        .fields(TextField.TITLE)
                        .priority(21)
                        .build(),

                NormalizationRule.builder()
                        .name("bracketed-qualifier")
                        .pattern("[(\\[{][^)\\]}]*[)\\]}]")
                        .replacement(" ")
                        .fields(TextField.TITLE)
                        .priority(30)
                        .build(),

                // "Title - Keinemusik Remix"
                NormalizationRule.builder()
                        .name("dash-mix-suffix")
                        .pattern("\\s-\\s[^-]*\\b(mix|remix|rmx|edit|dub|rework|version|vip|bootleg)\\s*$")
                        .replacement("")
                        .fields(TextField.TITLE)
                        .priority(31)
                        .build()
        );
    }

    public static List<NormalizationRule> getMixLabelRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("mix-label-rmx")
                        .pattern("\\brmx\\b")
                        .replacement("remix")
                        .fields(TextField.MIX_LABEL)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("mix-label-re-prefix")
                        .pattern("\\bre[-\\s](work|fire|edit|mix)\\b")
                        .replacement("re$1")
                        .fields(TextField.MIX_LABEL)
                        .priority(11)
                        .build(),

                NormalizationRule.builder()
                        .name("mix-label-brackets")
                        .pattern("[()\\[\\]]")
                        .replacement(" ")
                        .fields(TextField.MIX_LABEL)
                        .priority(12)
                        .build()
        );
    }

    public static List<NormalizationRule> getQueryRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("query-quotes")
                        .pattern("[\"\\u201C\\u201D]")
                        .replacement("")
                        .fields(TextField.QUERY)
                        .priority(5)
                        .build()
        );
    }
}
