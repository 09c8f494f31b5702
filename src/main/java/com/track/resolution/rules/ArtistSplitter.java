package com.track.resolution.rules;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits combined artist credits such as "A, B & C feat. D" into individual names.
 */
public final class ArtistSplitter {

    private static final Pattern SEPARATORS = Pattern.compile(
            "\\s*(?:,|;|&|/|\\s+x\\s+|\\s+vs\\.?\\s+|\\s+with\\s+|\\s+feat\\.?\\s+|\\s+ft\\.?\\s+|\\s+featuring\\s+)\\s*",
            Pattern.CASE_INSENSITIVE);

    private ArtistSplitter() {
        // Utility class
    }

    public static List<String> split(String credits) {
        if (credits == null || credits.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SEPARATORS.split(credits.trim()))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
