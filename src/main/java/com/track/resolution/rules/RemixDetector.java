package com.track.resolution.rules;

import com.track.resolution.core.model.SourceTrack;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a mix label designates a remix.
 *
 * <p>A label is <em>significant</em> when it is non-blank and not one of the neutral
 * catalog designations ("Original Mix", "Extended Mix", "Radio Edit", ...), which the
 * catalog attaches to nearly every release. A track is remix-flagged when its significant
 * label matches the remix pattern.</p>
 */
public class RemixDetector {

    public static final String DEFAULT_REMIX_PATTERN =
            "\\b(remix|rmx|re-?work|re-?fire|re-?edit|edit|bootleg|flip|vip|dub|mix|version|remake)\\b";
    public static final String DEFAULT_NEUTRAL_PATTERN =
            "^\\s*(original|extended|main|club|radio|album)?\\s*(mix|edit|version)?\\s*$";

    private final Pattern remixPattern;
    private final Pattern neutralPattern;

    public RemixDetector() {
        this(DEFAULT_REMIX_PATTERN, DEFAULT_NEUTRAL_PATTERN);
    }

    public RemixDetector(String remixPattern, String neutralPattern) {
        this.remixPattern = Pattern.compile(Objects.requireNonNull(remixPattern, "remixPattern is required"),
                Pattern.CASE_INSENSITIVE);
        this.neutralPattern = Pattern.compile(Objects.requireNonNull(neutralPattern, "neutralPattern is required"),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns the label when it carries identity, empty for blank or neutral labels.
     */
    public Optional<String> significantLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        if (neutralPattern.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }

    public boolean isRemixLabel(String label) {
        return significantLabel(label)
                .map(l -> remixPattern.matcher(l).find())
                .orElse(false);
    }

    public boolean isRemix(SourceTrack track) {
        return isRemixLabel(track.remixLabel());
    }

    public String getRemixPattern() {
        return remixPattern.pattern();
    }

    public String getNeutralPattern() {
        return neutralPattern.pattern();
    }
}
