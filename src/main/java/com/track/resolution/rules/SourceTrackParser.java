package com.track.resolution.rules;

import com.track.resolution.core.model.SourceTrack;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link SourceTrack}s from raw playlist fields, where the mix designation is
 * usually embedded in the title and artists are one combined credit string.
 */
public final class SourceTrackParser {

    private SourceTrackParser() {
        // Utility class
    }

    public static SourceTrack parse(String id, String rawTitle, String rawArtists) {
        return parse(id, rawTitle, rawArtists, null);
    }

    public static SourceTrack parse(String id, String rawTitle, String rawArtists, Integer releaseYear) {
        MixLabelParser.ParsedTitle parsed = MixLabelParser.parse(rawTitle);
        List<String> artists = new ArrayList<>(ArtistSplitter.split(rawArtists));
        for (String featured : parsed.featuredArtists()) {
            if (artists.stream().noneMatch(a -> a.equalsIgnoreCase(featured))) {
                artists.add(featured);
            }
        }
        String title = parsed.title().isBlank() ? rawTitle : parsed.title();
        return new SourceTrack(id, title, artists, parsed.mixLabel(), releaseYear);
    }
}
