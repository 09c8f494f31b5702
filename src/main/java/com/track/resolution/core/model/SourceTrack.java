package com.track.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a locally-known track to be resolved against the catalog.
 *
 * @param id          stable identity supplied by the input collaborator (e.g. playlist row)
 * @param title       track title without the mix designation
 * @param artists     ordered, non-empty artist list; the first entry is the primary artist
 * @param remixLabel  optional mix/remix designation such as "Keinemusik Remix", may be null
 * @param releaseYear optional release-year hint, may be null
 */
public record SourceTrack(
        String id,
        String title,
        List<String> artists,
        String remixLabel,
        Integer releaseYear
) {
    public SourceTrack {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(artists, "artists is required");
        if (title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        artists = artists.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(a -> !a.isEmpty())
                .toList();
        if (artists.isEmpty()) {
            throw new IllegalArgumentException("at least one artist is required");
        }
        title = title.trim();
        remixLabel = remixLabel == null || remixLabel.isBlank() ? null : remixLabel.trim();
    }

    public static SourceTrack of(String id, String title, List<String> artists) {
        return new SourceTrack(id, title, artists, null, null);
    }

    public static SourceTrack of(String id, String title, List<String> artists, String remixLabel) {
        return new SourceTrack(id, title, artists, remixLabel, null);
    }

    public String primaryArtist() {
        return artists.get(0);
    }

    public boolean hasRemixLabel() {
        return remixLabel != null;
    }

    /**
     * Title with the mix designation appended in catalog style, e.g. "Title (Keinemusik Remix)".
     */
    public String displayTitle() {
        return remixLabel == null ? title : title + " (" + remixLabel + ")";
    }
}
