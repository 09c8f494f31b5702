package com.track.resolution.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A catalog listing extracted from a raw response.
 * Text fields are whitespace-collapsed; the mix designation lives in {@code mixLabel},
 * never inside {@code title}.
 */
public record Candidate(
        String catalogId,
        String title,
        String mixLabel,
        List<String> artists,
        List<String> remixers,
        String recordLabel,
        String releaseDate,
        Integer bpm,
        String musicalKey,
        String genre,
        String releaseName,
        String sourceUrl,
        int queryRank,
        StrategyType strategy
) {
    public Candidate {
        Objects.requireNonNull(catalogId, "catalogId is required");
        Objects.requireNonNull(title, "title is required");
        artists = artists != null ? List.copyOf(artists) : List.of();
        remixers = remixers != null ? List.copyOf(remixers) : List.of();
        mixLabel = mixLabel == null || mixLabel.isBlank() ? null : mixLabel;
    }

    public boolean hasMixLabel() {
        return mixLabel != null;
    }

    /**
     * Artists and remixers combined, artists first, without duplicates.
     */
    public List<String> creditedArtists() {
        if (remixers.isEmpty()) {
            return artists;
        }
        return Stream.concat(artists.stream(), remixers.stream())
                .distinct()
                .toList();
    }

    public String displayTitle() {
        return mixLabel == null ? title : title + " (" + mixLabel + ")";
    }

    public Builder toBuilder() {
        return new Builder()
                .catalogId(catalogId)
                .title(title)
                .mixLabel(mixLabel)
                .artists(artists)
                .remixers(remixers)
                .recordLabel(recordLabel)
                .releaseDate(releaseDate)
                .bpm(bpm)
                .musicalKey(musicalKey)
                .genre(genre)
                .releaseName(releaseName)
                .sourceUrl(sourceUrl)
                .queryRank(queryRank)
                .strategy(strategy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String catalogId;
        private String title;
        private String mixLabel;
        private List<String> artists;
        private List<String> remixers;
        private String recordLabel;
        private String releaseDate;
        private Integer bpm;
        private String musicalKey;
        private String genre;
        private String releaseName;
        private String sourceUrl;
        private int queryRank;
        private StrategyType strategy = StrategyType.DIRECT_SEARCH;

        public Builder catalogId(String catalogId) {
            this.catalogId = catalogId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder mixLabel(String mixLabel) {
            this.mixLabel = mixLabel;
            return this;
        }

        public Builder artists(List<String> artists) {
            this.artists = artists;
            return this;
        }

        public Builder remixers(List<String> remixers) {
            this.remixers = remixers;
            return this;
        }

        public Builder recordLabel(String recordLabel) {
            this.recordLabel = recordLabel;
            return this;
        }

        public Builder releaseDate(String releaseDate) {
            this.releaseDate = releaseDate;
            return this;
        }

        public Builder bpm(Integer bpm) {
            this.bpm = bpm;
            return this;
        }

        public Builder musicalKey(String musicalKey) {
            this.musicalKey = musicalKey;
            return this;
        }

        public Builder genre(String genre) {
            this.genre = genre;
            return this;
        }

        public Builder releaseName(String releaseName) {
            this.releaseName = releaseName;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder queryRank(int queryRank) {
            this.queryRank = queryRank;
            return this;
        }

        public Builder strategy(StrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Candidate build() {
            return new Candidate(catalogId, title, mixLabel, artists, remixers, recordLabel,
                    releaseDate, bpm, musicalKey, genre, releaseName, sourceUrl, queryRank, strategy);
        }
    }
}
