package com.track.resolution.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A track flagged for manual review. Created when no candidate is accepted but at
 * least one guard-passing candidate scores at or above the review floor.
 */
public class ReviewItem {

    private final String id;
    private final String runId;
    private final String trackId;
    private final String sourceTitle;
    private final List<String> candidateIds;
    private final double bestScore;
    private final List<String> reasons;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String selectedCandidateId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.runId = builder.runId;
        this.trackId = Objects.requireNonNull(builder.trackId, "trackId is required");
        this.sourceTitle = builder.sourceTitle;
        this.candidateIds = builder.candidateIds != null ? List.copyOf(builder.candidateIds) : List.of();
        this.bestScore = builder.bestScore;
        this.reasons = builder.reasons != null ? List.copyOf(builder.reasons) : List.of();
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getRunId() {
        return runId;
    }

    public String getTrackId() {
        return trackId;
    }

    public String getSourceTitle() {
        return sourceTitle;
    }

    /**
     * Catalog ids of the retained candidates, best first.
     */
    public List<String> getCandidateIds() {
        return candidateIds;
    }

    public double getBestScore() {
        return bestScore;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    /**
     * The candidate confirmed by the reviewer, or null.
     */
    public String getSelectedCandidateId() {
        return selectedCandidateId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    public boolean isApproved() {
        return status == ReviewStatus.APPROVED;
    }

    public boolean isRejected() {
        return status == ReviewStatus.REJECTED;
    }

    void markApproved(String reviewerId, String candidateId, String notes) {
        this.status = ReviewStatus.APPROVED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.selectedCandidateId = candidateId;
        this.notes = notes;
    }

    void markRejected(String reviewerId, String notes) {
        this.status = ReviewStatus.REJECTED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", trackId='" + trackId + '\'' +
                ", candidates=" + candidateIds +
                ", bestScore=" + bestScore +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String runId;
        private String trackId;
        private String sourceTitle;
        private List<String> candidateIds;
        private double bestScore;
        private List<String> reasons;
        private ReviewStatus status;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder trackId(String trackId) {
            this.trackId = trackId;
            return this;
        }

        public Builder sourceTitle(String sourceTitle) {
            this.sourceTitle = sourceTitle;
            return this;
        }

        public Builder candidateIds(List<String> candidateIds) {
            this.candidateIds = candidateIds;
            return this;
        }

        public Builder bestScore(double bestScore) {
            this.bestScore = bestScore;
            return this;
        }

        public Builder reasons(List<String> reasons) {
            this.reasons = reasons;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
