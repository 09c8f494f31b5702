package com.track.resolution.review;

import java.util.List;

/**
 * Queue of tracks awaiting manual inspection.
 */
public interface ReviewQueue {

    /**
     * Submits a review item to the queue.
     *
     * @param item the review item to submit
     * @return the submitted item
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    List<ReviewItem> getPending();

    /**
     * Pending items whose best candidate scores within the range, best first.
     *
     * @param minScore minimum score (inclusive)
     * @param maxScore maximum score (inclusive)
     */
    List<ReviewItem> getPendingByScoreRange(double minScore, double maxScore);

    /**
     * Confirms one of the retained candidates as the match.
     *
     * @param reviewId    the review item ID
     * @param reviewerId  the reviewer's identifier
     * @param candidateId catalog id of the confirmed candidate; must be one of the retained ones
     * @param notes       optional notes about the decision
     */
    void approve(String reviewId, String reviewerId, String candidateId, String notes);

    /**
     * Rejects all retained candidates.
     *
     * @param reviewId   the review item ID
     * @param reviewerId the reviewer's identifier
     * @param notes      optional notes about the decision
     */
    void reject(String reviewId, String reviewerId, String notes);

    /**
     * Gets a review item by ID, or null if not found.
     */
    ReviewItem get(String reviewId);

    long countPending();
}
