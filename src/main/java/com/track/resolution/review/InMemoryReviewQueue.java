package com.track.resolution.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("Submitted review item {} (track={}, candidates={}, bestScore={})",
                item.getId(), item.getTrackId(), item.getCandidateIds().size(), item.getBestScore());
        return item;
    }

    @Override
    public List<ReviewItem> getPending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public List<ReviewItem> getPendingByScoreRange(double minScore, double maxScore) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getBestScore() >= minScore && item.getBestScore() <= maxScore)
                .sorted(Comparator.comparingDouble(ReviewItem::getBestScore).reversed())
                .toList();
    }

    @Override
    public void approve(String reviewId, String reviewerId, String candidateId, String notes) {
        ReviewItem item = pendingItem(reviewId);
        if (!item.getCandidateIds().contains(candidateId)) {
            throw new IllegalArgumentException("Candidate " + candidateId + " was not retained for review " + reviewId);
        }
        item.markApproved(reviewerId, candidateId, notes);
        log.info("Review item {} approved by {} with candidate {}", reviewId, reviewerId, candidateId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        pendingItem(reviewId).markRejected(reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
