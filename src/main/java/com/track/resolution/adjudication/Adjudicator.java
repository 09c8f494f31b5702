package com.track.resolution.adjudication;

import com.track.resolution.audit.AuditAction;
import com.track.resolution.audit.AuditTrail;
import com.track.resolution.audit.CandidateRecord;
import com.track.resolution.audit.QueryRecord;
import com.track.resolution.core.model.Candidate;
import com.track.resolution.core.model.Disposition;
import com.track.resolution.core.model.Query;
import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.SourceTrack;
import com.track.resolution.core.model.StrategyType;
import com.track.resolution.extract.CandidateExtractor;
import com.track.resolution.extract.ExtractionOutcome;
import com.track.resolution.guard.GuardChain;
import com.track.resolution.guard.GuardResult;
import com.track.resolution.guard.GuardThresholds;
import com.track.resolution.metrics.MetricsService;
import com.track.resolution.metrics.NoOpMetricsService;
import com.track.resolution.query.QueryPlanner;
import com.track.resolution.review.ReviewItem;
import com.track.resolution.review.ReviewQueue;
import com.track.resolution.scoring.TrackScorer;
import com.track.resolution.tracing.NoOpTracingService;
import com.track.resolution.tracing.Span;
import com.track.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Resolves one source track to a single disposition.
 *
 * <p>For each planned query rank, retrieval starts with direct catalog search.
 * A remix track escalates to the next strategy while the rank has fewer than
 * {@code escalationCandidateThreshold} candidates; any other track escalates only
 * when the previous strategy produced nothing. Candidates are deduplicated by
 * catalog id across the whole track, scored, and passed through the guard chain.
 * The search stops early at the first accepted candidate scoring at or above the
 * high-confidence score.</p>
 *
 * <p>Thread-safe: all per-track state lives in a {@code TrackAdjudication} created
 * per call.</p>
 */
public class Adjudicator {
    private static final Logger log = LoggerFactory.getLogger(Adjudicator.class);

    static final List<StrategyType> ESCALATION_ORDER = List.of(
            StrategyType.DIRECT_SEARCH, StrategyType.ENGINE_FALLBACK, StrategyType.BROWSER_AUTOMATION);

    private final QueryPlanner planner;
    private final RetrievalCoordinator coordinator;
    private final CandidateExtractor extractor;
    private final TrackScorer scorer;
    private final GuardChain guards;
    private final double minAcceptScore;
    private final double reviewFloor;
    private final double highConfidenceScore;
    private final int escalationCandidateThreshold;
    private final AuditTrail auditTrail;
    private final ReviewQueue reviewQueue;
    private final MetricsService metrics;
    private final TracingService tracing;

    private Adjudicator(Builder builder) {
        this.planner = builder.planner;
        this.coordinator = builder.coordinator;
        this.extractor = builder.extractor;
        this.scorer = builder.scorer;
        this.guards = builder.guards != null
                ? builder.guards
                : GuardChain.standard(GuardThresholds.defaults(), builder.scorer);
        this.minAcceptScore = builder.minAcceptScore;
        this.reviewFloor = builder.reviewFloor;
        this.highConfidenceScore = builder.highConfidenceScore;
        this.escalationCandidateThreshold = builder.escalationCandidateThreshold;
        this.auditTrail = builder.auditTrail;
        this.reviewQueue = builder.reviewQueue;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
    }

    /**
     * Adjudicates a track and records its disposition in the audit trail.
     * Never throws for per-track failures; cancellation yields an unmatched
     * disposition with reason {@value Disposition#CANCELLED}.
     */
    public Disposition adjudicate(String runId, SourceTrack track, CancellationToken token) {
        long start = System.nanoTime();
        Disposition disposition;
        try (Span span = tracing.startSpan(TracingService.ADJUDICATE_SPAN, Map.of("track.id", track.id()))) {
            try {
                disposition = new TrackAdjudication(runId, track, token, span).run();
            } catch (CancellationException e) {
                log.debug("Adjudication of track {} cancelled", track.id());
                disposition = Disposition.unmatched(track.id(), Disposition.CANCELLED);
            } catch (RuntimeException e) {
                log.error("Adjudication of track {} failed", track.id(), e);
                span.recordException(e);
                disposition = Disposition.unmatched(track.id(), "error: " + e.getMessage());
            }
            span.setAttribute("disposition", disposition.type().name());
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        record(runId, track, disposition, elapsed);
        return disposition;
    }

    public Disposition adjudicate(String runId, SourceTrack track) {
        return adjudicate(runId, track, CancellationToken.none());
    }

    private void record(String runId, SourceTrack track, Disposition disposition, Duration elapsed) {
        auditTrail.recordDisposition(runId, disposition, elapsed);
        metrics.recordResolutionDuration(disposition.type(), elapsed);

        if (disposition.isFlaggedForReview()) {
            auditTrail.recordReview(runId, track, disposition);
            if (reviewQueue != null) {
                reviewQueue.submit(ReviewItem.builder()
                        .runId(runId)
                        .trackId(track.id())
                        .sourceTitle(track.displayTitle())
                        .candidateIds(disposition.reviewCandidates().stream()
                                .map(c -> c.candidate().catalogId())
                                .toList())
                        .bestScore(disposition.reviewCandidates().get(0).score())
                        .reasons(disposition.reasons())
                        .build());
            }
        }

        if (disposition.isMatched()) {
            ScoredCandidate match = disposition.match();
            log.info("track.disposed track={} type={} catalogId={} score={} elapsedMs={}", track.id(),
                    disposition.type(), match.candidate().catalogId(), match.score(), elapsed.toMillis());
        } else {
            log.info("track.disposed track={} type={} reason='{}' elapsedMs={}", track.id(),
                    disposition.type(), disposition.reason(), elapsed.toMillis());
        }
    }

    public double getMinAcceptScore() {
        return minAcceptScore;
    }

    public double getReviewFloor() {
        return reviewFloor;
    }

    public double getHighConfidenceScore() {
        return highConfidenceScore;
    }

    /**
     * Mutable state of one adjudication.
     */
    private final class TrackAdjudication {
        private final String runId;
        private final SourceTrack track;
        private final CancellationToken token;
        private final Span span;
        private final boolean remix;

        private final Map<String, CandidateVerdict> verdicts = new LinkedHashMap<>();
        private List<Query> plan = List.of();
        private int nextRank;
        private Query currentQuery;
        private int nextStrategy;
        private int strategiesTried;
        private RetrievalAttempt lastAttempt;
        private final Map<String, Candidate> rankCandidates = new LinkedHashMap<>();
        private boolean earlyExit;
        private AdjudicationState state = AdjudicationState.PLANNING;

        TrackAdjudication(String runId, SourceTrack track, CancellationToken token, Span span) {
            this.runId = runId;
            this.track = track;
            this.token = token;
            this.span = span;
            this.remix = scorer.getRemixDetector().isRemix(track);
        }

        Disposition run() {
            plan = planner.plan(track);
            log.debug("Planned {} queries for track {} (remix={})", plan.size(), track.id(), remix);

            Disposition disposition = null;
            while (disposition == null) {
                token.throwIfCancelled();
                switch (state) {
                    case PLANNING -> planNextRank();
                    case RETRIEVING -> retrieve();
                    case EXTRACTING -> extract();
                    case SCORING -> score();
                    case DECIDING -> disposition = decide();
                    default -> throw new IllegalStateException("Unexpected state " + state);
                }
            }
            return disposition;
        }

        private void transition(AdjudicationState next) {
            log.trace("Track {}: {} -> {}", track.id(), state, next);
            state = next;
        }

        private void planNextRank() {
            if (nextRank >= plan.size()) {
                transition(AdjudicationState.DECIDING);
                return;
            }
            currentQuery = plan.get(nextRank++);
            nextStrategy = 0;
            strategiesTried = 0;
            rankCandidates.clear();
            transition(AdjudicationState.RETRIEVING);
        }

        private void retrieve() {
            StrategyType type = nextUsableStrategy();
            if (type == null) {
                transition(AdjudicationState.SCORING);
                return;
            }
            Query query = currentQuery.withStrategy(type);
            if (strategiesTried > 0) {
                log.debug("Escalating rank {} of track {} to {} ({} candidates so far)",
                        query.rank(), track.id(), type.tag(), rankCandidates.size());
                metrics.incrementEscalation(type);
                span.addEvent("escalated:" + type.tag());
                auditTrail.record(AuditAction.ESCALATED, runId, track.id(), Map.of(
                        "strategy", type.tag(), "rank", query.rank(), "candidates", rankCandidates.size()));
            }
            strategiesTried++;

            auditTrail.record(AuditAction.QUERY_ISSUED, runId, track.id(), Map.of(
                    "query", query.text(), "strategy", type.tag(), "rank", query.rank()));
            lastAttempt = coordinator.retrieve(query, token);
            for (String failure : lastAttempt.failures()) {
                auditTrail.record(AuditAction.RETRIEVAL_FAILED, runId, track.id(), Map.of(
                        "query", query.text(), "strategy", type.tag(),
                        "reason", failure != null ? failure : "unknown"));
            }
            transition(AdjudicationState.EXTRACTING);
        }

        private StrategyType nextUsableStrategy() {
            while (nextStrategy < ESCALATION_ORDER.size()) {
                StrategyType type = ESCALATION_ORDER.get(nextStrategy++);
                if (coordinator.isUsable(type)) {
                    return type;
                }
                log.trace("Skipping unusable {} strategy for track {}", type.tag(), track.id());
            }
            return null;
        }

        private void extract() {
            ExtractionOutcome outcome = extractor.extractWithOutcome(lastAttempt.response());
            if (outcome.failed()) {
                auditTrail.record(AuditAction.EXTRACTION_FAILED, runId, track.id(), Map.of(
                        "query", lastAttempt.response().query().text(),
                        "strategy", lastAttempt.response().strategy().tag(),
                        "reasons", String.join("; ", outcome.failures())));
            }
            for (Candidate candidate : outcome.candidates()) {
                rankCandidates.putIfAbsent(candidate.catalogId(), candidate);
            }
            auditTrail.recordQuery(QueryRecord.of(runId, track.id(), lastAttempt.response(),
                    outcome.candidates().size()));

            if (needsEscalation() && nextStrategy < ESCALATION_ORDER.size()) {
                transition(AdjudicationState.RETRIEVING);
            } else {
                transition(AdjudicationState.SCORING);
            }
        }

        private boolean needsEscalation() {
            if (remix) {
                return rankCandidates.size() < escalationCandidateThreshold;
            }
            return rankCandidates.isEmpty();
        }

        private void score() {
            for (Candidate candidate : rankCandidates.values()) {
                if (verdicts.containsKey(candidate.catalogId())) {
                    continue;
                }
                ScoredCandidate scored = scorer.score(track, candidate);
                GuardResult guard = guards.evaluate(track, scored);
                boolean accepted = guard.passed() && scored.score() >= minAcceptScore;
                CandidateVerdict verdict = new CandidateVerdict(scored, guard, accepted, verdicts.size());
                verdicts.put(candidate.catalogId(), verdict);

                metrics.recordCandidateScore(scored.score());
                auditTrail.recordCandidate(CandidateRecord.of(runId, track.id(), scored, guard, accepted));
                if (guard.vetoed()) {
                    metrics.incrementGuardVeto(guard.guardName());
                    auditTrail.record(AuditAction.CANDIDATE_VETOED, runId, track.id(), Map.of(
                            "catalogId", candidate.catalogId(), "guard", guard.guardName(),
                            "reason", guard.reason()));
                }
                if (accepted && scored.score() >= highConfidenceScore) {
                    log.debug("High-confidence candidate {} ({}) for track {}, stopping search",
                            candidate.catalogId(), scored.score(), track.id());
                    earlyExit = true;
                }
            }
            transition(earlyExit ? AdjudicationState.DECIDING : AdjudicationState.PLANNING);
        }

        private Disposition decide() {
            List<CandidateVerdict> accepted = verdicts.values().stream()
                    .filter(CandidateVerdict::accepted)
                    .sorted(CandidateVerdict.BEST_FIRST)
                    .toList();
            if (!accepted.isEmpty()) {
                transition(AdjudicationState.MATCHED);
                return Disposition.matched(track.id(), accepted.get(0).scored());
            }

            List<CandidateVerdict> reviewable = verdicts.values().stream()
                    .filter(v -> v.guard().passed() && v.score() >= reviewFloor)
                    .sorted(CandidateVerdict.BEST_FIRST)
                    .toList();
            if (!reviewable.isEmpty()) {
                transition(AdjudicationState.FLAGGED_FOR_REVIEW);
                return Disposition.flaggedForReview(track.id(),
                        reviewable.stream().map(CandidateVerdict::scored).toList(),
                        reviewReasons(reviewable));
            }

            transition(AdjudicationState.UNMATCHED);
            if (verdicts.isEmpty()) {
                return Disposition.unmatched(track.id(), Disposition.NO_RESULTS);
            }
            boolean allVetoed = verdicts.values().stream().allMatch(v -> v.guard().vetoed());
            return Disposition.unmatched(track.id(),
                    allVetoed ? Disposition.ALL_VETOED : Disposition.BELOW_REVIEW_FLOOR);
        }

        private List<String> reviewReasons(List<CandidateVerdict> reviewable) {
            Set<String> reasons = new LinkedHashSet<>();
            for (CandidateVerdict v : reviewable) {
                reasons.add(String.format("%s scored %.2f, below accept threshold %.2f",
                        v.catalogId(), v.score(), minAcceptScore));
            }
            for (CandidateVerdict v : verdicts.values()) {
                if (v.guard().vetoed()) {
                    reasons.add(v.catalogId() + " vetoed by " + v.guard().describe());
                }
            }
            return new ArrayList<>(reasons);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private QueryPlanner planner = new QueryPlanner();
        private RetrievalCoordinator coordinator;
        private CandidateExtractor extractor = new CandidateExtractor();
        private TrackScorer scorer = new TrackScorer();
        private GuardChain guards;
        private double minAcceptScore = 72.0;
        private double reviewFloor = 50.0;
        private double highConfidenceScore = 85.0;
        private int escalationCandidateThreshold = 5;
        private AuditTrail auditTrail = new AuditTrail();
        private ReviewQueue reviewQueue;
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();

        public Builder planner(QueryPlanner planner) {
            this.planner = planner;
            return this;
        }

        public Builder coordinator(RetrievalCoordinator coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        public Builder extractor(CandidateExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder scorer(TrackScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        /**
         * Guard chain; defaults to the standard chain over the configured scorer.
         */
        public Builder guards(GuardChain guards) {
            this.guards = guards;
            return this;
        }

        public Builder minAcceptScore(double minAcceptScore) {
            this.minAcceptScore = minAcceptScore;
            return this;
        }

        public Builder reviewFloor(double reviewFloor) {
            this.reviewFloor = reviewFloor;
            return this;
        }

        public Builder highConfidenceScore(double highConfidenceScore) {
            this.highConfidenceScore = highConfidenceScore;
            return this;
        }

        public Builder escalationCandidateThreshold(int escalationCandidateThreshold) {
            this.escalationCandidateThreshold = escalationCandidateThreshold;
            return this;
        }

        public Builder auditTrail(AuditTrail auditTrail) {
            this.auditTrail = auditTrail;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Adjudicator build() {
            Objects.requireNonNull(coordinator, "coordinator is required");
            Objects.requireNonNull(planner, "planner is required");
            Objects.requireNonNull(extractor, "extractor is required");
            Objects.requireNonNull(scorer, "scorer is required");
            Objects.requireNonNull(auditTrail, "auditTrail is required");
            if (reviewFloor > minAcceptScore || minAcceptScore > highConfidenceScore) {
                throw new IllegalStateException("Thresholds must satisfy reviewFloor <= minAcceptScore <= highConfidenceScore");
            }
            return new Adjudicator(this);
        }
    }
}
