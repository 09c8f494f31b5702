package com.track.resolution.audit;

import com.track.resolution.core.model.ScoredCandidate;
import com.track.resolution.core.model.Disposition;
import com.track.resolution.core.model.SourceTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only record of a resolution run: four typed streams (queries, candidates,
 * dispositions, reviews) plus a generic event log.
 * Thread-safe; shared by all workers of a run.
 */
public class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final List<QueryRecord> queries = new CopyOnWriteArrayList<>();
    private final List<CandidateRecord> candidates = new CopyOnWriteArrayList<>();
    private final List<DispositionRecord> dispositions = new CopyOnWriteArrayList<>();
    private final List<ReviewRecord> reviews = new CopyOnWriteArrayList<>();
    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final Set<String> disposed = ConcurrentHashMap.newKeySet();

    public void recordQuery(QueryRecord record) {
        queries.add(record);
    }

    public void recordCandidate(CandidateRecord record) {
        candidates.add(record);
    }

    /**
     * Records the final disposition of a track. A track has exactly one disposition per run.
     *
     * @throws IllegalStateException if the track already has a disposition in this run
     */
    public DispositionRecord recordDisposition(String runId, Disposition disposition, Duration elapsed) {
        if (!disposed.add(runId + "/" + disposition.trackId())) {
            throw new IllegalStateException("Disposition already recorded for track " + disposition.trackId()
                    + " in run " + runId);
        }
        DispositionRecord record = DispositionRecord.of(runId, disposition, elapsed);
        dispositions.add(record);
        record(AuditAction.DISPOSITION_RECORDED, runId, disposition.trackId(),
                Map.of("type", disposition.type().name()));
        return record;
    }

    public ReviewRecord recordReview(String runId, SourceTrack track, Disposition disposition) {
        List<String> retained = disposition.reviewCandidates().stream()
                .map(AuditTrail::describe)
                .toList();
        ReviewRecord record = new ReviewRecord(runId, track.id(), track.displayTitle(), retained,
                disposition.reasons());
        reviews.add(record);
        return record;
    }

    public AuditEntry record(AuditAction action, String runId, String trackId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .runId(runId)
                .trackId(trackId)
                .details(details)
                .build();
        entries.add(entry);
        log.debug("Audit entry recorded: {} for track {} in run {}", action, trackId, runId);
        return entry;
    }

    public List<QueryRecord> queries() {
        return Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public List<CandidateRecord> candidates() {
        return Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    public List<DispositionRecord> dispositions() {
        return Collections.unmodifiableList(new ArrayList<>(dispositions));
    }

    public List<ReviewRecord> reviews() {
        return Collections.unmodifiableList(new ArrayList<>(reviews));
    }

    public List<AuditEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public List<QueryRecord> queriesForTrack(String trackId) {
        return queries.stream()
                .filter(q -> trackId.equals(q.trackId()))
                .collect(Collectors.toList());
    }

    public List<CandidateRecord> candidatesForTrack(String trackId) {
        return candidates.stream()
                .filter(c -> trackId.equals(c.trackId()))
                .collect(Collectors.toList());
    }

    private static String describe(ScoredCandidate scored) {
        return scored.candidate().catalogId() + " " + scored.score() + " " + scored.candidate().displayTitle();
    }
}
