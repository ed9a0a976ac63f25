package com.flagship.reconciliation.run;

import com.flagship.reconciliation.record.RecordFamily;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the unresolved queue. One row per (family, record id); a record that
 * stays unresolved across runs keeps its row and its first-seen timestamp.
 */
@Entity
@Table(name = "unresolved_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UnresolvedItemEntity {

    private static final int MAX_SUMMARY = 2000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_family", nullable = false, updatable = false)
    private RecordFamily recordFamily;

    @Column(name = "record_id", nullable = false, updatable = false)
    private Long recordId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReportOutcome outcome;

    @Column(name = "candidate_summary", length = MAX_SUMMARY)
    private String candidateSummary;

    @Column(name = "last_run_id")
    private UUID lastRunId;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @PrePersist
    void onCreate() {
        this.firstSeenAt = Instant.now();
        this.lastSeenAt = this.firstSeenAt;
    }

    static UnresolvedItemEntity open(RecordFamily family, long recordId, ReportOutcome outcome,
                                     String candidateSummary, UUID runId) {
        return new UnresolvedItemEntity(
            UUID.randomUUID(),
            family,
            recordId,
            outcome,
            clip(candidateSummary),
            runId,
            null, // firstSeenAt - set by @PrePersist
            null, // lastSeenAt - set by @PrePersist
            false,
            null
        );
    }

    /**
     * Seen again as unresolved by a later run; reopens the item if it had been resolved.
     */
    void seenAgain(ReportOutcome outcome, String candidateSummary, UUID runId) {
        this.outcome = outcome;
        this.candidateSummary = clip(candidateSummary);
        this.lastRunId = runId;
        this.lastSeenAt = Instant.now();
        this.resolved = false;
        this.resolvedAt = null;
    }

    void resolve(UUID runId) {
        if (resolved) {
            return;
        }
        this.resolved = true;
        this.resolvedAt = Instant.now();
        this.lastRunId = runId;
    }

    public UnresolvedItem toDomain() {
        return new UnresolvedItem(id, recordFamily, recordId, outcome, candidateSummary, lastRunId,
            firstSeenAt, lastSeenAt, resolved, resolvedAt);
    }

    private static String clip(String value) {
        if (value == null) {
            return null;
        }
        return value.length() > MAX_SUMMARY ? value.substring(0, MAX_SUMMARY) : value;
    }
}
