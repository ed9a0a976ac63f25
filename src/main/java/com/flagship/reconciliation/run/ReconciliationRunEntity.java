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
 * History row for a write-mode run.
 */
@Entity
@Table(name = "reconciliation_runs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconciliationRunEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RunOperation operation;

    @Column(nullable = false, updatable = false)
    private String mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RecordFamily direction;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(nullable = false)
    private int evaluated;

    @Column(nullable = false)
    private int applied;

    @Column(name = "already_satisfied", nullable = false)
    private int alreadySatisfied;

    @Column(nullable = false)
    private int ambiguous;

    @Column(name = "no_candidate", nullable = false)
    private int noCandidate;

    @Column(name = "below_threshold", nullable = false)
    private int belowThreshold;

    @Column(nullable = false)
    private int conflicts;

    @Column(nullable = false)
    private int failed;

    @Column(nullable = false)
    private int deferred;

    static ReconciliationRunEntity fromSummary(RunSummary summary) {
        return new ReconciliationRunEntity(
            summary.getRunId(),
            summary.getOperation(),
            summary.mode(),
            summary.getDirection(),
            summary.getStartedAt(),
            summary.getFinishedAt(),
            summary.evaluated(),
            summary.count(ReportOutcome.APPLIED),
            summary.count(ReportOutcome.ALREADY_SATISFIED),
            summary.count(ReportOutcome.AMBIGUOUS),
            summary.count(ReportOutcome.NO_CANDIDATE),
            summary.count(ReportOutcome.BELOW_THRESHOLD),
            summary.count(ReportOutcome.CONFLICT),
            summary.count(ReportOutcome.FAILED),
            summary.count(ReportOutcome.DEFERRED)
        );
    }
}
