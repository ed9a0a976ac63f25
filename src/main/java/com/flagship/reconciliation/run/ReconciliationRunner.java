package com.flagship.reconciliation.run;

import com.flagship.reconciliation.exception.AlreadyLinkedException;
import com.flagship.reconciliation.exception.PartialBatchFailureException;
import com.flagship.reconciliation.link.LinkApplication;
import com.flagship.reconciliation.link.LinkPlan;
import com.flagship.reconciliation.link.LinkageLedger;
import com.flagship.reconciliation.matching.MatchDecision;
import com.flagship.reconciliation.matching.MatchingEngine;
import com.flagship.reconciliation.matching.MatchingPolicy;
import com.flagship.reconciliation.matching.ScoredCandidate;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.observability.RunContext;
import com.flagship.reconciliation.record.LinkCoverage;
import com.flagship.reconciliation.record.RecordFamily;
import com.flagship.reconciliation.record.RecordStore;
import com.flagship.reconciliation.safety.RunConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Batch driver: evaluates every unmatched record of the run's direction in ascending id
 * order and applies the clear winners.
 *
 * Each record is its own unit of work. A record whose apply fails is rolled back,
 * reported as FAILED and the batch carries on. Once the apply limit or the time budget is
 * reached, the remaining records are reported as DEFERRED and stay unmatched.
 *
 * A dry run takes the same decisions as a write run (candidates claimed earlier in the
 * run are excluded from later records) but writes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationRunner {

    private final RecordStore recordStore;
    private final MatchingEngine matchingEngine;
    private final LinkageLedger linkageLedger;
    private final UnresolvedQueueService unresolvedQueue;
    private final RunHistoryService runHistory;
    private final ReconciliationMetrics metrics;
    private final Clock clock;

    public RunSummary run(RunConfig config, MatchingPolicy policy) {
        RunContext.startRun(config.getRunId());
        try {
            return metrics.timeRun(() -> execute(config, policy));
        } finally {
            RunContext.endRun();
        }
    }

    /**
     * Linked and unlinked totals of both record families, for the match-rate section of a report.
     */
    public List<LinkCoverage> coverage() {
        return List.of(recordStore.coverage(RecordFamily.LEDGER), recordStore.coverage(RecordFamily.RECORDS));
    }

    private RunSummary execute(RunConfig config, MatchingPolicy policy) {
        Instant startedAt = clock.instant();
        Instant deadline = config.getMaxDuration() == null ? null : startedAt.plus(config.getMaxDuration());
        RecordFamily family = config.getDirection();
        List<Long> queue = family == RecordFamily.LEDGER
            ? recordStore.findUnlinkedLedgerTransactionIds()
            : recordStore.findUnlinkedFinancialRecordIds();

        log.info("Run {} started in {} mode: {} unmatched {} record(s), limit={}",
            RunContext.shortId(config.getRunId()), config.mode(), queue.size(), family,
            config.getLimit() == null ? "none" : config.getLimit());

        RunTally tally = new RunTally(metrics);
        Set<Long> claimed = new HashSet<>();
        for (int i = 0; i < queue.size(); i++) {
            if (config.limitReached(tally.applies()) || pastDeadline(deadline)) {
                defer(family, queue.subList(i, queue.size()), tally,
                    config.limitReached(tally.applies()) ? "apply limit reached" : "run time budget exhausted");
                break;
            }
            long recordId = queue.get(i);
            RunContext.enterRecord(family, recordId);
            Instant recordStarted = clock.instant();
            try {
                processRecord(family, recordId, config, policy, claimed, tally);
            } finally {
                metrics.recordRecordDuration(Duration.between(recordStarted, clock.instant()));
                RunContext.leaveRecord();
            }
        }

        RunSummary summary = tally.toSummary(RunOperation.MATCH, config, family, startedAt, clock.instant());
        if (config.isWriteEnabled()) {
            runHistory.record(summary);
        }
        log.info("Run {} finished: {}", RunContext.shortId(config.getRunId()), summary.getCounts());
        return summary;
    }

    private ReportOutcome processRecord(RecordFamily family, long recordId, RunConfig config,
                                        MatchingPolicy policy, Set<Long> claimed, RunTally tally) {
        MatchDecision decision;
        try {
            decision = matchingEngine.match(family, recordId, policy, claimed);
        } catch (RuntimeException e) {
            return fail(family, recordId, e, tally);
        }

        return switch (decision.getState()) {
            case NO_CANDIDATE -> unresolved(family, recordId, config, tally, ReportOutcome.NO_CANDIDATE,
                List.of(ReportRow.withoutCandidate(family, recordId, ReportOutcome.NO_CANDIDATE,
                    "no candidate cleared any strategy")));
            case AMBIGUOUS -> unresolved(family, recordId, config, tally, ReportOutcome.AMBIGUOUS,
                decision.getRanked().stream()
                    .map(candidate -> ReportRow.forCandidate(family, recordId, candidate, ReportOutcome.AMBIGUOUS,
                        candidate.getProvenance()))
                    .toList());
            case MATCHED -> decision.isAutoApplicable()
                ? applyBest(family, recordId, decision, config, claimed, tally)
                : unresolved(family, recordId, config, tally, ReportOutcome.BELOW_THRESHOLD,
                    List.of(ReportRow.forCandidate(family, recordId, decision.best().orElseThrow(),
                        ReportOutcome.BELOW_THRESHOLD, decision.best().orElseThrow().getProvenance())));
            default -> throw new IllegalStateException("Non-terminal match state " + decision.getState());
        };
    }

    private ReportOutcome applyBest(RecordFamily family, long recordId, MatchDecision decision, RunConfig config,
                                    Set<Long> claimed, RunTally tally) {
        ScoredCandidate best = decision.best().orElseThrow();
        try {
            LinkPlan plan = linkageLedger.propose(best);
            if (!config.isWriteEnabled()) {
                claimed.add(best.candidateId());
                return tally.record(ReportRow.forCandidate(family, recordId, best, ReportOutcome.PLANNED,
                    plan.describe()));
            }

            LinkApplication application = linkageLedger.apply(plan, config);
            claimed.add(best.candidateId());
            unresolvedQueue.markResolved(family, recordId, config.getRunId());
            ReportOutcome outcome = application.isAlreadySatisfied()
                ? ReportOutcome.ALREADY_SATISFIED
                : ReportOutcome.APPLIED;
            return tally.record(ReportRow.forCandidate(family, recordId, best, outcome,
                "link " + application.getLink().getId()));
        } catch (AlreadyLinkedException e) {
            log.warn("Conflict on {} {}: {}", family, recordId, e.getMessage());
            return unresolved(family, recordId, config, tally, ReportOutcome.CONFLICT,
                List.of(ReportRow.forCandidate(family, recordId, best, ReportOutcome.CONFLICT, e.getMessage())));
        } catch (RuntimeException e) {
            return fail(family, recordId, e, tally);
        }
    }

    private ReportOutcome unresolved(RecordFamily family, long recordId, RunConfig config, RunTally tally,
                                     ReportOutcome outcome, List<ReportRow> rows) {
        if (config.isWriteEnabled()) {
            String summary = rows.stream()
                .map(row -> row.getCandidateId() == null
                    ? row.getDetail()
                    : row.getCandidateId() + ":" + row.getStrategy() + ":" + row.getConfidence())
                .collect(Collectors.joining("; "));
            unresolvedQueue.record(family, recordId, outcome, summary, config.getRunId());
        }
        return tally.record(outcome, rows);
    }

    private ReportOutcome fail(RecordFamily family, long recordId, RuntimeException cause, RunTally tally) {
        PartialBatchFailureException failure = new PartialBatchFailureException(family, recordId, cause);
        log.error(failure.getMessage(), failure);
        return tally.record(ReportRow.withoutCandidate(family, recordId, ReportOutcome.FAILED,
            String.valueOf(cause.getMessage())));
    }

    private void defer(RecordFamily family, List<Long> remaining, RunTally tally, String reason) {
        log.info("Deferring {} record(s): {}", remaining.size(), reason);
        for (long recordId : remaining) {
            tally.record(ReportRow.withoutCandidate(family, recordId, ReportOutcome.DEFERRED, reason));
        }
    }

    private boolean pastDeadline(Instant deadline) {
        return deadline != null && clock.instant().isAfter(deadline);
    }
}
