package com.flagship.reconciliation.run;

import com.flagship.reconciliation.exception.AlreadyLinkedException;
import com.flagship.reconciliation.exception.PartialBatchFailureException;
import com.flagship.reconciliation.link.LinkApplication;
import com.flagship.reconciliation.link.LinkPlan;
import com.flagship.reconciliation.link.LinkageLedger;
import com.flagship.reconciliation.matching.StrategyKind;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.observability.RunContext;
import com.flagship.reconciliation.record.Aggregate;
import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.RecordFamily;
import com.flagship.reconciliation.record.RecordStore;
import com.flagship.reconciliation.safety.RunConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Links financial records to the aggregate (charter) named by their reserve number.
 * Cancelled aggregates get HISTORICAL links, which never count towards a balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregateLinker {

    private final RecordStore recordStore;
    private final LinkageLedger linkageLedger;
    private final RunHistoryService runHistory;
    private final ReconciliationMetrics metrics;
    private final Clock clock;

    public RunSummary linkAll(RunConfig config) {
        RunContext.startRun(config.getRunId());
        try {
            return metrics.timeRun(() -> execute(config));
        } finally {
            RunContext.endRun();
        }
    }

    private RunSummary execute(RunConfig config) {
        Instant startedAt = clock.instant();
        Instant deadline = config.getMaxDuration() == null ? null : startedAt.plus(config.getMaxDuration());
        List<FinancialRecord> awaiting = recordStore.findRecordsAwaitingAggregate();
        log.info("Aggregate linking started in {} mode: {} record(s) carry a reserve number without an aggregate",
            config.mode(), awaiting.size());

        RunTally tally = new RunTally(metrics);
        for (int i = 0; i < awaiting.size(); i++) {
            FinancialRecord record = awaiting.get(i);
            boolean overBudget = deadline != null && clock.instant().isAfter(deadline);
            if (config.limitReached(tally.applies()) || overBudget) {
                String reason = overBudget ? "run time budget exhausted" : "apply limit reached";
                awaiting.subList(i, awaiting.size()).forEach(deferred -> tally.record(ReportRow.withoutCandidate(
                    RecordFamily.RECORDS, deferred.getId(), ReportOutcome.DEFERRED, reason)));
                break;
            }
            RunContext.enterRecord(RecordFamily.RECORDS, record.getId());
            try {
                linkRecord(record, config, tally);
            } finally {
                RunContext.leaveRecord();
            }
        }

        RunSummary summary = tally.toSummary(RunOperation.LINK_AGGREGATES, config, RecordFamily.RECORDS,
            startedAt, clock.instant());
        if (config.isWriteEnabled()) {
            runHistory.record(summary);
        }
        log.info("Aggregate linking finished: {}", summary.getCounts());
        return summary;
    }

    private ReportOutcome linkRecord(FinancialRecord record, RunConfig config, RunTally tally) {
        Optional<Aggregate> aggregate = recordStore.findAggregateByReserveNumber(record.getReserveNumber());
        if (aggregate.isEmpty()) {
            return tally.record(ReportRow.withoutCandidate(RecordFamily.RECORDS, record.getId(),
                ReportOutcome.NO_CANDIDATE, "no aggregate with reserve number " + record.getReserveNumber()));
        }

        LinkPlan plan = linkageLedger.proposeAggregateLink(record, aggregate.get());
        try {
            if (!config.isWriteEnabled()) {
                return tally.record(row(record, plan, ReportOutcome.PLANNED, plan.describe()));
            }
            LinkApplication application = linkageLedger.apply(plan, config);
            ReportOutcome outcome = application.isAlreadySatisfied()
                ? ReportOutcome.ALREADY_SATISFIED
                : ReportOutcome.APPLIED;
            return tally.record(row(record, plan, outcome, plan.describe()));
        } catch (AlreadyLinkedException e) {
            log.warn("Conflict linking record {} to aggregate {}: {}", record.getId(), plan.getAggregateId(),
                e.getMessage());
            return tally.record(row(record, plan, ReportOutcome.CONFLICT, e.getMessage()));
        } catch (RuntimeException e) {
            PartialBatchFailureException failure = new PartialBatchFailureException(RecordFamily.RECORDS,
                record.getId(), e);
            log.error(failure.getMessage(), failure);
            return tally.record(row(record, plan, ReportOutcome.FAILED, String.valueOf(e.getMessage())));
        }
    }

    private ReportRow row(FinancialRecord record, LinkPlan plan, ReportOutcome outcome, String detail) {
        return new ReportRow(RecordFamily.RECORDS, record.getId(), plan.getAggregateId(), StrategyKind.NATURAL_KEY,
            plan.getConfidence(), outcome, detail);
    }
}
