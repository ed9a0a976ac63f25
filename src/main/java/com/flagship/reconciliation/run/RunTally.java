package com.flagship.reconciliation.run;

import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.record.RecordFamily;
import com.flagship.reconciliation.safety.RunConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator used while a run is in progress.
 */
class RunTally {

    private final ReconciliationMetrics metrics;
    private final List<ReportRow> rows = new ArrayList<>();
    private final Map<ReportOutcome, Integer> counts = new EnumMap<>(ReportOutcome.class);
    private int applies;

    RunTally(ReconciliationMetrics metrics) {
        this.metrics = metrics;
    }

    ReportOutcome record(ReportOutcome outcome, List<ReportRow> outcomeRows) {
        counts.merge(outcome, 1, Integer::sum);
        rows.addAll(outcomeRows);
        if (outcome == ReportOutcome.APPLIED || outcome == ReportOutcome.PLANNED) {
            applies++;
        }
        metrics.recordOutcome(outcome.name());
        return outcome;
    }

    ReportOutcome record(ReportRow row) {
        return record(row.getOutcome(), List.of(row));
    }

    int applies() {
        return applies;
    }

    RunSummary toSummary(RunOperation operation, RunConfig config, RecordFamily direction,
                         Instant startedAt, Instant finishedAt) {
        return new RunSummary(config.getRunId(), operation, config.isWriteEnabled(), direction, startedAt,
            finishedAt, List.copyOf(rows), Collections.unmodifiableMap(new EnumMap<>(counts)));
    }
}
