package com.flagship.reconciliation.run;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Counts (one per record) and report rows (one or more per record) of a finished run.
 */
@Value
public class RunSummary {
    UUID runId;
    RunOperation operation;
    boolean writeEnabled;
    RecordFamily direction;
    Instant startedAt;
    Instant finishedAt;
    List<ReportRow> rows;
    Map<ReportOutcome, Integer> counts;

    public int count(ReportOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    /**
     * Records that were actually looked at; deferred ones were not.
     */
    public int evaluated() {
        return counts.entrySet().stream()
            .filter(entry -> entry.getKey() != ReportOutcome.DEFERRED)
            .mapToInt(Map.Entry::getValue)
            .sum();
    }

    public String mode() {
        return writeEnabled ? "WRITE" : "DRY_RUN";
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }
}
