package com.flagship.reconciliation.run;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class UnresolvedItem {
    UUID id;
    RecordFamily family;
    long recordId;
    ReportOutcome outcome;
    String candidateSummary;
    UUID lastRunId;
    Instant firstSeenAt;
    Instant lastSeenAt;
    boolean resolved;
    Instant resolvedAt;
}
