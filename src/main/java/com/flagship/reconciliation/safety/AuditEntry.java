package com.flagship.reconciliation.safety;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only record of one guarded operation, written on success and on failure.
 */
@Value
public class AuditEntry {
    UUID id;
    OperationKind operationKind;
    String targetTable;
    List<String> recordIds;
    /** {@code table:id} references to rows affected outside the target table. */
    List<String> relatedRecords;
    int rowCount;
    String condition;
    AuditOutcome outcome;
    String errorSummary;
    String snapshotName;
    UUID runId;
    Instant createdAt;

    public boolean isSuccess() {
        return outcome == AuditOutcome.SUCCESS;
    }
}
