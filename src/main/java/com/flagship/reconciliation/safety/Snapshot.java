package com.flagship.reconciliation.safety;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Registry entry for an immutable copy of rows taken before a destructive change.
 */
@Value
public class Snapshot {
    UUID id;
    String tableName;
    String sourceTable;
    String condition;
    int rowCount;
    OperationKind operationKind;
    UUID runId;
    Instant createdAt;
}
