package com.flagship.reconciliation.safety;

import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a guarded operation that reached APPLIED.
 */
@Value
public class GuardedResult<T> {
    T value;
    OperationPlan plan;
    AuditEntry auditEntry;
    Snapshot snapshot;

    public Optional<Snapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }
}
