package com.flagship.reconciliation.balance;

import com.flagship.reconciliation.safety.AuditEntry;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link BalanceRecalculator#repairDrift}: the check that found the drift and
 * the balances rewritten because of it.
 */
@Value
public class BalanceRepair {
    BalanceAudit before;
    List<AggregateBalance> repaired;
    AuditEntry auditEntry;

    public Optional<AuditEntry> audit() {
        return Optional.ofNullable(auditEntry);
    }
}
