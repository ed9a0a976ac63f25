package com.flagship.reconciliation.ingestion;

import com.flagship.reconciliation.safety.AuditEntry;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of importing one batch. Rows whose id already exists are skipped, not
 * overwritten; an import with nothing new writes no audit entry.
 */
@Value
public class IngestionResult {
    List<Long> insertedIds;
    List<Long> skippedIds;
    AuditEntry auditEntry;

    public int inserted() {
        return insertedIds.size();
    }

    public int skipped() {
        return skippedIds.size();
    }

    public Optional<AuditEntry> audit() {
        return Optional.ofNullable(auditEntry);
    }
}
