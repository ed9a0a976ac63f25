package com.flagship.reconciliation.safety;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes and reads the append-only audit log.
 *
 * Successful operations are audited inside the caller's transaction so the entry commits
 * (or rolls back) with the change it describes. Failures are audited in a separate
 * transaction so the entry survives the rollback of the failed unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final AuditEntryRepository auditEntryRepository;

    @Transactional(propagation = Propagation.REQUIRED)
    public AuditEntry append(OperationPlan plan, AuditOutcome outcome, String snapshotName, UUID runId) {
        AuditEntryEntity saved = auditEntryRepository.save(
            AuditEntryEntity.record(plan, outcome, null, snapshotName, runId));
        log.info("Audit {} {}: {}", outcome, plan.getKind(), plan.describe());
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditEntry appendIsolated(OperationPlan plan, AuditOutcome outcome, String errorSummary,
                                     String snapshotName, UUID runId) {
        AuditEntryEntity saved = auditEntryRepository.save(
            AuditEntryEntity.record(plan, outcome, errorSummary, snapshotName, runId));
        log.warn("Audit {} {}: {} ({})", outcome, plan.getKind(), plan.describe(), errorSummary);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> findByOperationKind(OperationKind kind) {
        return auditEntryRepository.findByOperationKindOrderByCreatedAt(kind).stream()
            .map(AuditEntryEntity::toDomain)
            .toList();
    }

    /**
     * Entries that touched the row {@code recordId} of {@code table}, either directly
     * (the table was the operation's target) or as a related record.
     */
    @Transactional(readOnly = true)
    public List<AuditEntry> findForRecord(String table, Object recordId) {
        String id = String.valueOf(recordId);
        String reference = OperationPlan.reference(table, id);
        return auditEntryRepository.findTouching(table, id, reference).stream()
            .map(AuditEntryEntity::toDomain)
            .filter(entry -> (entry.getTargetTable().equals(table) && entry.getRecordIds().contains(id))
                || entry.getRelatedRecords().contains(reference))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> findByRun(UUID runId) {
        return auditEntryRepository.findByRunIdOrderByCreatedAt(runId).stream()
            .map(AuditEntryEntity::toDomain)
            .toList();
    }
}
