package com.flagship.reconciliation.safety;

import com.flagship.reconciliation.exception.SnapshotFailureException;
import com.flagship.reconciliation.exception.WriteModeRequiredException;
import com.flagship.reconciliation.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Plan/apply protocol tests.
 *
 * These tests verify that:
 * - Planning counts rows without side effects
 * - A dry run never reaches the mutation and leaves no trace
 * - A failed mutation is rolled back while its FAILURE audit entry survives
 * - A snapshot that does not hold exactly the planned rows aborts the operation
 */
class SafetyGuardIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private SafetyGuard safetyGuard;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private SnapshotService snapshotService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("Planning a destructive change counts the rows that actually match")
    void planCountsMatchingRows() {
        givenLedger(ledger(1, "-10.00", AUG_13), ledger(2, "-20.00", AUG_13));

        OperationPlan plan = safetyGuard.plan(OperationKind.PURGE_LEDGER_TRANSACTIONS, "ledger_transactions",
            RowCondition.idIn(List.of(1L, 2L, 3L)), "cleanup");

        assertEquals(2, plan.getPlannedRowCount());
        assertEquals(List.of("1", "2", "3"), plan.recordIds());
        assertTrue(safetyGuard.isProtected("LEDGER_TRANSACTIONS"));
        assertFalse(safetyGuard.isProtected("snapshots"));
        assertThrows(IllegalArgumentException.class, () -> safetyGuard.plan(OperationKind.LINK_APPLY,
            "links; --", RowCondition.idIn(List.of(1L)), "bad"));
    }

    @Test
    @DisplayName("Without write mode the mutation never runs and nothing is audited")
    void dryRunNeverMutates() {
        int auditRows = count("audit_log");
        AtomicBoolean ran = new AtomicBoolean();
        OperationPlan plan = safetyGuard.plan(OperationKind.INGEST_AGGREGATES, "aggregates",
            RowCondition.idIn(List.of(7L)), "test");

        assertThrows(WriteModeRequiredException.class,
            () -> safetyGuard.execute(plan, RunConfig.dryRun(), () -> {
                ran.set(true);
                return 1;
            }));

        assertFalse(ran.get());
        assertEquals(auditRows, count("audit_log"));
    }

    @Test
    @DisplayName("A failed mutation rolls back but its FAILURE audit entry is kept")
    void failureAuditSurvivesRollback() {
        // Given
        RunConfig config = RunConfig.write();
        OperationPlan plan = safetyGuard.plan(OperationKind.INGEST_AGGREGATES, "aggregates",
            RowCondition.idIn(List.of(900L)), "import that fails halfway");
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        // When: the mutation writes a row and then fails inside one transaction
        IllegalStateException failure = assertThrows(IllegalStateException.class,
            () -> transaction.executeWithoutResult(status -> safetyGuard.execute(plan, config, () -> {
                jdbcTemplate.update("INSERT INTO aggregates (id, amount_owed) VALUES (900, 10.00)");
                throw new IllegalStateException("feed truncated");
            })));

        // Then
        assertEquals("feed truncated", failure.getMessage());
        assertEquals(0, count("aggregates"));
        List<AuditEntry> entries = auditLogService.findByRun(config.getRunId());
        assertEquals(1, entries.size());
        assertEquals(AuditOutcome.FAILURE, entries.get(0).getOutcome());
        assertEquals("IllegalStateException: feed truncated", entries.get(0).getErrorSummary());
        assertEquals(List.of("900"), entries.get(0).getRecordIds());
    }

    @Test
    @DisplayName("A snapshot holding fewer rows than planned aborts before the mutation")
    void snapshotMismatchAborts() {
        // Given: a plan claiming more rows than exist
        givenLedger(ledger(1, "-10.00", AUG_13));
        RunConfig config = RunConfig.write(writeToken("ledger_transactions"));
        OperationPlan plan = new OperationPlan(OperationKind.PURGE_LEDGER_TRANSACTIONS, "ledger_transactions",
            RowCondition.idIn(List.of(1L)), 3, "stale plan");
        AtomicBoolean ran = new AtomicBoolean();

        // When
        assertThrows(SnapshotFailureException.class, () -> safetyGuard.execute(plan, config, () -> {
            ran.set(true);
            return 0;
        }));

        // Then
        assertFalse(ran.get());
        assertEquals(1, count("ledger_transactions"));
        List<AuditEntry> entries = auditLogService.findByRun(config.getRunId());
        assertEquals(1, entries.size());
        assertEquals(AuditOutcome.ABORTED, entries.get(0).getOutcome());
        assertTrue(snapshotService.findBySourceTable("ledger_transactions").isEmpty());
    }

    @Test
    @DisplayName("A successful destructive operation is audited with its snapshot")
    void successIsAuditedWithSnapshot() {
        givenLedger(ledger(1, "-10.00", AUG_13), ledger(2, "-20.00", AUG_13));
        RunConfig config = RunConfig.write(writeToken("ledger_transactions"));
        OperationPlan plan = safetyGuard.plan(OperationKind.PURGE_LEDGER_TRANSACTIONS, "ledger_transactions",
            RowCondition.idIn(List.of(1L, 2L)), "duplicate import");

        GuardedResult<Integer> result = safetyGuard.execute(plan, config,
            () -> jdbcTemplate.update("DELETE FROM ledger_transactions WHERE id IN (1, 2)"));

        assertEquals(2, result.getValue());
        Snapshot snapshot = result.snapshot().orElseThrow();
        assertEquals(2, snapshot.getRowCount());
        assertEquals(2, snapshotService.countRows(snapshot));
        assertEquals(snapshot.getTableName(), result.getAuditEntry().getSnapshotName());
        assertTrue(result.getAuditEntry().isSuccess());
        assertEquals(config.getRunId(), snapshot.getRunId());
    }
}
