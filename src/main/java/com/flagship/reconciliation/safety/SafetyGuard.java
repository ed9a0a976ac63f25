package com.flagship.reconciliation.safety;

import com.flagship.reconciliation.config.ReconciliationProperties;
import com.flagship.reconciliation.exception.OverrideTokenRequiredException;
import com.flagship.reconciliation.exception.SnapshotFailureException;
import com.flagship.reconciliation.exception.WriteModeRequiredException;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Plan/apply protocol around every mutating operation.
 *
 * {@code REQUESTED → PLANNED → {APPLIED, ABORTED}}:
 * 1. {@link #plan} counts the rows the operation will touch, without side effects
 * 2. {@link #execute} refuses to leave PLANNED unless the run is in write mode
 * 3. destructive changes on protected tables additionally need the day's override key
 * 4. destructive changes get a verified snapshot before the mutation runs
 * 5. the outcome is audited on success (same transaction) and on failure (own transaction)
 *
 * A refusal for missing write mode writes nothing at all, not even an audit row: a dry
 * run leaves the database untouched.
 */
@Service
@Slf4j
public class SafetyGuard {

    private final JdbcTemplate jdbcTemplate;
    private final SnapshotService snapshotService;
    private final AuditLogService auditLogService;
    private final OverrideTokenValidator overrideTokenValidator;
    private final ReconciliationMetrics metrics;
    private final Set<String> protectedTables;

    public SafetyGuard(JdbcTemplate jdbcTemplate,
                       SnapshotService snapshotService,
                       AuditLogService auditLogService,
                       OverrideTokenValidator overrideTokenValidator,
                       ReconciliationMetrics metrics,
                       ReconciliationProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.snapshotService = snapshotService;
        this.auditLogService = auditLogService;
        this.overrideTokenValidator = overrideTokenValidator;
        this.metrics = metrics;
        this.protectedTables = properties.getSafety().getProtectedTables().stream()
            .map(table -> table.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public OperationPlan plan(OperationKind kind, String table, RowCondition condition, String reason) {
        RowCondition.requireIdentifier(table);
        int rows = kind.isDestructive() ? countMatching(table, condition) : condition.size();
        OperationPlan plan = new OperationPlan(kind, table, condition, rows, reason);
        log.debug("Planned {}", plan.describe());
        return plan;
    }

    public boolean isProtected(String table) {
        return protectedTables.contains(table.toLowerCase(Locale.ROOT));
    }

    public <T> GuardedResult<T> execute(OperationPlan plan, RunConfig config, Supplier<T> mutation) {
        GuardState state = transition(GuardState.REQUESTED, GuardState.PLANNED);

        if (!config.isWriteEnabled()) {
            metrics.recordGuardedOperation(plan.getKind().name(), "WRITE_MODE_REQUIRED");
            log.warn("Refused {}: run {} is a dry run", plan.describe(), config.getRunId());
            throw new WriteModeRequiredException(plan.getKind().name());
        }

        if (plan.getKind().isDestructive() && isProtected(plan.getTargetTable())) {
            try {
                overrideTokenValidator.requireValid(plan.getTargetTable(), config.getOverrideToken());
            } catch (OverrideTokenRequiredException e) {
                metrics.recordGuardedOperation(plan.getKind().name(), "OVERRIDE_REQUIRED");
                auditLogService.appendIsolated(plan, AuditOutcome.ABORTED, e.getMessage(), null, config.getRunId());
                throw e;
            }
        }

        Snapshot snapshot = null;
        if (plan.getKind().isDestructive()) {
            try {
                snapshot = snapshotService.capture(plan, config.getRunId());
            } catch (SnapshotFailureException e) {
                metrics.recordGuardedOperation(plan.getKind().name(), "SNAPSHOT_FAILED");
                auditLogService.appendIsolated(plan, AuditOutcome.ABORTED, summarize(e), null, config.getRunId());
                throw e;
            }
        }
        String snapshotName = snapshot == null ? null : snapshot.getTableName();

        T value;
        try {
            value = mutation.get();
        } catch (RuntimeException e) {
            transition(state, GuardState.ABORTED);
            metrics.recordGuardedOperation(plan.getKind().name(), "FAILED");
            auditLogService.appendIsolated(plan, AuditOutcome.FAILURE, summarize(e), snapshotName,
                config.getRunId());
            throw e;
        }

        AuditEntry entry = auditLogService.append(plan, AuditOutcome.SUCCESS, snapshotName, config.getRunId());
        transition(state, GuardState.APPLIED);
        metrics.recordGuardedOperation(plan.getKind().name(), "APPLIED");
        return new GuardedResult<>(value, plan, entry, snapshot);
    }

    private int countMatching(String table, RowCondition condition) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE " + condition.toSql(),
            Integer.class,
            condition.parameters());
        return count == null ? 0 : count;
    }

    private GuardState transition(GuardState from, GuardState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal guard state transition " + from + " -> " + to);
        }
        return to;
    }

    private String summarize(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
