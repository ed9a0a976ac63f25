package com.flagship.reconciliation.safety;

import com.flagship.reconciliation.exception.SnapshotFailureException;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Copies the exact row set of a planned destructive operation into a new
 * {@code snap_<table>_<yyyyMMdd_HHmmss>_<suffix>} table and registers it.
 *
 * Runs in its own transaction: a verified snapshot is committed before the mutation it
 * protects starts, and stays in place if that mutation is later rolled back.
 */
@Service
@Slf4j
public class SnapshotService {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final JdbcTemplate jdbcTemplate;
    private final SnapshotRepository snapshotRepository;
    private final ReconciliationMetrics metrics;
    private final Clock clock;

    public SnapshotService(JdbcTemplate jdbcTemplate, SnapshotRepository snapshotRepository,
                           ReconciliationMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.snapshotRepository = snapshotRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws SnapshotFailureException if the copy cannot be created or its row count differs
     *                                  from the plan's matched row count
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Snapshot capture(OperationPlan plan, UUID runId) {
        String source = RowCondition.requireIdentifier(plan.getTargetTable());
        String name = snapshotName(source);
        RowCondition condition = plan.getCondition();

        int stored;
        try {
            jdbcTemplate.execute("CREATE TABLE " + name + " AS SELECT * FROM " + source + " WHERE 1 = 0");
            jdbcTemplate.update("INSERT INTO " + name + " SELECT * FROM " + source + " WHERE " + condition.toSql(),
                condition.parameters());
            Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + name, Integer.class);
            stored = count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new SnapshotFailureException("Could not snapshot " + source + " WHERE " + condition.describe(), e);
        }

        if (stored != plan.getPlannedRowCount()) {
            throw new SnapshotFailureException(String.format(
                "Snapshot %s holds %d row(s) but %d matched %s; refusing to mutate",
                name, stored, plan.getPlannedRowCount(), condition.describe()));
        }

        SnapshotEntity saved = snapshotRepository.save(SnapshotEntity.register(name, plan, stored, runId));
        metrics.recordSnapshot(source, stored);
        log.info("Snapshot {} created: {} row(s) of {} WHERE {}", name, stored, source, condition.describe());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Snapshot> findBySourceTable(String sourceTable) {
        return snapshotRepository.findBySourceTableOrderByCreatedAt(sourceTable).stream()
            .map(SnapshotEntity::toDomain)
            .toList();
    }

    /**
     * Number of rows currently stored in a registered snapshot table.
     */
    @Transactional(readOnly = true)
    public int countRows(Snapshot snapshot) {
        String table = RowCondition.requireIdentifier(snapshot.getTableName());
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    private String snapshotName(String source) {
        String suffix = Integer.toHexString(ThreadLocalRandom.current().nextInt(0x100000, 0xFFFFFF));
        return "snap_" + source + "_" + LocalDateTime.now(clock).format(STAMP) + "_" + suffix;
    }
}
