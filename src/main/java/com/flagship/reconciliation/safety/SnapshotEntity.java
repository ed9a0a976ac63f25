package com.flagship.reconciliation.safety;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "snapshots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SnapshotEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "snapshot_table", nullable = false, updatable = false, unique = true)
    private String snapshotTable;

    @Column(name = "source_table", nullable = false, updatable = false)
    private String sourceTable;

    @Column(name = "condition_text", nullable = false, updatable = false, length = 2000)
    private String conditionText;

    @Column(name = "row_count", nullable = false, updatable = false)
    private int rowCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_kind", nullable = false, updatable = false)
    private OperationKind operationKind;

    @Column(name = "run_id", updatable = false)
    private UUID runId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static SnapshotEntity register(String snapshotTable, OperationPlan plan, int rowCount, UUID runId) {
        String condition = plan.getCondition().describe();
        return new SnapshotEntity(
            UUID.randomUUID(),
            snapshotTable,
            plan.getTargetTable(),
            condition.length() > 2000 ? condition.substring(0, 2000) : condition,
            rowCount,
            plan.getKind(),
            runId,
            null // createdAt - set by @PrePersist
        );
    }

    public Snapshot toDomain() {
        return new Snapshot(id, snapshotTable, sourceTable, conditionText, rowCount, operationKind, runId,
            createdAt);
    }
}
