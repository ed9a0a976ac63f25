package com.flagship.reconciliation.safety;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for the audit_log table. Insert-only: every column is {@code updatable = false}.
 */
@Entity
@Table(name = "audit_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditEntryEntity {

    private static final int MAX_TEXT = 2000;
    private static final int MAX_IDS = 4000;
    private static final int MAX_RELATED = 1000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_kind", nullable = false, updatable = false)
    private OperationKind operationKind;

    @Column(name = "target_table", nullable = false, updatable = false)
    private String targetTable;

    @Column(name = "record_ids", updatable = false, length = MAX_IDS)
    private String recordIds;

    @Column(name = "related_records", updatable = false, length = MAX_RELATED)
    private String relatedRecords;

    @Column(name = "row_count", nullable = false, updatable = false)
    private int rowCount;

    @Column(name = "condition_text", nullable = false, updatable = false, length = MAX_TEXT)
    private String conditionText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AuditOutcome outcome;

    @Column(name = "error_summary", updatable = false, length = MAX_TEXT)
    private String errorSummary;

    @Column(name = "snapshot_name", updatable = false)
    private String snapshotName;

    @Column(name = "run_id", updatable = false)
    private UUID runId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static AuditEntryEntity record(OperationPlan plan, AuditOutcome outcome, String errorSummary,
                                   String snapshotName, UUID runId) {
        return new AuditEntryEntity(
            UUID.randomUUID(),
            plan.getKind(),
            plan.getTargetTable(),
            clip(plan.joinedRecordIds(), MAX_IDS),
            clip(plan.joinedRelatedRecords(), MAX_RELATED),
            plan.getPlannedRowCount(),
            clip(plan.describe(), MAX_TEXT),
            outcome,
            clip(errorSummary, MAX_TEXT),
            snapshotName,
            runId,
            null // createdAt - set by @PrePersist
        );
    }

    public AuditEntry toDomain() {
        return new AuditEntry(id, operationKind, targetTable, split(recordIds), split(relatedRecords), rowCount,
            conditionText, outcome, errorSummary, snapshotName, runId, createdAt);
    }

    private static List<String> split(String joined) {
        return joined == null || joined.isBlank() ? List.of() : Arrays.asList(joined.split(","));
    }

    private static String clip(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
