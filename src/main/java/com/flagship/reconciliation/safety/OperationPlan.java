package com.flagship.reconciliation.safety;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The rows a guarded operation intends to touch, computed without side effects.
 *
 * For destructive operations {@code plannedRowCount} is the number of rows the condition
 * matched before anything ran; for additive ones it is the number of rows to be written.
 * {@code relatedRecords} names rows in other tables the operation affects indirectly,
 * as {@code table:id} references.
 */
@Value
public class OperationPlan {
    OperationKind kind;
    String targetTable;
    RowCondition condition;
    int plannedRowCount;
    String reason;
    List<String> relatedRecords;

    public OperationPlan(OperationKind kind, String targetTable, RowCondition condition, int plannedRowCount,
                         String reason) {
        this(kind, targetTable, condition, plannedRowCount, reason, List.of());
    }

    public OperationPlan(OperationKind kind, String targetTable, RowCondition condition, int plannedRowCount,
                         String reason, List<String> relatedRecords) {
        this.kind = kind;
        this.targetTable = targetTable;
        this.condition = condition;
        this.plannedRowCount = plannedRowCount;
        this.reason = reason;
        this.relatedRecords = List.copyOf(relatedRecords);
    }

    /**
     * Same plan, additionally naming {@code table:id} as affected.
     */
    public OperationPlan withRelated(String table, Object id) {
        if (id == null) {
            return this;
        }
        List<String> related = new ArrayList<>(relatedRecords);
        related.add(reference(RowCondition.requireIdentifier(table), id));
        return new OperationPlan(kind, targetTable, condition, plannedRowCount, reason, related);
    }

    public List<String> recordIds() {
        return condition.values().stream().map(String::valueOf).toList();
    }

    public String describe() {
        String text = String.format("%s on %s WHERE %s (%d row(s))",
            kind, targetTable, condition.describe(), plannedRowCount);
        return reason == null || reason.isBlank() ? text : text + ": " + reason;
    }

    static String reference(String table, Object id) {
        return table + ":" + id;
    }

    String joinedRecordIds() {
        return condition.values().stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    String joinedRelatedRecords() {
        return relatedRecords.isEmpty() ? null : String.join(",", relatedRecords);
    }
}
