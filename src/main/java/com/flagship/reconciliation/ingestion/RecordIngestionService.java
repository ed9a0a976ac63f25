package com.flagship.reconciliation.ingestion;

import com.flagship.reconciliation.record.Aggregate;
import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.RecordStore;
import com.flagship.reconciliation.safety.AuditEntry;
import com.flagship.reconciliation.safety.GuardedResult;
import com.flagship.reconciliation.safety.OperationKind;
import com.flagship.reconciliation.safety.OperationPlan;
import com.flagship.reconciliation.safety.RowCondition;
import com.flagship.reconciliation.safety.RunConfig;
import com.flagship.reconciliation.safety.SafetyGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongPredicate;

/**
 * Entry point for typed batches handed over by the import collaborators (bank exports,
 * POS feeds, legacy systems). Source files are never parsed here.
 *
 * Each batch is one guarded, audited, all-or-nothing insert. Importing is idempotent by
 * id: rows that already exist, or repeat within the batch, are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordIngestionService {

    private final RecordStore recordStore;
    private final SafetyGuard safetyGuard;

    @Transactional
    public IngestionResult ingestLedgerTransactions(List<LedgerTransaction> batch, RunConfig config) {
        batch.forEach(this::validate);
        return ingest(batch, LedgerTransaction::getId, recordStore::ledgerTransactionExists,
            recordStore::insertLedgerTransaction, OperationKind.INGEST_LEDGER_TRANSACTIONS,
            "ledger_transactions", config);
    }

    @Transactional
    public IngestionResult ingestFinancialRecords(List<FinancialRecord> batch, RunConfig config) {
        batch.forEach(this::validate);
        return ingest(batch, FinancialRecord::getId, recordStore::financialRecordExists,
            recordStore::insertFinancialRecord, OperationKind.INGEST_FINANCIAL_RECORDS,
            "financial_records", config);
    }

    @Transactional
    public IngestionResult ingestAggregates(List<Aggregate> batch, RunConfig config) {
        batch.forEach(this::validate);
        return ingest(batch, Aggregate::getId, recordStore::aggregateExists,
            recordStore::insertAggregate, OperationKind.INGEST_AGGREGATES, "aggregates", config);
    }

    private <T> IngestionResult ingest(List<T> batch, Function<T, Long> idOf, LongPredicate exists,
                                       Consumer<T> insert, OperationKind kind, String table, RunConfig config) {
        List<T> fresh = new ArrayList<>();
        List<Long> insertedIds = new ArrayList<>();
        List<Long> skippedIds = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (T row : batch) {
            long id = idOf.apply(row);
            if (!seen.add(id) || exists.test(id)) {
                skippedIds.add(id);
            } else {
                fresh.add(row);
                insertedIds.add(id);
            }
        }

        if (fresh.isEmpty()) {
            log.info("Nothing new to import into {} ({} row(s) skipped)", table, skippedIds.size());
            return new IngestionResult(List.of(), List.copyOf(skippedIds), null);
        }

        OperationPlan plan = safetyGuard.plan(kind, table, RowCondition.idIn(insertedIds),
            "import of " + fresh.size() + " row(s)");
        GuardedResult<Integer> result = safetyGuard.execute(plan, config, () -> {
            fresh.forEach(insert);
            return fresh.size();
        });
        AuditEntry entry = result.getAuditEntry();
        log.info("Imported {} row(s) into {}, skipped {}", result.getValue(), table, skippedIds.size());
        return new IngestionResult(List.copyOf(insertedIds), List.copyOf(skippedIds), entry);
    }

    private void validate(LedgerTransaction transaction) {
        require(transaction.getPostingDate() != null, "posting date", transaction.getId());
        require(transaction.getAmount() != null, "amount", transaction.getId());
        require(transaction.getAccountId() != null && !transaction.getAccountId().isBlank(),
            "account", transaction.getId());
        if (transaction.getLinkId() != null) {
            throw new IllegalArgumentException("Row " + transaction.getId() + " must not carry a link on import");
        }
    }

    private void validate(FinancialRecord record) {
        require(record.getRecordDate() != null, "record date", record.getId());
        require(record.getAmount() != null, "amount", record.getId());
        require(record.getNature() != null, "nature", record.getId());
    }

    private void validate(Aggregate aggregate) {
        require(aggregate.getAmountOwed() != null, "amount owed", aggregate.getId());
    }

    private void require(boolean condition, String what, long id) {
        if (!condition) {
            throw new IllegalArgumentException("Row " + id + " is missing " + what);
        }
    }
}
