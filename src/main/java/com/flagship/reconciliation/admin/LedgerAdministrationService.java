package com.flagship.reconciliation.admin;

import com.flagship.reconciliation.exception.LinkConstraintViolationException;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.RecordStore;
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
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Administrative removal of imported ledger transactions (duplicate imports, test rows).
 *
 * The only way ledger rows are ever deleted: unlinked rows only, write mode, the day's
 * override key for ledger_transactions, a verified snapshot and an audit entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAdministrationService {

    static final String LEDGER_TABLE = "ledger_transactions";

    private final RecordStore recordStore;
    private final SafetyGuard safetyGuard;

    /**
     * Previews a purge without touching anything.
     */
    @Transactional(readOnly = true)
    public OperationPlan planPurge(Collection<Long> ids, String reason) {
        List<Long> sorted = validate(ids);
        return safetyGuard.plan(OperationKind.PURGE_LEDGER_TRANSACTIONS, LEDGER_TABLE,
            RowCondition.idIn(sorted), reason);
    }

    @Transactional
    public GuardedResult<Integer> purgeLedgerTransactions(Collection<Long> ids, String reason, RunConfig config) {
        OperationPlan plan = planPurge(ids, reason);
        List<Long> sorted = plan.getCondition().values().stream().map(Long.class::cast).toList();
        GuardedResult<Integer> result = safetyGuard.execute(plan, config,
            () -> recordStore.deleteLedgerTransactions(sorted));
        log.info("Purged {} ledger transaction(s) into snapshot {}: {}", result.getValue(),
            result.snapshot().map(s -> s.getTableName()).orElse("-"), reason);
        return result;
    }

    private List<Long> validate(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("At least one ledger transaction id is required");
        }
        List<Long> sorted = new ArrayList<>(new TreeSet<>(ids));
        List<Long> linked = new ArrayList<>();
        for (Long id : sorted) {
            LedgerTransaction transaction = recordStore.findLedgerTransaction(id)
                .orElseThrow(() -> new IllegalArgumentException("Ledger transaction not found: " + id));
            if (transaction.isLinked()) {
                linked.add(id);
            }
        }
        if (!linked.isEmpty()) {
            throw new LinkConstraintViolationException(
                "Ledger transactions still linked, unlink them first: " + linked);
        }
        return sorted;
    }
}
