package com.flagship.reconciliation.balance;

import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.record.Aggregate;
import com.flagship.reconciliation.record.RecordStore;
import com.flagship.reconciliation.safety.GuardedResult;
import com.flagship.reconciliation.safety.OperationKind;
import com.flagship.reconciliation.safety.OperationPlan;
import com.flagship.reconciliation.safety.RowCondition;
import com.flagship.reconciliation.safety.RunConfig;
import com.flagship.reconciliation.safety.SafetyGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;

/**
 * Re-derives an aggregate's paid amount and balance from the current link set.
 *
 * paid = Σ amount of non-refund records − Σ |amount| of refund records, over the
 * financial records referencing the aggregate that carry a SETTLEMENT link and no
 * HISTORICAL link. A cancelled aggregate has nothing but historical links, so its paid
 * amount is zero whatever type its links were given when they were written.
 * balance = owed − paid. Both rounded half-up to cents.
 *
 * The aggregate's amount_paid/balance columns are a cache of this computation and are
 * written nowhere else.
 */
@Service
@Slf4j
public class BalanceRecalculator {

    static final int CURRENCY_SCALE = 2;
    static final String AGGREGATES_TABLE = "aggregates";

    private static final String PAID_SQL =
        "SELECT COALESCE(SUM(CASE WHEN fr.nature = 'REFUND' OR fr.amount < 0 " +
        "THEN -ABS(fr.amount) ELSE fr.amount END), 0) " +
        "FROM financial_records fr " +
        "WHERE fr.aggregate_id = ? " +
        "AND EXISTS (SELECT 1 FROM links l WHERE l.financial_record_id = fr.id AND l.link_type = 'SETTLEMENT') " +
        "AND NOT EXISTS (SELECT 1 FROM links h WHERE h.financial_record_id = fr.id AND h.link_type = 'HISTORICAL')";

    private final JdbcTemplate jdbcTemplate;
    private final RecordStore recordStore;
    private final SafetyGuard safetyGuard;
    private final ReconciliationMetrics metrics;
    private final Clock clock;

    public BalanceRecalculator(JdbcTemplate jdbcTemplate, RecordStore recordStore, SafetyGuard safetyGuard,
                               ReconciliationMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.recordStore = recordStore;
        this.safetyGuard = safetyGuard;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Computes the balance without writing it.
     */
    @Transactional(readOnly = true)
    public AggregateBalance compute(long aggregateId) {
        Aggregate aggregate = recordStore.findAggregate(aggregateId)
            .orElseThrow(() -> new IllegalArgumentException("Aggregate not found: " + aggregateId));
        return compute(aggregate);
    }

    /**
     * Computes and stores the balance. Joins the caller's transaction so the cache update
     * commits together with the link change that triggered it.
     */
    @Transactional
    public AggregateBalance recalculate(long aggregateId) {
        AggregateBalance result = compute(aggregateId);
        recordStore.updateAggregateBalance(aggregateId, result.getAmountPaid(), result.getBalance());
        metrics.incrementBalancesRecalculated();
        log.debug("Aggregate {} recalculated: owed={} paid={} balance={}",
            aggregateId, result.getAmountOwed(), result.getAmountPaid(), result.getBalance());
        return result;
    }

    /**
     * Compares every aggregate's cached balance with the one derived from its links.
     * Reads only.
     */
    @Transactional(readOnly = true)
    public BalanceAudit verifyAll() {
        List<BalanceCheck> checks = recordStore.findAllAggregates().stream()
            .map(aggregate -> BalanceCheck.of(aggregate, compute(aggregate)))
            .toList();
        BalanceAudit audit = new BalanceAudit(clock.instant(), checks);

        int drifted = audit.drifted().size();
        metrics.recordBalanceDrift(drifted);
        log.info("Balance check over {} aggregate(s): {} drifted, {} unpaid, {} overpaid",
            checks.size(), drifted, audit.withStatus(BalanceStatus.UNPAID).size(),
            audit.withStatus(BalanceStatus.OVERPAID).size());
        audit.drifted().forEach(check -> log.warn("Aggregate {} ({}) drifted: stored balance {} computed {}",
            check.getAggregateId(), check.getReserveNumber(), check.getStoredBalance(), check.getComputedBalance()));
        return audit;
    }

    /**
     * Rewrites the cached balance of every drifted aggregate through the safety guard:
     * the drifted rows are snapshotted first and the repair is audited as one operation.
     * Nothing is planned when no aggregate has drifted.
     *
     * @throws com.flagship.reconciliation.exception.WriteModeRequiredException in a dry run with drift
     */
    @Transactional
    public BalanceRepair repairDrift(RunConfig config) {
        BalanceAudit before = verifyAll();
        List<Long> driftedIds = before.driftedIds();
        if (driftedIds.isEmpty()) {
            return new BalanceRepair(before, List.of(), null);
        }

        OperationPlan plan = safetyGuard.plan(OperationKind.BALANCE_REPAIR, AGGREGATES_TABLE,
            RowCondition.idIn(driftedIds), "recalculate " + driftedIds.size() + " drifted balance(s)");
        GuardedResult<List<AggregateBalance>> result = safetyGuard.execute(plan, config,
            () -> driftedIds.stream().map(this::recalculate).toList());

        log.info("Repaired {} drifted balance(s) (snapshot {})", driftedIds.size(),
            result.snapshot().map(s -> s.getTableName()).orElse("-"));
        return new BalanceRepair(before, result.getValue(), result.getAuditEntry());
    }

    private AggregateBalance compute(Aggregate aggregate) {
        BigDecimal paid = BigDecimal.ZERO;
        if (!aggregate.isCancelled()) {
            BigDecimal linked = jdbcTemplate.queryForObject(PAID_SQL, BigDecimal.class, aggregate.getId());
            paid = linked == null ? BigDecimal.ZERO : linked;
        }
        paid = paid.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
        BigDecimal owed = aggregate.getAmountOwed().setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
        return new AggregateBalance(aggregate.getId(), owed, paid, owed.subtract(paid));
    }
}
