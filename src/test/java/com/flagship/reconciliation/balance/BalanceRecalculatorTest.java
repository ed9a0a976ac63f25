package com.flagship.reconciliation.balance;

import com.flagship.reconciliation.exception.OverrideTokenRequiredException;
import com.flagship.reconciliation.exception.WriteModeRequiredException;
import com.flagship.reconciliation.link.LinkPlan;
import com.flagship.reconciliation.link.LinkType;
import com.flagship.reconciliation.link.LinkageLedger;
import com.flagship.reconciliation.matching.StrategyKind;
import com.flagship.reconciliation.record.Aggregate;
import com.flagship.reconciliation.record.RecordStore;
import com.flagship.reconciliation.run.AggregateLinker;
import com.flagship.reconciliation.safety.AuditEntry;
import com.flagship.reconciliation.safety.AuditLogService;
import com.flagship.reconciliation.safety.AuditOutcome;
import com.flagship.reconciliation.safety.OperationKind;
import com.flagship.reconciliation.safety.RunConfig;
import com.flagship.reconciliation.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BalanceRecalculatorTest extends IntegrationTestSupport {

    @Autowired
    private BalanceRecalculator balanceRecalculator;

    @Autowired
    private LinkageLedger linkageLedger;

    @Autowired
    private AggregateLinker aggregateLinker;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private RecordStore recordStore;

    @Test
    @DisplayName("Refunds reduce the paid amount and only settled records count")
    void refundsAndUnsettledRecords() {
        // Given: charter owed 500.00 with a payment, a refund and a payment never seen at the bank
        givenAggregates(Aggregate.open(1, "020011", AUG_13, new BigDecimal("500.00")));
        givenRecords(
            payment(11, "300.00", AUG_13).withAggregate(1L),
            refund(12, "50.00", AUG_13).withAggregate(1L),
            payment(13, "100.00", AUG_13).withAggregate(1L));
        givenLedger(ledger(1, "-300.00", AUG_13), ledger(2, "50.00", AUG_13));

        // When
        settle(1, 11);
        settle(2, 12);

        // Then
        AggregateBalance balance = balanceRecalculator.compute(1);
        assertEquals(new BigDecimal("250.00"), balance.getAmountPaid());
        assertEquals(new BigDecimal("250.00"), balance.getBalance());
        assertFalse(balance.isSettled());
        assertEquals(0, new BigDecimal("250.00").compareTo(balanceOf(1)));
    }

    @Test
    @DisplayName("Recalculating an aggregate without links resets a stale cache")
    void recalculateResetsStaleCache() {
        givenAggregates(Aggregate.open(1, "020012", AUG_13, new BigDecimal("120.00")));
        jdbcTemplate.update("UPDATE aggregates SET amount_paid = 999.99, balance = -879.99 WHERE id = 1");

        AggregateBalance balance = balanceRecalculator.recalculate(1);

        assertEquals(new BigDecimal("0.00"), balance.getAmountPaid());
        assertEquals(new BigDecimal("120.00"), balance.getBalance());
        assertEquals(0, new BigDecimal("120.00").compareTo(balanceOf(1)));
    }

    @Test
    @DisplayName("An unknown aggregate is an error")
    void unknownAggregate() {
        assertThrows(IllegalArgumentException.class, () -> balanceRecalculator.compute(404));
    }

    @Test
    @DisplayName("A cancelled charter stays unpaid when its bank-linked payment is then linked by reserve number")
    void cancelledCharterBankLinkFirst() {
        // Given: a cancelled charter whose payment cleared the bank before the charter was linked
        givenCancelledCharterWithPayment();
        settle(1, 12);
        assertEquals(0, new BigDecimal("0.00").compareTo(amountPaidOf(2)));

        // When
        aggregateLinker.linkAll(RunConfig.write());

        // Then
        assertEquals(LinkType.HISTORICAL, linkageLedger.findForFinancialRecord(12).stream()
            .filter(link -> link.getAggregateId() != null).findFirst().orElseThrow().getType());
        assertEquals(0, new BigDecimal("0.00").compareTo(amountPaidOf(2)));
        assertEquals(0, new BigDecimal("300.00").compareTo(balanceOf(2)));
        assertEquals(new BigDecimal("0.00"), balanceRecalculator.compute(2).getAmountPaid());
    }

    @Test
    @DisplayName("A cancelled charter stays unpaid when its payment is linked by reserve number and then cleared at the bank")
    void cancelledCharterAggregateLinkFirst() {
        // Given
        givenCancelledCharterWithPayment();
        aggregateLinker.linkAll(RunConfig.write());

        // When
        LinkPlan plan = linkageLedger.propose(1, recordStore.findFinancialRecord(12).orElseThrow(),
            StrategyKind.AMOUNT_DATE_NARROW, 80, "exact");
        linkageLedger.apply(plan, RunConfig.write());

        // Then
        assertEquals(LinkType.HISTORICAL, linkageLedger.findForLedgerTransaction(1).orElseThrow().getType());
        assertEquals(0, new BigDecimal("0.00").compareTo(amountPaidOf(2)));
        assertEquals(0, new BigDecimal("300.00").compareTo(balanceOf(2)));
    }

    @Test
    @DisplayName("Verifying balances flags drifted, unpaid and overpaid charters without writing")
    void verifyAllFlagsDriftAndStatus() {
        // Given: charter 1 settled, charter 2 unpaid, charter 3 overpaid, charter 4 cancelled
        givenAggregates(
            Aggregate.open(1, "020021", AUG_13, new BigDecimal("100.00")),
            Aggregate.open(2, "020022", AUG_13, new BigDecimal("200.00")),
            Aggregate.open(3, "020023", AUG_13, new BigDecimal("50.00")),
            Aggregate.cancelled(4, "020024", AUG_13, new BigDecimal("75.00")));
        givenRecords(
            payment(11, "100.00", AUG_13).withAggregate(1L),
            payment(13, "80.00", AUG_13).withAggregate(3L));
        givenLedger(ledger(1, "-100.00", AUG_13), ledger(3, "-80.00", AUG_13));
        settle(1, 11);
        settle(3, 13);
        jdbcTemplate.update("UPDATE aggregates SET amount_paid = 0, balance = 100.00 WHERE id = 1");
        int auditRows = count("audit_log");

        // When
        BalanceAudit audit = balanceRecalculator.verifyAll();

        // Then
        assertEquals(4, audit.getChecks().size());
        assertEquals(List.of(1L), audit.driftedIds());
        assertFalse(audit.isClean());
        assertEquals(BalanceStatus.SETTLED, audit.getChecks().get(0).getStatus());
        assertEquals(BalanceStatus.UNPAID, audit.getChecks().get(1).getStatus());
        assertEquals(BalanceStatus.OVERPAID, audit.getChecks().get(2).getStatus());
        assertEquals(BalanceStatus.CANCELLED, audit.getChecks().get(3).getStatus());
        assertEquals(new BigDecimal("-30.00"), audit.getChecks().get(2).getComputedBalance());
        assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(1)));
        assertEquals(auditRows, count("audit_log"));
    }

    @Test
    @DisplayName("Repairing drifted balances needs write mode and the day's override key")
    void repairDriftIsGuarded() {
        // Given
        givenAggregates(Aggregate.open(1, "020031", AUG_13, new BigDecimal("120.00")));
        jdbcTemplate.update("UPDATE aggregates SET amount_paid = 20.00, balance = 100.00 WHERE id = 1");

        // When / Then
        assertThrows(WriteModeRequiredException.class, () -> balanceRecalculator.repairDrift(RunConfig.dryRun()));
        assertThrows(OverrideTokenRequiredException.class, () -> balanceRecalculator.repairDrift(RunConfig.write()));

        assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(1)));
        List<AuditEntry> audits = auditLogService.findByOperationKind(OperationKind.BALANCE_REPAIR);
        assertEquals(1, audits.size());
        assertEquals(AuditOutcome.ABORTED, audits.get(0).getOutcome());
        assertEquals(0, count("snapshots"));
    }

    @Test
    @DisplayName("Repairing drifted balances snapshots the drifted rows and rewrites only those")
    void repairDriftRewritesDriftedRows() {
        // Given
        givenAggregates(
            Aggregate.open(1, "020041", AUG_13, new BigDecimal("120.00")),
            Aggregate.open(2, "020042", AUG_13, new BigDecimal("60.00")));
        jdbcTemplate.update("UPDATE aggregates SET amount_paid = 20.00, balance = 100.00 WHERE id = 1");

        // When
        BalanceRepair repair = balanceRecalculator.repairDrift(RunConfig.write(writeToken("aggregates")));

        // Then
        assertEquals(List.of(1L), repair.getBefore().driftedIds());
        assertEquals(1, repair.getRepaired().size());
        assertEquals(new BigDecimal("120.00"), repair.getRepaired().get(0).getBalance());
        assertEquals(0, new BigDecimal("120.00").compareTo(balanceOf(1)));

        AuditEntry entry = repair.audit().orElseThrow();
        assertEquals(AuditOutcome.SUCCESS, entry.getOutcome());
        assertEquals(List.of("1"), entry.getRecordIds());
        assertNotNull(entry.getSnapshotName());
        assertEquals(1, count(entry.getSnapshotName()));
        assertTrue(balanceRecalculator.verifyAll().isClean());
    }

    @Test
    @DisplayName("Repairing with no drift plans nothing and writes no audit entry")
    void repairWithoutDriftIsNoop() {
        givenAggregates(Aggregate.open(1, "020051", AUG_13, new BigDecimal("120.00")));

        BalanceRepair repair = balanceRecalculator.repairDrift(RunConfig.dryRun());

        assertTrue(repair.getRepaired().isEmpty());
        assertTrue(repair.audit().isEmpty());
        assertTrue(auditLogService.findByOperationKind(OperationKind.BALANCE_REPAIR).isEmpty());
    }

    private void givenCancelledCharterWithPayment() {
        givenAggregates(Aggregate.cancelled(2, "019240", AUG_13, new BigDecimal("300.00")));
        givenRecords(payment(12, "300.00", AUG_13).withReserveNumber("019240"));
        givenLedger(ledger(1, "-300.00", AUG_13));
    }

    private void settle(long ledgerId, long recordId) {
        linkageLedger.apply(LinkPlan.ledgerToRecord(ledgerId, recordId, LinkType.SETTLEMENT,
            StrategyKind.AMOUNT_DATE_NARROW, 80, "exact"), RunConfig.write());
    }
}
