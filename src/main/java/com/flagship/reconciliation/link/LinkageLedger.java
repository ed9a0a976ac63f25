package com.flagship.reconciliation.link;

import com.flagship.reconciliation.balance.AggregateBalance;
import com.flagship.reconciliation.balance.BalanceRecalculator;
import com.flagship.reconciliation.exception.AlreadyLinkedException;
import com.flagship.reconciliation.exception.LinkConstraintViolationException;
import com.flagship.reconciliation.matching.ScoredCandidate;
import com.flagship.reconciliation.matching.SignRule;
import com.flagship.reconciliation.matching.StrategyKind;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
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
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The durable record of accepted links; the only component that writes the links table,
 * the ledger back-reference and a financial record's aggregate reference.
 *
 * Invariants:
 * - at most one link per ledger transaction
 * - at most one link per (financial record, link kind)
 * - re-applying an identical plan is a no-op success
 * - every apply and unlink recalculates the affected aggregate in the same transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkageLedger {

    static final String LINKS_TABLE = "links";
    static final String LEDGER_TABLE = "ledger_transactions";
    static final String RECORDS_TABLE = "financial_records";
    static final String AGGREGATES_TABLE = "aggregates";

    private final LinkRepository linkRepository;
    private final RecordStore recordStore;
    private final SafetyGuard safetyGuard;
    private final BalanceRecalculator balanceRecalculator;
    private final ReconciliationMetrics metrics;

    /**
     * Turns a ranked candidate into a plan. Reads only.
     */
    @Transactional(readOnly = true)
    public LinkPlan propose(ScoredCandidate candidate) {
        LedgerTransaction ledger = candidate.getPair().getLedger();
        FinancialRecord record = candidate.getPair().getRecord();
        return propose(ledger.getId(), record, candidate.getStrategy(), candidate.getConfidence(),
            candidate.getProvenance());
    }

    @Transactional(readOnly = true)
    public LinkPlan propose(long ledgerTransactionId, FinancialRecord record, StrategyKind strategy,
                            int confidence, String provenance) {
        return LinkPlan.ledgerToRecord(ledgerTransactionId, record.getId(), typeFor(record.getAggregateId()),
            strategy, confidence, provenance);
    }

    public LinkPlan proposeAggregateLink(FinancialRecord record, Aggregate aggregate) {
        LinkType type = aggregate.isCancelled() ? LinkType.HISTORICAL : LinkType.SETTLEMENT;
        return LinkPlan.recordToAggregate(record.getId(), aggregate.getId(), type,
            StrategyKind.NATURAL_KEY.tier(), "reserve number " + aggregate.getReserveNumber());
    }

    /**
     * Applies a plan through the safety guard.
     *
     * @return the new link, or the existing identical one flagged as already satisfied
     * @throws AlreadyLinkedException if either side already carries a different link
     * @throws LinkConstraintViolationException if the plan references missing or sign-incompatible rows
     */
    @Transactional
    public LinkApplication apply(LinkPlan plan, RunConfig config) {
        Optional<Link> existing = findExisting(plan);
        if (existing.isPresent()) {
            Link link = existing.get();
            if (link.samePairAs(plan)) {
                metrics.incrementAlreadySatisfied();
                log.debug("Plan already satisfied by link {}: {}", link.getId(), plan.describe());
                return LinkApplication.satisfied(link);
            }
            throw new AlreadyLinkedException(link, plan);
        }
        validateReferences(plan);

        UUID linkId = UUID.randomUUID();
        OperationPlan operation = safetyGuard.plan(OperationKind.LINK_APPLY, LINKS_TABLE,
                RowCondition.idIn(List.of(linkId)), plan.describe())
            .withRelated(LEDGER_TABLE, plan.getLedgerTransactionId())
            .withRelated(RECORDS_TABLE, plan.getFinancialRecordId())
            .withRelated(AGGREGATES_TABLE, plan.getAggregateId());
        GuardedResult<LinkApplication> result = safetyGuard.execute(operation, config,
            () -> write(linkId, plan, config.getRunId()));

        Link link = result.getValue().getLink();
        metrics.recordLinkApplied(link.getKind().name(), link.getStrategy().name());
        log.info("Linked {} (link {})", plan.describe(), link.getId());
        return result.getValue();
    }

    /**
     * Removes a link after snapshotting its row, clears the back-reference it set and
     * recalculates the affected aggregate.
     *
     * @return the audit entry describing the unlink
     */
    @Transactional
    public AuditEntry unlink(UUID linkId, String reason, RunConfig config) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("An unlink reason is required");
        }
        Link link = findById(linkId)
            .orElseThrow(() -> new IllegalArgumentException("Link not found: " + linkId));

        OperationPlan operation = safetyGuard.plan(OperationKind.LINK_UNLINK, LINKS_TABLE,
                RowCondition.idIn(List.of(linkId)), reason.trim())
            .withRelated(LEDGER_TABLE, link.getLedgerTransactionId())
            .withRelated(RECORDS_TABLE, link.getFinancialRecordId())
            .withRelated(AGGREGATES_TABLE, link.getAggregateId());
        GuardedResult<Link> result = safetyGuard.execute(operation, config, () -> remove(link));

        metrics.incrementUnlinks();
        log.info("Unlinked {} (record {}, snapshot {}): {}", linkId, link.getFinancialRecordId(),
            result.snapshot().map(s -> s.getTableName()).orElse("-"), reason.trim());
        return result.getAuditEntry();
    }

    @Transactional(readOnly = true)
    public Optional<Link> findById(UUID linkId) {
        return linkRepository.findById(linkId).map(LinkEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Link> findForLedgerTransaction(long ledgerTransactionId) {
        return linkRepository.findByLedgerTransactionId(ledgerTransactionId).map(LinkEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Link> findForFinancialRecord(long financialRecordId) {
        return linkRepository.findByFinancialRecordIdOrderByCreatedAt(financialRecordId).stream()
            .map(LinkEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Link> findByRun(UUID runId) {
        return linkRepository.findByRunIdOrderByCreatedAt(runId).stream()
            .map(LinkEntity::toDomain)
            .toList();
    }

    private Optional<Link> findExisting(LinkPlan plan) {
        if (plan.getKind() == LinkKind.LEDGER_TO_RECORD) {
            Optional<Link> byLedger = linkRepository.findByLedgerTransactionId(plan.getLedgerTransactionId())
                .map(LinkEntity::toDomain);
            if (byLedger.isPresent()) {
                return byLedger;
            }
        }
        return linkRepository.findByFinancialRecordIdAndLinkKind(plan.getFinancialRecordId(), plan.getKind())
            .map(LinkEntity::toDomain);
    }

    private void validateReferences(LinkPlan plan) {
        FinancialRecord record = recordStore.findFinancialRecord(plan.getFinancialRecordId())
            .orElseThrow(() -> new LinkConstraintViolationException(
                "Financial record not found: " + plan.getFinancialRecordId()));

        if (plan.getKind() == LinkKind.LEDGER_TO_RECORD) {
            LedgerTransaction ledger = recordStore.findLedgerTransaction(plan.getLedgerTransactionId())
                .orElseThrow(() -> new LinkConstraintViolationException(
                    "Ledger transaction not found: " + plan.getLedgerTransactionId()));
            if (!SignRule.compatible(ledger, record)) {
                throw new LinkConstraintViolationException(String.format(
                    "Sign mismatch: ledger %d amount %s cannot settle record %d amount %s (%s)",
                    ledger.getId(), ledger.getAmount(), record.getId(), record.getAmount(), record.getNature()));
            }
            return;
        }

        if (plan.getAggregateId() == null || !recordStore.aggregateExists(plan.getAggregateId())) {
            throw new LinkConstraintViolationException("Aggregate not found: " + plan.getAggregateId());
        }
        if (record.getAggregateId() != null && !record.getAggregateId().equals(plan.getAggregateId())) {
            throw new LinkConstraintViolationException(String.format(
                "Financial record %d already references aggregate %d", record.getId(), record.getAggregateId()));
        }
    }

    private LinkApplication write(UUID linkId, LinkPlan plan, UUID runId) {
        LinkEntity saved;
        try {
            saved = linkRepository.saveAndFlush(LinkEntity.fromDomain(Link.fromPlan(linkId, plan, runId)));
        } catch (DataIntegrityViolationException e) {
            throw new LinkConstraintViolationException("Links table rejected " + plan.describe(), e);
        }

        Long aggregateId;
        if (plan.getKind() == LinkKind.LEDGER_TO_RECORD) {
            recordStore.setLedgerLinkReference(plan.getLedgerTransactionId(), linkId);
            aggregateId = recordAggregate(plan.getFinancialRecordId());
        } else {
            recordStore.assignAggregate(plan.getFinancialRecordId(), plan.getAggregateId());
            aggregateId = plan.getAggregateId();
        }

        AggregateBalance balance = aggregateId == null ? null : balanceRecalculator.recalculate(aggregateId);
        return LinkApplication.created(saved.toDomain(), balance);
    }

    private Link remove(Link link) {
        Long aggregateId = link.getKind() == LinkKind.RECORD_TO_AGGREGATE
            ? link.getAggregateId()
            : recordAggregate(link.getFinancialRecordId());

        linkRepository.deleteById(link.getId());
        linkRepository.flush();

        if (link.getKind() == LinkKind.LEDGER_TO_RECORD) {
            recordStore.clearLedgerLinkReference(link.getLedgerTransactionId());
        } else {
            recordStore.clearAggregate(link.getFinancialRecordId());
        }

        if (aggregateId != null) {
            balanceRecalculator.recalculate(aggregateId);
        }
        return link;
    }

    private Long recordAggregate(long financialRecordId) {
        return recordStore.findFinancialRecord(financialRecordId)
            .map(FinancialRecord::getAggregateId)
            .orElse(null);
    }

    private LinkType typeFor(Long aggregateId) {
        if (aggregateId == null) {
            return LinkType.SETTLEMENT;
        }
        return recordStore.findAggregate(aggregateId)
            .filter(Aggregate::isCancelled)
            .map(aggregate -> LinkType.HISTORICAL)
            .orElse(LinkType.SETTLEMENT);
    }
}
