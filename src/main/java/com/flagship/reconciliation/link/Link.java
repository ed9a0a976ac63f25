package com.flagship.reconciliation.link;

import com.flagship.reconciliation.matching.StrategyKind;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An accepted association, either ledger transaction to financial record or
 * financial record to aggregate.
 */
@Value
public class Link {
    UUID id;
    LinkKind kind;
    LinkType type;
    Long ledgerTransactionId;
    long financialRecordId;
    Long aggregateId;
    StrategyKind strategy;
    int confidence;
    String provenance;
    UUID runId;
    Instant createdAt;

    static Link fromPlan(UUID id, LinkPlan plan, UUID runId) {
        return new Link(id, plan.getKind(), plan.getType(), plan.getLedgerTransactionId(),
            plan.getFinancialRecordId(), plan.getAggregateId(), plan.getStrategy(), plan.getConfidence(),
            plan.getProvenance(), runId, null);
    }

    /**
     * Whether this link already associates the same two records the plan proposes.
     */
    public boolean samePairAs(LinkPlan plan) {
        return kind == plan.getKind()
            && financialRecordId == plan.getFinancialRecordId()
            && Objects.equals(ledgerTransactionId, plan.getLedgerTransactionId())
            && Objects.equals(aggregateId, plan.getAggregateId());
    }
}
