package com.flagship.reconciliation.link;

import com.flagship.reconciliation.matching.StrategyKind;
import lombok.Value;

/**
 * A proposed link. Producing a plan never mutates anything; only
 * {@link LinkageLedger#apply} turns it into a persisted {@link Link}.
 */
@Value
public class LinkPlan {
    LinkKind kind;
    LinkType type;
    Long ledgerTransactionId;
    long financialRecordId;
    Long aggregateId;
    StrategyKind strategy;
    int confidence;
    String provenance;

    public static LinkPlan ledgerToRecord(long ledgerTransactionId, long financialRecordId, LinkType type,
                                          StrategyKind strategy, int confidence, String provenance) {
        return new LinkPlan(LinkKind.LEDGER_TO_RECORD, type, ledgerTransactionId, financialRecordId, null,
            strategy, confidence, provenance);
    }

    public static LinkPlan recordToAggregate(long financialRecordId, long aggregateId, LinkType type,
                                             int confidence, String provenance) {
        return new LinkPlan(LinkKind.RECORD_TO_AGGREGATE, type, null, financialRecordId, aggregateId,
            StrategyKind.NATURAL_KEY, confidence, provenance);
    }

    public String describe() {
        String counterpart = kind == LinkKind.LEDGER_TO_RECORD
            ? "ledger " + ledgerTransactionId
            : "aggregate " + aggregateId;
        return String.format("%s %s record %d <-> %s via %s (confidence %d)",
            type, kind, financialRecordId, counterpart, strategy, confidence);
    }
}
