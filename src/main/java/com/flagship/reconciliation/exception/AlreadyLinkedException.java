package com.flagship.reconciliation.exception;

import com.flagship.reconciliation.link.Link;
import com.flagship.reconciliation.link.LinkPlan;
import lombok.Getter;

/**
 * Raised when a link plan targets a record that already carries a different accepted link.
 * An identical existing link is not an error; see {@code LinkApplication#isAlreadySatisfied()}.
 */
@Getter
public class AlreadyLinkedException extends ReconciliationException {

    private final transient Link existingLink;
    private final transient LinkPlan rejectedPlan;

    public AlreadyLinkedException(Link existingLink, LinkPlan rejectedPlan) {
        super(String.format(
            "Record already linked: existing link %s (ledger=%s, record=%s, aggregate=%s) conflicts with plan %s",
            existingLink.getId(),
            existingLink.getLedgerTransactionId(),
            existingLink.getFinancialRecordId(),
            existingLink.getAggregateId(),
            rejectedPlan.describe()));
        this.existingLink = existingLink;
        this.rejectedPlan = rejectedPlan;
    }
}
