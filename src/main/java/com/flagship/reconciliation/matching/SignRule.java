package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;

/**
 * A financial record pairs only with a ledger transaction of the opposite sign:
 * a payment (+) with a bank debit (-), a refund (-) with a bank credit (+).
 * A mismatch is a rejection whatever strategy would otherwise accept.
 */
public final class SignRule {

    private SignRule() {
    }

    public static boolean compatible(LedgerTransaction ledger, FinancialRecord record) {
        return ledger.getAmount().signum() == -record.signedAmount().signum();
    }
}
