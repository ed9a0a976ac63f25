package com.flagship.reconciliation.record;

/**
 * The two record families the engine reconciles against each other.
 */
public enum RecordFamily {
    /** Bank-reported ledger transactions. */
    LEDGER,
    /** Payments, deposits and refunds recorded by the business. */
    RECORDS;

    public RecordFamily counterpart() {
        return this == LEDGER ? RECORDS : LEDGER;
    }
}
