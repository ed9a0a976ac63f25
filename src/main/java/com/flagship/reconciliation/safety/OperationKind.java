package com.flagship.reconciliation.safety;

/**
 * Mutating operations the safety guard knows about. Destructive operations delete or
 * overwrite rows and therefore require a verified snapshot first.
 */
public enum OperationKind {
    LINK_APPLY(false),
    LINK_UNLINK(true),
    INGEST_LEDGER_TRANSACTIONS(false),
    INGEST_FINANCIAL_RECORDS(false),
    INGEST_AGGREGATES(false),
    PURGE_LEDGER_TRANSACTIONS(true),
    BALANCE_REPAIR(true);

    private final boolean destructive;

    OperationKind(boolean destructive) {
        this.destructive = destructive;
    }

    public boolean isDestructive() {
        return destructive;
    }
}
