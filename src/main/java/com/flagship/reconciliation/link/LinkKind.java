package com.flagship.reconciliation.link;

/**
 * Which two records a link associates.
 */
public enum LinkKind {
    LEDGER_TO_RECORD,
    RECORD_TO_AGGREGATE
}
