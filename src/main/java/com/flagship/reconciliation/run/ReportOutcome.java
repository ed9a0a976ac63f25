package com.flagship.reconciliation.run;

/**
 * Per-record outcome category of a run.
 */
public enum ReportOutcome {
    APPLIED,
    ALREADY_SATISFIED,
    PLANNED,
    BELOW_THRESHOLD,
    AMBIGUOUS,
    NO_CANDIDATE,
    CONFLICT,
    FAILED,
    DEFERRED;

    /**
     * Outcomes that need a later run or a human to settle the record.
     */
    public boolean isUnresolved() {
        return this == BELOW_THRESHOLD || this == AMBIGUOUS || this == NO_CANDIDATE || this == CONFLICT;
    }
}
