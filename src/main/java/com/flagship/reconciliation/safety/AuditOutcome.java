package com.flagship.reconciliation.safety;

public enum AuditOutcome {
    SUCCESS,
    FAILURE,
    ABORTED
}
