package com.flagship.reconciliation.exception;

public class OverrideTokenRequiredException extends ReconciliationException {

    public OverrideTokenRequiredException(String table, String expectedFormat) {
        super(String.format("PROTECTED: destructive change to %s requires --override-key=%s", table, expectedFormat));
    }
}
