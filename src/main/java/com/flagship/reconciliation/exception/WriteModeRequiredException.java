package com.flagship.reconciliation.exception;

/**
 * A mutation was attempted by a run that did not opt into write mode.
 * Never downgraded to a silent no-op.
 */
public class WriteModeRequiredException extends ReconciliationException {

    public WriteModeRequiredException(String operation) {
        super("Write mode required for operation " + operation + "; re-run with --write to apply changes");
    }
}
