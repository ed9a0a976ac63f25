package com.flagship.reconciliation.exception;

/**
 * The pre-mutation snapshot could not be created or verified. The guarded mutation is aborted.
 */
public class SnapshotFailureException extends ReconciliationException {

    public SnapshotFailureException(String message) {
        super(message);
    }

    public SnapshotFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
