package com.flagship.reconciliation.exception;

/**
 * Base type for every failure the reconciliation engine surfaces to an operator.
 * Input validation problems keep using {@link IllegalArgumentException}.
 */
public abstract class ReconciliationException extends RuntimeException {

    protected ReconciliationException(String message) {
        super(message);
    }

    protected ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
