package com.flagship.reconciliation.exception;

public class LinkConstraintViolationException extends ReconciliationException {

    public LinkConstraintViolationException(String message) {
        super(message);
    }

    public LinkConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
