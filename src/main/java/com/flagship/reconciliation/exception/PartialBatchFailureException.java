package com.flagship.reconciliation.exception;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.Getter;

/**
 * One record's apply-and-recalculate unit failed and was rolled back. The batch carries on.
 */
@Getter
public class PartialBatchFailureException extends ReconciliationException {

    private final RecordFamily family;
    private final long recordId;

    public PartialBatchFailureException(RecordFamily family, long recordId, Throwable cause) {
        super(String.format("Reconciliation of %s record %d failed and was rolled back: %s",
            family, recordId, cause.getMessage()), cause);
        this.family = family;
        this.recordId = recordId;
    }
}
