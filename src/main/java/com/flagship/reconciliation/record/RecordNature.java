package com.flagship.reconciliation.record;

public enum RecordNature {
    PAYMENT,
    DEPOSIT,
    REFUND
}
