package com.flagship.reconciliation.run;

public enum RunOperation {
    MATCH,
    LINK_AGGREGATES
}
