package com.flagship.reconciliation.matching;

public enum EvaluationMode {
    /** Stop at the first strategy tier that accepts at least one candidate. */
    FIRST_ACCEPT,
    /** Score every candidate under its best strategy, then rank all of them together. */
    COLLECT_ALL
}
