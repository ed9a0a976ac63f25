package com.flagship.reconciliation.matching;

public enum Verdict {
    ACCEPT,
    REJECT,
    /** The strategy has nothing to say about this pair (e.g. no natural key on either side). */
    ABSTAIN
}
