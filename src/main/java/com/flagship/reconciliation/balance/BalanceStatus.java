package com.flagship.reconciliation.balance;

import java.math.BigDecimal;

/**
 * Where an aggregate stands once its balance has been derived from the link set.
 */
public enum BalanceStatus {
    SETTLED,
    PARTIALLY_PAID,
    /** Something is owed and nothing has been paid. */
    UNPAID,
    /** Paid more than owed. */
    OVERPAID,
    /** Cancelled aggregates carry only historical links. */
    CANCELLED;

    static BalanceStatus classify(boolean cancelled, BigDecimal owed, BigDecimal paid) {
        if (cancelled) {
            return CANCELLED;
        }
        if (paid.compareTo(owed) > 0) {
            return OVERPAID;
        }
        if (owed.signum() > 0 && paid.signum() == 0) {
            return UNPAID;
        }
        return paid.compareTo(owed) == 0 ? SETTLED : PARTIALLY_PAID;
    }
}
