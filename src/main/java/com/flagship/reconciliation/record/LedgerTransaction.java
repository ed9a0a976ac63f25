package com.flagship.reconciliation.record;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One bank-reported movement of money.
 *
 * Immutable once imported. The only column that changes afterwards is the
 * back-reference to the accepted link, maintained by the linkage ledger.
 */
@Value
public class LedgerTransaction {
    long id;
    String accountId;
    LocalDate postingDate;
    BigDecimal amount;
    String description;
    String naturalKey;
    String originReference;
    UUID linkId;

    public static LedgerTransaction of(long id, String accountId, LocalDate postingDate,
                                       BigDecimal amount, String description) {
        return new LedgerTransaction(id, accountId, postingDate, amount, description, null, null, null);
    }

    public LedgerTransaction withNaturalKey(String key) {
        return new LedgerTransaction(id, accountId, postingDate, amount, description, key, originReference, linkId);
    }

    public boolean isLinked() {
        return linkId != null;
    }
}
