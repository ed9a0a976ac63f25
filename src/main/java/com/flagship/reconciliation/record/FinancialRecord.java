package com.flagship.reconciliation.record;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A payment, deposit or refund tracked independently of the bank feed.
 *
 * The aggregate reference is only ever set through the linkage ledger.
 */
@Value
public class FinancialRecord {
    long id;
    LocalDate recordDate;
    BigDecimal amount;
    RecordNature nature;
    String naturalKey;
    String accountId;
    String description;
    String reserveNumber;
    Long aggregateId;
    String originReference;

    public static FinancialRecord of(long id, LocalDate recordDate, BigDecimal amount, RecordNature nature) {
        return new FinancialRecord(id, recordDate, amount, nature, null, null, null, null, null, null);
    }

    public FinancialRecord withNaturalKey(String key) {
        return new FinancialRecord(id, recordDate, amount, nature, key, accountId, description,
            reserveNumber, aggregateId, originReference);
    }

    public FinancialRecord withAccount(String account) {
        return new FinancialRecord(id, recordDate, amount, nature, naturalKey, account, description,
            reserveNumber, aggregateId, originReference);
    }

    public FinancialRecord withDescription(String text) {
        return new FinancialRecord(id, recordDate, amount, nature, naturalKey, accountId, text,
            reserveNumber, aggregateId, originReference);
    }

    public FinancialRecord withReserveNumber(String reserve) {
        return new FinancialRecord(id, recordDate, amount, nature, naturalKey, accountId, description,
            reserve, aggregateId, originReference);
    }

    public FinancialRecord withAggregate(Long aggregate) {
        return new FinancialRecord(id, recordDate, amount, nature, naturalKey, accountId, description,
            reserveNumber, aggregate, originReference);
    }

    /**
     * Refunds are recognised by nature or by a negative amount.
     */
    public boolean isRefund() {
        return nature == RecordNature.REFUND || amount.signum() < 0;
    }

    /**
     * Amount with the refund sign convention applied: refunds are always negative.
     */
    public BigDecimal signedAmount() {
        return isRefund() ? amount.abs().negate() : amount;
    }
}
