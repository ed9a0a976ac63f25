package com.flagship.reconciliation.record;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A charter: the business object whose balance is the reconciliation target.
 *
 * {@code amountPaid} and {@code balance} are a materialized cache written only by the
 * balance recalculator.
 */
@Value
public class Aggregate {
    long id;
    String reserveNumber;
    LocalDate charterDate;
    BigDecimal amountOwed;
    BigDecimal amountPaid;
    BigDecimal balance;
    boolean cancelled;

    public static Aggregate open(long id, String reserveNumber, LocalDate charterDate, BigDecimal amountOwed) {
        return new Aggregate(id, reserveNumber, charterDate, amountOwed, BigDecimal.ZERO, amountOwed, false);
    }

    public static Aggregate cancelled(long id, String reserveNumber, LocalDate charterDate, BigDecimal amountOwed) {
        return new Aggregate(id, reserveNumber, charterDate, amountOwed, BigDecimal.ZERO, amountOwed, true);
    }
}
