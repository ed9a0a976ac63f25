package com.flagship.reconciliation.record;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Typed lookup condition consumed by the record store.
 *
 * Amount bounds apply to the absolute amount so a single condition finds both
 * signs; sign compatibility is decided by the matching chain.
 */
@Value
@Builder(toBuilder = true)
public class MatchCondition {
    String accountId;
    BigDecimal minAbsAmount;
    BigDecimal maxAbsAmount;
    LocalDate fromDate;
    LocalDate toDate;
    String textPattern;
    @Builder.Default
    boolean excludeLinked = true;
    int limit;

    /**
     * Amount range around {@code amount} widened by {@code tolerance} (a fraction, e.g. 0.05),
     * dates within {@code windowDays} of {@code date}.
     */
    public static MatchCondition around(BigDecimal amount, BigDecimal tolerance, LocalDate date,
                                        int windowDays, int limit) {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(date, "date");
        if (windowDays < 0) {
            throw new IllegalArgumentException("Date window must not be negative: " + windowDays);
        }
        BigDecimal abs = amount.abs();
        BigDecimal slack = abs.multiply(tolerance == null ? BigDecimal.ZERO : tolerance);
        return MatchCondition.builder()
            .minAbsAmount(abs.subtract(slack))
            .maxAbsAmount(abs.add(slack))
            .fromDate(date.minusDays(windowDays))
            .toDate(date.plusDays(windowDays))
            .limit(limit)
            .build();
    }

    public MatchCondition forAccount(String account) {
        return toBuilder().accountId(account).build();
    }
}
