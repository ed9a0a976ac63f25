package com.flagship.reconciliation.record;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How much of one record family carries a ledger link. Amounts are absolute values.
 */
@Value
public class LinkCoverage {
    RecordFamily family;
    int matchedCount;
    BigDecimal matchedAmount;
    int unmatchedCount;
    BigDecimal unmatchedAmount;

    public int total() {
        return matchedCount + unmatchedCount;
    }

    /**
     * Percentage of rows linked, one decimal place; zero for an empty family.
     */
    @JsonProperty("matchRate")
    public BigDecimal matchRate() {
        if (total() == 0) {
            return BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(matchedCount * 100L)
            .divide(BigDecimal.valueOf(total()), 1, RoundingMode.HALF_UP);
    }
}
