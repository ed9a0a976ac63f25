package com.flagship.reconciliation.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.reconciliation.record.Aggregate;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One aggregate's cached balance compared with the balance derived from its links.
 */
@Value
@JsonPropertyOrder({"aggregate_id", "reserve_number", "status", "drifted", "amount_owed",
    "stored_paid", "stored_balance", "computed_paid", "computed_balance"})
public class BalanceCheck {
    @JsonProperty("aggregate_id")
    long aggregateId;
    @JsonProperty("reserve_number")
    String reserveNumber;
    BalanceStatus status;
    boolean drifted;
    @JsonProperty("amount_owed")
    BigDecimal amountOwed;
    @JsonProperty("stored_paid")
    BigDecimal storedPaid;
    @JsonProperty("stored_balance")
    BigDecimal storedBalance;
    @JsonProperty("computed_paid")
    BigDecimal computedPaid;
    @JsonProperty("computed_balance")
    BigDecimal computedBalance;

    static BalanceCheck of(Aggregate stored, AggregateBalance computed) {
        boolean drifted = stored.getAmountPaid().compareTo(computed.getAmountPaid()) != 0
            || stored.getBalance().compareTo(computed.getBalance()) != 0;
        return new BalanceCheck(stored.getId(), stored.getReserveNumber(),
            BalanceStatus.classify(stored.isCancelled(), computed.getAmountOwed(), computed.getAmountPaid()),
            drifted, computed.getAmountOwed(), stored.getAmountPaid(), stored.getBalance(),
            computed.getAmountPaid(), computed.getBalance());
    }

    /**
     * Stored minus computed balance; zero when the cache is current.
     */
    public BigDecimal discrepancy() {
        return storedBalance.subtract(computedBalance);
    }
}
