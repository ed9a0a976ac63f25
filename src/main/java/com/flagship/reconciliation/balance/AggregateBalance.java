package com.flagship.reconciliation.balance;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class AggregateBalance {
    long aggregateId;
    BigDecimal amountOwed;
    BigDecimal amountPaid;
    BigDecimal balance;

    public boolean isSettled() {
        return balance.signum() == 0;
    }
}
