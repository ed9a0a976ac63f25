package com.flagship.reconciliation.balance;

import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of checking every aggregate's cached balance against its links.
 */
@Value
public class BalanceAudit {
    Instant checkedAt;
    List<BalanceCheck> checks;

    public List<BalanceCheck> drifted() {
        return checks.stream().filter(BalanceCheck::isDrifted).toList();
    }

    public List<Long> driftedIds() {
        return drifted().stream().map(BalanceCheck::getAggregateId).toList();
    }

    public List<BalanceCheck> withStatus(BalanceStatus status) {
        return checks.stream().filter(check -> check.getStatus() == status).toList();
    }

    public Map<BalanceStatus, Long> countsByStatus() {
        return checks.stream().collect(Collectors.groupingBy(BalanceCheck::getStatus,
            () -> new EnumMap<>(BalanceStatus.class), Collectors.counting()));
    }

    public boolean isClean() {
        return drifted().isEmpty();
    }
}
