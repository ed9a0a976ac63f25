package com.flagship.reconciliation.link;

import com.flagship.reconciliation.balance.AggregateBalance;
import lombok.Value;

import java.util.Optional;

/**
 * Result of applying a plan. {@code alreadySatisfied} means an identical link existed
 * and nothing was written.
 */
@Value
public class LinkApplication {
    Link link;
    boolean alreadySatisfied;
    AggregateBalance balance;

    static LinkApplication created(Link link, AggregateBalance balance) {
        return new LinkApplication(link, false, balance);
    }

    static LinkApplication satisfied(Link existing) {
        return new LinkApplication(existing, true, null);
    }

    public Optional<AggregateBalance> recalculatedBalance() {
        return Optional.ofNullable(balance);
    }
}
