package com.flagship.reconciliation.matching;

/**
 * Matching strategies in fixed priority order, each with its base confidence tier.
 */
public enum StrategyKind {
    NATURAL_KEY(100),
    AMOUNT_DATE_NARROW(80),
    AMOUNT_ACCOUNT_WIDE(60),
    AMOUNT_TOLERANCE_SAME_DATE(40),
    DESCRIPTION_PATTERN(20);

    private final int tier;

    StrategyKind(int tier) {
        this.tier = tier;
    }

    public int tier() {
        return tier;
    }
}
