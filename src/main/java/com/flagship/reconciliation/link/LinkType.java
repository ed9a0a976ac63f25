package com.flagship.reconciliation.link;

/**
 * SETTLEMENT links count towards an aggregate's paid amount. HISTORICAL links
 * are kept for audit completeness on cancelled aggregates and never affect a balance.
 */
public enum LinkType {
    SETTLEMENT,
    HISTORICAL
}
