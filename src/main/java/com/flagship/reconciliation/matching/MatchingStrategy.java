package com.flagship.reconciliation.matching;

/**
 * One link in the matching chain. Implementations are stateless and never touch the record store.
 */
public interface MatchingStrategy {

    StrategyKind kind();

    StrategyVerdict evaluate(CandidatePair pair, MatchingPolicy policy);
}
