package com.flagship.reconciliation.matching;

/**
 * Both sides carry the same externally issued key (legacy ledger id, processor reference).
 */
public class NaturalKeyStrategy implements MatchingStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.NATURAL_KEY;
    }

    @Override
    public StrategyVerdict evaluate(CandidatePair pair, MatchingPolicy policy) {
        String ledgerKey = pair.getLedger().getNaturalKey();
        String recordKey = pair.getRecord().getNaturalKey();
        if (ledgerKey == null || ledgerKey.isBlank() || recordKey == null || recordKey.isBlank()) {
            return StrategyVerdict.abstain(kind());
        }
        if (ledgerKey.trim().equalsIgnoreCase(recordKey.trim())) {
            return StrategyVerdict.accept(kind(), "natural key " + ledgerKey.trim());
        }
        return StrategyVerdict.reject(kind(), "natural keys differ");
    }
}
