package com.flagship.reconciliation.matching;

import java.util.Optional;

/**
 * Last resort: exact amount plus a description hit, either through a shared alias
 * or through token similarity above the policy minimum.
 */
public class DescriptionPatternStrategy implements MatchingStrategy {

    private final AliasResolver aliasResolver;

    public DescriptionPatternStrategy(AliasResolver aliasResolver) {
        this.aliasResolver = aliasResolver;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.DESCRIPTION_PATTERN;
    }

    @Override
    public StrategyVerdict evaluate(CandidatePair pair, MatchingPolicy policy) {
        String ledgerText = pair.getLedger().getDescription();
        String recordText = pair.getRecord().getDescription();
        if (ledgerText == null || ledgerText.isBlank() || recordText == null || recordText.isBlank()) {
            return StrategyVerdict.abstain(kind());
        }
        if (!pair.amountsEqual()) {
            return StrategyVerdict.reject(kind(), "amount differs by " + pair.amountDelta());
        }
        if (pair.dateDistanceDays() > policy.getWideWindowDays()) {
            return StrategyVerdict.reject(kind(), "outside wide window");
        }

        Optional<String> ledgerAlias = aliasResolver.canonicalName(ledgerText);
        if (ledgerAlias.isPresent() && ledgerAlias.equals(aliasResolver.canonicalName(recordText))) {
            return StrategyVerdict.accept(kind(), 1.0, "alias " + ledgerAlias.get());
        }

        double similarity = TextSimilarity.jaccard(ledgerText, recordText);
        if (similarity >= policy.getMinTextSimilarity()) {
            return StrategyVerdict.accept(kind(), similarity,
                String.format("description similarity %.2f", similarity));
        }
        return StrategyVerdict.reject(kind(), String.format("description similarity %.2f", similarity));
    }
}
