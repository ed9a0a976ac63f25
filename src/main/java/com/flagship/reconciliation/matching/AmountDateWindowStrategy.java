package com.flagship.reconciliation.matching;

/**
 * Exact amount, posted within the narrow date window.
 */
public class AmountDateWindowStrategy implements MatchingStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.AMOUNT_DATE_NARROW;
    }

    @Override
    public StrategyVerdict evaluate(CandidatePair pair, MatchingPolicy policy) {
        if (!pair.amountsEqual()) {
            return StrategyVerdict.reject(kind(), "amount differs by " + pair.amountDelta());
        }
        long days = pair.dateDistanceDays();
        if (days > policy.getNarrowWindowDays()) {
            return StrategyVerdict.reject(kind(), days + " days apart");
        }
        return StrategyVerdict.accept(kind(),
            String.format("amount %s exact, %d day(s) apart", pair.getLedger().getAmount().abs(), days));
    }
}
