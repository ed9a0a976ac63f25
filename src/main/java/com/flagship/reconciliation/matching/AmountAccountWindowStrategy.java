package com.flagship.reconciliation.matching;

/**
 * Exact amount on the same bank account, anywhere inside the wide date window.
 */
public class AmountAccountWindowStrategy implements MatchingStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.AMOUNT_ACCOUNT_WIDE;
    }

    @Override
    public StrategyVerdict evaluate(CandidatePair pair, MatchingPolicy policy) {
        String recordAccount = pair.getRecord().getAccountId();
        if (recordAccount == null || recordAccount.isBlank()) {
            return StrategyVerdict.abstain(kind());
        }
        if (!recordAccount.trim().equals(pair.getLedger().getAccountId())) {
            return StrategyVerdict.reject(kind(), "account differs");
        }
        if (!pair.amountsEqual()) {
            return StrategyVerdict.reject(kind(), "amount differs by " + pair.amountDelta());
        }
        long days = pair.dateDistanceDays();
        if (days > policy.getWideWindowDays()) {
            return StrategyVerdict.reject(kind(), days + " days apart");
        }
        return StrategyVerdict.accept(kind(),
            String.format("amount exact on account %s, %d day(s) apart", recordAccount.trim(), days));
    }
}
