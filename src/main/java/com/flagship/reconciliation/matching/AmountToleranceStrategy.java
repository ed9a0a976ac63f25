package com.flagship.reconciliation.matching;

import java.math.BigDecimal;

/**
 * Same posting date, amount within the configured tolerance (currency conversion, rounding).
 */
public class AmountToleranceStrategy implements MatchingStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.AMOUNT_TOLERANCE_SAME_DATE;
    }

    @Override
    public StrategyVerdict evaluate(CandidatePair pair, MatchingPolicy policy) {
        if (pair.dateDistanceDays() != 0) {
            return StrategyVerdict.reject(kind(), "dates differ");
        }
        BigDecimal allowed = pair.getLedger().getAmount().abs().multiply(policy.getAmountTolerance());
        BigDecimal delta = pair.amountDelta();
        if (delta.compareTo(allowed) > 0) {
            return StrategyVerdict.reject(kind(), "amount delta " + delta + " exceeds tolerance " + allowed);
        }
        return StrategyVerdict.accept(kind(), "same date, amount within tolerance (delta " + delta + ")");
    }
}
