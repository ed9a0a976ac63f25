package com.flagship.reconciliation.matching;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converts strategy outcomes into confidence values and a deterministic ranking.
 *
 * Score = strategy tier minus linear penalties for date distance and amount delta
 * (description hits are penalised by their text dissimilarity instead of amount).
 * The total penalty is capped below one tier so secondary signals never reorder tiers.
 *
 * Pure: no state, no I/O.
 */
public class ConfidenceScorer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    static final Comparator<ScoredCandidate> RANKING_ORDER = Comparator
        .comparingInt(ScoredCandidate::getConfidence).reversed()
        .thenComparingLong(ScoredCandidate::dateDistanceDays)
        .thenComparing(ScoredCandidate::amountDelta)
        .thenComparingLong(ScoredCandidate::candidateId);

    public ScoredCandidate score(CandidatePair pair, StrategyVerdict verdict, MatchingPolicy policy) {
        if (!verdict.isAccepted()) {
            throw new IllegalArgumentException("Only accepted verdicts can be scored: " + verdict);
        }
        StrategyKind strategy = verdict.getStrategy();
        int confidence = strategy.tier();
        if (strategy != StrategyKind.NATURAL_KEY) {
            int penalty = Math.min(policy.maxPenalty(), penalty(pair, verdict, policy));
            confidence -= penalty;
        }
        return new ScoredCandidate(pair, strategy, confidence, verdict.getTextSimilarity(),
            strategy + ": " + verdict.getReason());
    }

    /**
     * Orders candidates by confidence, then smallest date distance, smallest amount delta and
     * lowest candidate id. The leader is auto-apply eligible when it beats the runner-up by at
     * least the policy tie margin.
     */
    public CandidateRanking rank(List<ScoredCandidate> candidates, MatchingPolicy policy) {
        if (candidates.isEmpty()) {
            return CandidateRanking.empty();
        }
        List<ScoredCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING_ORDER);
        boolean eligible = ranked.size() == 1
            || ranked.get(0).getConfidence() - ranked.get(1).getConfidence() >= policy.getTieMargin();
        return new CandidateRanking(List.copyOf(ranked), eligible);
    }

    private int penalty(CandidatePair pair, StrategyVerdict verdict, MatchingPolicy policy) {
        long datePenalty = pair.dateDistanceDays() * policy.getDatePenaltyPerDay();
        long secondary;
        if (verdict.getStrategy() == StrategyKind.DESCRIPTION_PATTERN) {
            secondary = Math.round((1.0 - verdict.getTextSimilarity()) * 10);
        } else {
            secondary = amountPercentDelta(pair) * policy.getAmountPenaltyPerPercent();
        }
        return (int) Math.min(Integer.MAX_VALUE, datePenalty + secondary);
    }

    private long amountPercentDelta(CandidatePair pair) {
        BigDecimal base = pair.getLedger().getAmount().abs();
        if (base.signum() == 0 || pair.amountsEqual()) {
            return 0;
        }
        return pair.amountDelta()
            .multiply(HUNDRED)
            .divide(base, 0, RoundingMode.CEILING)
            .longValue();
    }
}
