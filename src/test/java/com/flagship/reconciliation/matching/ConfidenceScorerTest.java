package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.RecordNature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 10);

    private final ConfidenceScorer scorer = new ConfidenceScorer();
    private final MatchingPolicy policy = MatchingPolicy.defaults();

    @Test
    @DisplayName("Penalties never push a score into the tier below")
    void penaltyIsCapped() {
        // Given: an account match 30 days apart would lose 30 points uncapped
        CandidatePair pair = pair(1, "-80.00", DAY, 2, "80.00", DAY.plusDays(30));
        StrategyVerdict verdict = StrategyVerdict.accept(StrategyKind.AMOUNT_ACCOUNT_WIDE, "account");

        // When
        ScoredCandidate scored = scorer.score(pair, verdict, policy);

        // Then
        assertEquals(41, scored.getConfidence());
        assertTrue(scored.getProvenance().startsWith("AMOUNT_ACCOUNT_WIDE: "));
    }

    @Test
    @DisplayName("Natural-key matches carry no penalty")
    void naturalKeyHasNoPenalty() {
        CandidatePair pair = pair(1, "-80.00", DAY, 2, "70.00", DAY.plusDays(20));

        ScoredCandidate scored = scorer.score(pair,
            StrategyVerdict.accept(StrategyKind.NATURAL_KEY, "natural key"), policy);

        assertEquals(100, scored.getConfidence());
    }

    @Test
    @DisplayName("Description matches are penalised by text dissimilarity instead of amount")
    void descriptionPenaltyUsesSimilarity() {
        CandidatePair pair = pair(1, "-80.00", DAY, 2, "80.00", DAY.plusDays(2));

        ScoredCandidate scored = scorer.score(pair,
            StrategyVerdict.accept(StrategyKind.DESCRIPTION_PATTERN, 0.5, "similar"), policy);

        assertEquals(20 - 2 - 5, scored.getConfidence());
        assertEquals(0.5, scored.getTextSimilarity());
    }

    @Test
    @DisplayName("Only accepted verdicts can be scored")
    void rejectedVerdictCannotBeScored() {
        CandidatePair pair = pair(1, "-80.00", DAY, 2, "80.00", DAY);

        assertThrows(IllegalArgumentException.class, () -> scorer.score(pair,
            StrategyVerdict.reject(StrategyKind.AMOUNT_DATE_NARROW, "no"), policy));
    }

    @Test
    @DisplayName("Equal confidence is broken by date distance, then amount delta, then candidate id")
    void tieBreakOrder() {
        ScoredCandidate farther = candidate(pair(1, "-80.00", DAY, 5, "80.00", DAY.plusDays(2)), 70);
        ScoredCandidate closerHighId = candidate(pair(1, "-80.00", DAY, 9, "80.00", DAY.plusDays(1)), 70);
        ScoredCandidate closerLowId = candidate(pair(1, "-80.00", DAY, 3, "80.00", DAY.plusDays(1)), 70);
        ScoredCandidate closerBiggerDelta = candidate(pair(1, "-80.00", DAY, 1, "81.00", DAY.plusDays(1)), 70);

        CandidateRanking ranking = scorer.rank(List.of(farther, closerHighId, closerBiggerDelta, closerLowId), policy);

        assertEquals(List.of(3L, 9L, 1L, 5L),
            ranking.getRanked().stream().map(ScoredCandidate::candidateId).toList());
        assertFalse(ranking.isAutoApplyEligible());
    }

    @Test
    @DisplayName("The leader is eligible only with a margin of at least the tie margin")
    void tieMarginDecidesEligibility() {
        ScoredCandidate leader = candidate(pair(1, "-80.00", DAY, 2, "80.00", DAY), 80);
        ScoredCandidate closeRunnerUp = candidate(pair(1, "-80.00", DAY, 3, "80.00", DAY), 61);
        ScoredCandidate distantRunnerUp = candidate(pair(1, "-80.00", DAY, 4, "80.00", DAY), 60);

        assertFalse(scorer.rank(List.of(leader, closeRunnerUp), policy).isAutoApplyEligible());
        assertTrue(scorer.rank(List.of(distantRunnerUp, leader), policy).isAutoApplyEligible());
        assertTrue(scorer.rank(List.of(distantRunnerUp), policy).isAutoApplyEligible());
        assertTrue(scorer.rank(List.of(), policy).getRanked().isEmpty());
    }

    private static ScoredCandidate candidate(CandidatePair pair, int confidence) {
        return new ScoredCandidate(pair, StrategyKind.AMOUNT_DATE_NARROW, confidence, 0.0, "test");
    }

    private static CandidatePair pair(long ledgerId, String ledgerAmount, LocalDate ledgerDate,
                                      long recordId, String recordAmount, LocalDate recordDate) {
        return CandidatePair.forLedgerSubject(
            LedgerTransaction.of(ledgerId, "ACC-1", ledgerDate, new BigDecimal(ledgerAmount), null),
            FinancialRecord.of(recordId, recordDate, new BigDecimal(recordAmount), RecordNature.PAYMENT));
    }
}
