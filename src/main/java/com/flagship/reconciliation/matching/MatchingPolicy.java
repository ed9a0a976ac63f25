package com.flagship.reconciliation.matching;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable matching parameters for one run.
 */
@Value
@Builder(toBuilder = true)
public class MatchingPolicy {
    @Builder.Default
    int narrowWindowDays = 3;
    @Builder.Default
    int intermediateWindowDays = 7;
    @Builder.Default
    int wideWindowDays = 30;
    @Builder.Default
    BigDecimal amountTolerance = new BigDecimal("0.05");
    @Builder.Default
    int maxCandidates = 50;
    @Builder.Default
    int autoApplyThreshold = 40;
    @Builder.Default
    int tieMargin = 20;
    @Builder.Default
    int datePenaltyPerDay = 1;
    @Builder.Default
    int amountPenaltyPerPercent = 2;
    @Builder.Default
    double minTextSimilarity = 0.30;
    @Builder.Default
    EvaluationMode evaluationMode = EvaluationMode.FIRST_ACCEPT;

    public static MatchingPolicy defaults() {
        return MatchingPolicy.builder().build();
    }

    /**
     * Candidate generation passes, narrowest first.
     */
    public List<Integer> dateWindows() {
        return List.of(narrowWindowDays, intermediateWindowDays, wideWindowDays).stream()
            .distinct()
            .sorted()
            .toList();
    }

    /**
     * Largest penalty a secondary signal may subtract without dropping a score into the next tier.
     */
    public int maxPenalty() {
        return Math.max(0, tieMargin - 1);
    }
}
