package com.flagship.reconciliation.matching;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Candidates in display order plus whether the leader is clear enough to apply automatically.
 */
@Value
public class CandidateRanking {
    List<ScoredCandidate> ranked;
    boolean autoApplyEligible;

    public static CandidateRanking empty() {
        return new CandidateRanking(List.of(), false);
    }

    public Optional<ScoredCandidate> top() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    public int size() {
        return ranked.size();
    }
}
