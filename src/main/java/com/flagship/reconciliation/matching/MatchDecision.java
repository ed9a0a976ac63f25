package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Terminal outcome of evaluating one subject record against its candidates.
 */
@Value
public class MatchDecision {
    RecordFamily subjectFamily;
    long subjectId;
    MatchState state;
    List<ScoredCandidate> ranked;
    boolean meetsThreshold;

    static MatchDecision noCandidate(RecordFamily family, long subjectId) {
        return new MatchDecision(family, subjectId, MatchState.NO_CANDIDATE, List.of(), false);
    }

    static MatchDecision ambiguous(RecordFamily family, long subjectId, List<ScoredCandidate> ranked) {
        return new MatchDecision(family, subjectId, MatchState.AMBIGUOUS, ranked, false);
    }

    static MatchDecision matched(RecordFamily family, long subjectId, List<ScoredCandidate> ranked,
                                 int threshold) {
        return new MatchDecision(family, subjectId, MatchState.MATCHED, ranked,
            ranked.get(0).getConfidence() >= threshold);
    }

    public Optional<ScoredCandidate> best() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /**
     * Matched with a clear leader whose confidence clears the policy threshold.
     */
    public boolean isAutoApplicable() {
        return state == MatchState.MATCHED && meetsThreshold;
    }
}
