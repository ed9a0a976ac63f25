package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.FinancialRecord;
import com.flagship.reconciliation.record.LedgerTransaction;
import com.flagship.reconciliation.record.RecordFamily;
import com.flagship.reconciliation.record.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Drives candidate generation and the strategy chain for one record, widening the date
 * window (narrow, intermediate, wide) only while the previous pass produced no candidate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchingEngine {

    private final RecordStore recordStore;
    private final CandidateGenerator candidateGenerator;
    private final MatchingStrategyChain strategyChain;

    public MatchDecision match(RecordFamily family, long subjectId, MatchingPolicy policy, Set<Long> claimed) {
        MatchState state = MatchState.UNMATCHED;
        state = transition(state, MatchState.EVALUATING);

        MatchDecision decision = MatchDecision.noCandidate(family, subjectId);
        for (int windowDays : policy.dateWindows()) {
            List<CandidatePair> candidates = candidatesFor(family, subjectId, windowDays, policy, claimed);
            if (candidates.isEmpty()) {
                continue;
            }
            decision = strategyChain.evaluate(family, subjectId, candidates, policy);
            log.debug("{} {} window ±{}d: {} candidates -> {}", family, subjectId, windowDays,
                candidates.size(), decision.getState());
            if (decision.getState() != MatchState.NO_CANDIDATE) {
                break;
            }
        }
        transition(state, decision.getState());
        return decision;
    }

    private List<CandidatePair> candidatesFor(RecordFamily family, long subjectId, int windowDays,
                                              MatchingPolicy policy, Set<Long> claimed) {
        if (family == RecordFamily.LEDGER) {
            LedgerTransaction subject = recordStore.findLedgerTransaction(subjectId)
                .orElseThrow(() -> new IllegalArgumentException("Ledger transaction not found: " + subjectId));
            return candidateGenerator.candidatesFor(subject, windowDays, policy, claimed);
        }
        FinancialRecord subject = recordStore.findFinancialRecord(subjectId)
            .orElseThrow(() -> new IllegalArgumentException("Financial record not found: " + subjectId));
        return candidateGenerator.candidatesFor(subject, windowDays, policy, claimed);
    }

    private MatchState transition(MatchState from, MatchState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal match state transition " + from + " -> " + to);
        }
        return to;
    }
}
