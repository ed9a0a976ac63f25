package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of matching strategies.
 *
 * Sign-incompatible pairs are rejected before any strategy runs. In
 * {@link EvaluationMode#FIRST_ACCEPT} the first tier that accepts anything decides; two or
 * more acceptances in that tier make the record ambiguous. In
 * {@link EvaluationMode#COLLECT_ALL} each candidate is scored under its best strategy and the
 * leader must beat the runner-up by the tie margin.
 *
 * Never touches the record store, so it is testable with plain objects.
 */
@Slf4j
public class MatchingStrategyChain {

    private final List<MatchingStrategy> strategies;
    private final ConfidenceScorer scorer;

    public MatchingStrategyChain(List<MatchingStrategy> strategies, ConfidenceScorer scorer) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one matching strategy is required");
        }
        List<MatchingStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort((a, b) -> Integer.compare(a.kind().ordinal(), b.kind().ordinal()));
        this.strategies = List.copyOf(ordered);
        this.scorer = scorer;
    }

    public static MatchingStrategyChain standard(AliasResolver aliasResolver) {
        return new MatchingStrategyChain(List.of(
            new NaturalKeyStrategy(),
            new AmountDateWindowStrategy(),
            new AmountAccountWindowStrategy(),
            new AmountToleranceStrategy(),
            new DescriptionPatternStrategy(aliasResolver)
        ), new ConfidenceScorer());
    }

    public List<MatchingStrategy> strategies() {
        return strategies;
    }

    public MatchDecision evaluate(RecordFamily subjectFamily, long subjectId,
                                  List<CandidatePair> candidates, MatchingPolicy policy) {
        List<CandidatePair> eligible = candidates.stream()
            .filter(pair -> {
                boolean compatible = SignRule.compatible(pair.getLedger(), pair.getRecord());
                if (!compatible) {
                    log.debug("Rejected candidate {} for {} {}: sign mismatch",
                        pair.candidateId(), subjectFamily, subjectId);
                }
                return compatible;
            })
            .toList();

        if (eligible.isEmpty()) {
            return MatchDecision.noCandidate(subjectFamily, subjectId);
        }

        return policy.getEvaluationMode() == EvaluationMode.COLLECT_ALL
            ? collectAll(subjectFamily, subjectId, eligible, policy)
            : firstAccept(subjectFamily, subjectId, eligible, policy);
    }

    private MatchDecision firstAccept(RecordFamily family, long subjectId,
                                      List<CandidatePair> candidates, MatchingPolicy policy) {
        for (MatchingStrategy strategy : strategies) {
            List<ScoredCandidate> accepted = new ArrayList<>();
            for (CandidatePair pair : candidates) {
                StrategyVerdict verdict = strategy.evaluate(pair, policy);
                if (verdict.isAccepted()) {
                    accepted.add(scorer.score(pair, verdict, policy));
                }
            }
            if (!accepted.isEmpty()) {
                return decide(family, subjectId, scorer.rank(accepted, policy), policy);
            }
        }
        return MatchDecision.noCandidate(family, subjectId);
    }

    private MatchDecision collectAll(RecordFamily family, long subjectId,
                                     List<CandidatePair> candidates, MatchingPolicy policy) {
        List<ScoredCandidate> scored = new ArrayList<>();
        for (CandidatePair pair : candidates) {
            bestVerdict(pair, policy).ifPresent(verdict -> scored.add(scorer.score(pair, verdict, policy)));
        }
        if (scored.isEmpty()) {
            return MatchDecision.noCandidate(family, subjectId);
        }
        return decide(family, subjectId, scorer.rank(scored, policy), policy);
    }

    private Optional<StrategyVerdict> bestVerdict(CandidatePair pair, MatchingPolicy policy) {
        for (MatchingStrategy strategy : strategies) {
            StrategyVerdict verdict = strategy.evaluate(pair, policy);
            if (verdict.isAccepted()) {
                return Optional.of(verdict);
            }
        }
        return Optional.empty();
    }

    private MatchDecision decide(RecordFamily family, long subjectId, CandidateRanking ranking,
                                 MatchingPolicy policy) {
        if (!ranking.isAutoApplyEligible()) {
            log.debug("{} {} is ambiguous: {} candidates within tie margin", family, subjectId, ranking.size());
            return MatchDecision.ambiguous(family, subjectId, ranking.getRanked());
        }
        return MatchDecision.matched(family, subjectId, ranking.getRanked(), policy.getAutoApplyThreshold());
    }
}
