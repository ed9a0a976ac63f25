package com.flagship.reconciliation.matching;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ScoredCandidate {
    CandidatePair pair;
    StrategyKind strategy;
    int confidence;
    double textSimilarity;
    String provenance;

    public long candidateId() {
        return pair.candidateId();
    }

    public long dateDistanceDays() {
        return pair.dateDistanceDays();
    }

    public BigDecimal amountDelta() {
        return pair.amountDelta();
    }
}
