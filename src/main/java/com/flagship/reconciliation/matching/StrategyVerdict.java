package com.flagship.reconciliation.matching;

import lombok.Value;

@Value
public class StrategyVerdict {
    StrategyKind strategy;
    Verdict verdict;
    double textSimilarity;
    String reason;

    public static StrategyVerdict accept(StrategyKind strategy, String reason) {
        return new StrategyVerdict(strategy, Verdict.ACCEPT, 0.0, reason);
    }

    public static StrategyVerdict accept(StrategyKind strategy, double similarity, String reason) {
        return new StrategyVerdict(strategy, Verdict.ACCEPT, similarity, reason);
    }

    public static StrategyVerdict reject(StrategyKind strategy, String reason) {
        return new StrategyVerdict(strategy, Verdict.REJECT, 0.0, reason);
    }

    public static StrategyVerdict abstain(StrategyKind strategy) {
        return new StrategyVerdict(strategy, Verdict.ABSTAIN, 0.0, "not applicable");
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPT;
    }
}
