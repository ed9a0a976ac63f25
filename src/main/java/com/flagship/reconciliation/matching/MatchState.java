package com.flagship.reconciliation.matching;

/**
 * Per-record matching state machine: UNMATCHED → EVALUATING → {MATCHED, NO_CANDIDATE, AMBIGUOUS}.
 * The three outcomes are terminal for a run; unresolved ones are picked up by the next run.
 */
public enum MatchState {
    UNMATCHED,
    EVALUATING,
    MATCHED,
    NO_CANDIDATE,
    AMBIGUOUS;

    public boolean isTerminal() {
        return this == MATCHED || this == NO_CANDIDATE || this == AMBIGUOUS;
    }

    public boolean canTransitionTo(MatchState target) {
        return switch (this) {
            case UNMATCHED -> target == EVALUATING;
            case EVALUATING -> target.isTerminal();
            case MATCHED, NO_CANDIDATE, AMBIGUOUS -> false;
        };
    }
}
