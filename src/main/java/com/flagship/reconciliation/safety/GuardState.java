package com.flagship.reconciliation.safety;

/**
 * REQUESTED → PLANNED → {APPLIED, ABORTED}.
 */
public enum GuardState {
    REQUESTED,
    PLANNED,
    APPLIED,
    ABORTED;

    public boolean canTransitionTo(GuardState target) {
        return switch (this) {
            case REQUESTED -> target == PLANNED || target == ABORTED;
            case PLANNED -> target == APPLIED || target == ABORTED;
            case APPLIED, ABORTED -> false;
        };
    }
}
