package com.athl3t.backend.model;

/**
 * Lifecycle shared by single bets, parlay legs and parlays. PENDING is the
 * only non-terminal state.
 */
public enum BetStatus {
    PENDING,
    WON,
    LOST,
    PUSH,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
