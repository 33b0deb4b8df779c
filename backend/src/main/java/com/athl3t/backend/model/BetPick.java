package com.athl3t.backend.model;

public enum BetPick {
    HOME,
    AWAY,
    OVER,
    UNDER;

    public boolean isTotalPick() {
        return this == OVER || this == UNDER;
    }
}
