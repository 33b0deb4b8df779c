package com.athl3t.backend.model;

public enum BetType {
    MONEYLINE,
    SPREAD,
    OVER_UNDER;

    public boolean accepts(BetPick pick) {
        if (pick == null) {
            return false;
        }
        return this == OVER_UNDER ? pick.isTotalPick() : !pick.isTotalPick();
    }
}
