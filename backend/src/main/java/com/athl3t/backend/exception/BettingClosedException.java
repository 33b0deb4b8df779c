package com.athl3t.backend.exception;

public class BettingClosedException extends ConflictException {

    public BettingClosedException(Long gameId) {
        super("BETTING_CLOSED", "Betting is closed for game " + gameId);
    }
}
