package com.athl3t.backend.exception;

public class AlreadySettledException extends ConflictException {

    public AlreadySettledException(Long gameId) {
        super("ALREADY_SETTLED", "Game " + gameId + " has already been settled");
    }
}
