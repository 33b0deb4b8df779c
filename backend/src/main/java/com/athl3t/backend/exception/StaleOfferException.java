package com.athl3t.backend.exception;

public class StaleOfferException extends ConflictException {

    public StaleOfferException(String message) {
        super("STALE_OFFER", message);
    }
}
