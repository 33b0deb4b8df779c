package com.athl3t.backend.exception;

/**
 * A well-formed request that the ledger refuses to execute, e.g. because a
 * balance or holding would go negative.
 */
public class TradingException extends RuntimeException {

    private final String errorCode;

    public TradingException(String message) {
        this("TRADING_REJECTED", message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "TRADING_REJECTED";
    }

    protected TradingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
