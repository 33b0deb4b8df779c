package com.athl3t.backend.exception;

public class ConflictException extends RuntimeException {

    private final String errorCode;

    public ConflictException(String message) {
        this("CONFLICT", message);
    }

    protected ConflictException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
