package com.athl3t.backend.exception;

public class NotFoundException extends RuntimeException {

    private final String errorCode;

    public NotFoundException(String message) {
        this("NOT_FOUND", message);
    }

    protected NotFoundException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
