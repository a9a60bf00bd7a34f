package com.gprintex.commission.exception;

/**
 * Base of all typed commission errors. The error code is stable and exposed to API clients.
 */
public abstract class CommissionException extends RuntimeException {

    private final String errorCode;

    protected CommissionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CommissionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
