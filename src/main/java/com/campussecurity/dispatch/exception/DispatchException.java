package com.campussecurity.dispatch.exception;

/**
 * Base exception for all dispatch engine failures surfaced to callers.
 */
public class DispatchException extends RuntimeException {

    private final String errorCode;

    public DispatchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DispatchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
