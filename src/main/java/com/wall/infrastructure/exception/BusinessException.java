package com.wall.infrastructure.exception;

/**
 * Base class for business failures raised as exceptions on read paths.
 * Carries a stable, machine-readable error code for the response body.
 */
public abstract class BusinessException extends RuntimeException {

    private final String errorCode;

    protected BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
