package com.roomgate.core.error;

/**
 * Malformed envelope or frame, or a connection refused by middleware.
 */
public class ValidationException extends GatewayException {
    public static final int DEFAULT_CODE = 4400;

    /**
     * Middleware chain did not complete in time.
     */
    public static final int TIMEOUT = 4408;

    public ValidationException(String message) {
        super(DEFAULT_CODE, message);
    }

    public ValidationException(int code, String message) {
        super(code, message);
    }
}
