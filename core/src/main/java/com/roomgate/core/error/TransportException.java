package com.roomgate.core.error;

/**
 * Frame write or broker publish failure. Always handled best-effort by the caller.
 */
public class TransportException extends GatewayException {
    public static final int CODE = 1011;

    public TransportException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
