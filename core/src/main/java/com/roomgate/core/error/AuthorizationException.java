package com.roomgate.core.error;

/**
 * Caller is not allowed to perform the operation.
 * <p>
 * Raised for failed handshake authentication ({@link #UNAUTHENTICATED}) and for
 * operations on rooms the connection is not a member of ({@link #FORBIDDEN}).
 * </p>
 */
public class AuthorizationException extends GatewayException {
    public static final int UNAUTHENTICATED = 4401;
    public static final int FORBIDDEN = 4403;

    public AuthorizationException(String message) {
        super(FORBIDDEN, message);
    }

    public AuthorizationException(int code, String message) {
        super(code, message);
    }
}
