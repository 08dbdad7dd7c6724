package com.roomgate.core.error;

import lombok.Getter;

/**
 * Base type for failures raised by the gateway.
 * <p>
 * Every failure carries a numeric reason code. Codes in the 4xxx range double as
 * WebSocket close codes when a failure ends a connection.
 * </p>
 */
@Getter
public class GatewayException extends RuntimeException {
    private final int code;

    public GatewayException(int code, String message) {
        super(message);
        this.code = code;
    }

    public GatewayException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
