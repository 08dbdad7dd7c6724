package com.roomgate.gateway.session;

import reactor.core.publisher.Mono;

/**
 * Asynchronous handshake step run before a connection is registered.
 * <p>
 * Completing admits the connection to the next step; an error rejects it. A
 * {@link com.roomgate.core.error.GatewayException} carries the code sent in
 * {@code connect_error} and used to close the transport.
 * </p>
 */
@FunctionalInterface
public interface Middleware {
    Mono<Void> apply(Connection connection);
}
