package com.roomgate.gateway.auth;

import com.roomgate.gateway.transport.HandshakeInfo;
import reactor.core.publisher.Mono;

/**
 * Resolves the authenticated user behind a handshake.
 * <p>
 * Credential checks happen outside the gateway; implementations only read the result
 * (a trusted header, a session lookup).
 * </p>
 */
@FunctionalInterface
public interface IdentityVerifier {

    /**
     * @param handshake Handshake of the connecting client
     * @return user id, or empty if the handshake carries no valid identity
     */
    Mono<String> verify(HandshakeInfo handshake);
}
