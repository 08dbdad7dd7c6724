package com.roomgate.gateway.auth;

import com.roomgate.gateway.transport.HandshakeInfo;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Trusts a user id header set by an authenticating proxy in front of the gateway.
 */
public class HeaderIdentityVerifier implements IdentityVerifier {
    private final String headerName;

    public HeaderIdentityVerifier(String headerName) {
        this.headerName = headerName.toLowerCase(Locale.ROOT);
    }

    @Override
    public Mono<String> verify(HandshakeInfo handshake) {
        return Mono.justOrEmpty(handshake.header(headerName));
    }
}
