package com.roomgate.gateway.auth;

import com.roomgate.core.error.AuthorizationException;
import com.roomgate.gateway.session.Connection;
import com.roomgate.gateway.session.Middleware;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Admits only connections whose handshake resolves to a user; sets the connection's user id.
 */
@RequiredArgsConstructor
public class AuthMiddleware implements Middleware {
    private static final Logger log = LoggerFactory.getLogger(AuthMiddleware.class);

    private final IdentityVerifier verifier;

    @Override
    public Mono<Void> apply(Connection connection) {
        return verifier.verify(connection.getHandshake())
            .filter(userId -> !userId.isBlank())
            .switchIfEmpty(Mono.error(() -> new AuthorizationException(
                AuthorizationException.UNAUTHENTICATED, "Authentication required")))
            .doOnNext(userId -> {
                connection.setUserId(userId);
                log.debug("Connection {} authenticated as {}", connection.getId(), userId);
            })
            .then();
    }
}
