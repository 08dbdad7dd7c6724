package com.roomgate.gateway.auth;

import com.roomgate.core.error.AuthorizationException;
import com.roomgate.core.msg.ServerEvents;
import com.roomgate.gateway.session.Connection;
import com.roomgate.gateway.session.ContextFixtures;
import com.roomgate.gateway.session.GatewayContext;
import com.roomgate.gateway.session.Namespace;
import com.roomgate.gateway.session.NamespaceRegistry;
import com.roomgate.gateway.transport.HandshakeInfo;
import com.roomgate.gateway.transport.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.junit.jupiter.api.Assertions.*;

class AuthMiddlewareTest {

    private VirtualTimeScheduler scheduler;
    private GatewayContext context;
    private Namespace namespace;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        context = ContextFixtures.context("proc-a", null, scheduler);
        namespace = new NamespaceRegistry(context).of("/");
        namespace.use(new AuthMiddleware(new HeaderIdentityVerifier("X-User-Id")));
    }

    @AfterEach
    void tearDown() {
        context.getTaskManager().shutdown();
        scheduler.dispose();
    }

    @Test
    @DisplayName("Handshake with the identity header is admitted with its user id")
    void testAuthenticated() {
        // Given
        HandshakeInfo handshake = HandshakeInfo.builder().header("x-user-id", "alice").build();
        RecordingTransport transport = new RecordingTransport();

        // When
        Connection connection = namespace.add(transport, handshake).block();

        // Then
        assertNotNull(connection);
        assertEquals("alice", connection.getUserId());
        assertEquals(1, transport.events(ServerEvents.CONNECT).size());
    }

    @Test
    @DisplayName("Handshake without identity is rejected with 4401")
    void testUnauthenticated() {
        RecordingTransport transport = new RecordingTransport();

        StepVerifier.create(namespace.add(transport, HandshakeInfo.builder().build()))
            .verifyComplete();

        assertEquals(AuthorizationException.UNAUTHENTICATED, transport.getCloseCode());
        assertEquals(AuthorizationException.UNAUTHENTICATED,
            transport.events(ServerEvents.CONNECT_ERROR).get(0).getPayload().get("code").asInt());
        assertEquals(0, namespace.connectionCount());
    }

    @Test
    @DisplayName("Blank identity counts as missing")
    void testBlankIdentity() {
        RecordingTransport transport = new RecordingTransport();

        assertNull(namespace.add(transport, HandshakeInfo.builder().header("x-user-id", " ").build()).block());

        assertEquals(AuthorizationException.UNAUTHENTICATED, transport.getCloseCode());
    }

    @Test
    @DisplayName("Verifier errors reject the handshake")
    void testVerifierError() {
        Namespace strict = new NamespaceRegistry(context).of("/strict");
        strict.use(new AuthMiddleware(handshake -> Mono.error(new IllegalStateException("session store down"))));
        RecordingTransport transport = new RecordingTransport();

        assertNull(strict.add(transport, HandshakeInfo.builder().namespace("/strict").build()).block());

        assertFalse(transport.isOpen());
        assertEquals(1011, transport.getCloseCode());
    }

    @Test
    @DisplayName("Header lookup ignores case")
    void testHeaderCaseInsensitive() {
        HeaderIdentityVerifier verifier = new HeaderIdentityVerifier("X-USER-ID");

        StepVerifier.create(verifier.verify(HandshakeInfo.builder().header("x-user-id", "bob").build()))
            .expectNext("bob")
            .verifyComplete();
    }
}
