package com.roomgate.gateway.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateAdapterTest {

    private InMemoryStateAdapter state;

    @BeforeEach
    void setUp() {
        state = new InMemoryStateAdapter();
        state.connect().block();
    }

    @Test
    @DisplayName("Membership is visible from both the room and the connection side")
    void testAddUser() {
        state.addUserToRoom("/chat", "general", "c1").block();
        state.addUserToRoom("/chat", "general", "c2").block();
        state.addUserToRoom("/chat", "random", "c1").block();

        StepVerifier.create(state.getUsersInRoom("/chat", "general"))
            .expectNext(Set.of("c1", "c2"))
            .verifyComplete();
        StepVerifier.create(state.getCountInRoom("/chat", "general"))
            .expectNext(2L)
            .verifyComplete();
        StepVerifier.create(state.getConnectionRooms("/chat", "c1"))
            .expectNext(Set.of("general", "random"))
            .verifyComplete();
        StepVerifier.create(state.isMember("/chat", "random", "c2"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    @DisplayName("Adding the same member twice is idempotent")
    void testAddIdempotent() {
        state.addUserToRoom("/chat", "general", "c1").block();
        state.addUserToRoom("/chat", "general", "c1").block();

        assertEquals(1L, state.getCountInRoom("/chat", "general").block());
    }

    @Test
    @DisplayName("Namespaces are isolated")
    void testNamespaceIsolation() {
        state.addUserToRoom("/chat", "general", "c1").block();

        assertEquals(Set.of(), state.getUsersInRoom("/admin", "general").block());
        assertEquals(0L, state.getCountInRoom("/admin", "general").block());
    }

    @Test
    @DisplayName("Removing the last member empties the room")
    void testRemoveUser() {
        state.addUserToRoom("/chat", "general", "c1").block();

        state.removeUserFromRoom("/chat", "general", "c1").block();
        state.removeUserFromRoom("/chat", "general", "c1").block();

        assertEquals(0L, state.getCountInRoom("/chat", "general").block());
        assertTrue(state.getConnectionRooms("/chat", "c1").block().isEmpty());
    }

    @Test
    @DisplayName("clearProcessData drops every entry")
    void testClearProcessData() {
        state.addUserToRoom("/chat", "general", "c1").block();
        state.addUserToRoom("/chat", "random", "c2").block();

        StepVerifier.create(state.clearProcessData()).verifyComplete();

        assertEquals(0L, state.getCountInRoom("/chat", "general").block());
        assertEquals(0L, state.getCountInRoom("/chat", "random").block());
    }

    @Test
    @DisplayName("Refresh keeps entries")
    void testRefresh() {
        state.addUserToRoom("/chat", "general", "c1").block();

        StepVerifier.create(state.refresh()).verifyComplete();

        assertEquals(Set.of("c1"), state.getUsersInRoom("/chat", "general").block());
    }
}
