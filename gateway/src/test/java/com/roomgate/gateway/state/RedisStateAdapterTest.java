package com.roomgate.gateway.state;

import io.lettuce.core.ZAddArgs;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.CommandArgs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RedisStateAdapterTest {

    private RecordingRedisCommands redis;
    private RedisStateAdapter state;

    @BeforeEach
    void setUp() {
        redis = new RecordingRedisCommands();
        state = new RedisStateAdapter(redis.commands(), Duration.ofSeconds(60));
    }

    /**
     * Members written by refresh, i.e. the ZADD calls carrying {@link ZAddArgs}.
     */
    private List<String> refreshedMembers() {
        return redis.calls("zadd").stream()
            .filter(call -> call.argCount() == 4 && call.arg(1) instanceof ZAddArgs)
            .map(call -> (String) call.arg(3))
            .collect(Collectors.toList());
    }

    // ========== Refresh ==========

    @Test
    @DisplayName("Refresh only updates existing entries and skips members that left")
    void testRefreshUsesUpdateOnlyWrites() {
        // Given
        state.addUserToRoom("/chat", "general", "alice").block();
        state.addUserToRoom("/chat", "general", "bob").block();
        state.removeUserFromRoom("/chat", "general", "bob").block();
        redis.clear();

        // When
        state.refresh().block();

        // Then
        assertEquals(List.of("alice"), refreshedMembers());
        RecordingRedisCommands.Call write = redis.calls("zadd").get(0);
        CommandArgs<String, String> args = new CommandArgs<>(StringCodec.UTF8);
        ((ZAddArgs) write.arg(1)).build(args);
        assertTrue(args.toCommandString().contains("XX"), args.toCommandString());
    }

    @Test
    @DisplayName("A member removed while refresh runs is not written back")
    void testRefreshSkipsMemberRemovedMidway() {
        // Given
        state.addUserToRoom("/chat", "general", "alice").block();
        state.addUserToRoom("/chat", "general", "bob").block();
        redis.clear();
        AtomicReference<String> removed = new AtomicReference<>();
        redis.onCall(call -> {
            if (call.getMethod().equals("zadd") && call.arg(1) instanceof ZAddArgs && removed.get() == null) {
                String other = "alice".equals(call.arg(3)) ? "bob" : "alice";
                removed.set(other);
                state.removeUserFromRoom("/chat", "general", other).block();
            }
        });

        // When: the first refresh write removes the other member
        state.refresh().block();

        // Then
        assertNotNull(removed.get());
        List<String> refreshed = refreshedMembers();
        assertEquals(1, refreshed.size());
        assertFalse(refreshed.contains(removed.get()));
        assertEquals(1, redis.calls("zrem").size());
    }

    @Test
    @DisplayName("clearProcessData removes only what this process wrote")
    void testClearProcessData() {
        state.addUserToRoom("/chat", "general", "alice").block();
        state.addUserToRoom("/chat", "random", "alice").block();
        redis.clear();

        state.clearProcessData().block();

        assertEquals(2, redis.calls("zrem").size());
        assertEquals(1, redis.calls("del").size());

        redis.clear();
        state.refresh().block();
        assertTrue(redis.calls("zadd").isEmpty());
    }
}
