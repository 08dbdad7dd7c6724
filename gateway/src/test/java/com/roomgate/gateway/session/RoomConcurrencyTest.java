package com.roomgate.gateway.session;

import com.roomgate.gateway.broker.LocalBroker;
import com.roomgate.gateway.transport.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Membership, broadcast and shutdown under concurrent callers.
 */
class RoomConcurrencyTest {

    private static final int CONNECTIONS = 64;
    private static final int ROUNDS = 25;
    private static final List<String> ROOMS = List.of("a", "b", "c", "d");

    private Scheduler scheduler;
    private ExecutorService pool;
    private GatewayContext context;
    private Namespace namespace;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newParallel("room-concurrency");
        pool = Executors.newFixedThreadPool(16);
        context = ContextFixtures.context("proc-a", new LocalBroker(), scheduler);
        namespace = new NamespaceRegistry(context).of("/chat");
        namespace.setDefaultRoomOptions(RoomOptions.builder().emptyTimeout(Duration.ZERO).build());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        context.getTaskManager().shutdown();
        scheduler.dispose();
    }

    private Connection connect(RecordingTransport transport) {
        Connection connection = namespace.add(transport, ContextFixtures.handshake("/chat")).block();
        assertNotNull(connection);
        transport.clear();
        return connection;
    }

    /**
     * Runs {@code tasks} bodies on the pool, released together, and fails on the first error.
     */
    private void runConcurrently(int tasks, IntConsumer body) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(tasks);
        Queue<Throwable> errors = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < tasks; i++) {
            int index = i;
            pool.execute(() -> {
                try {
                    start.await();
                    body.accept(index);
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS), "workers did not finish");
        if (!errors.isEmpty()) {
            fail("worker failed", errors.peek());
        }
    }

    // ========== Membership ==========

    @Test
    @DisplayName("Room membership and the connection's room set agree after concurrent churn")
    void testMembershipConsistentUnderChurn() throws InterruptedException {
        // Given
        List<Connection> connections = new ArrayList<>();
        for (int i = 0; i < CONNECTIONS; i++) {
            connections.add(connect(new RecordingTransport()));
        }

        // When: every connection joins, emits and leaves; half of them close at the end
        runConcurrently(CONNECTIONS, i -> {
            Connection connection = connections.get(i);
            for (int round = 0; round < ROUNDS; round++) {
                String first = ROOMS.get((i + round) % ROOMS.size());
                String second = ROOMS.get((i + round + 1) % ROOMS.size());
                connection.join(first);
                connection.join(second);
                namespace.to(first).emit("tick", round, connection.getId());
                connection.leave(first);
            }
            if (i % 2 == 0) {
                connection.close();
            }
        });

        // Then
        for (Connection connection : connections) {
            for (String roomName : ROOMS) {
                boolean member = namespace.getRoom(roomName)
                    .map(room -> room.contains(connection.getId()))
                    .orElse(false);
                assertEquals(member, connection.isInRoom(roomName),
                    connection.getId() + " disagrees with room " + roomName);
            }
            if (!connection.isOpen()) {
                assertTrue(connection.getRooms().isEmpty());
            }
        }
        for (String roomName : namespace.getRoomNames()) {
            Room room = namespace.getRoom(roomName).orElseThrow();
            assertFalse(room.isDestroyed(), "destroyed room " + roomName + " still registered");
            assertTrue(room.size() > 0, "empty room " + roomName + " still registered");
        }
        assertEquals(CONNECTIONS / 2, namespace.connectionCount());
    }

    @Test
    @DisplayName("Members that stay get every broadcast while others join, leave and close")
    void testBroadcastDuringChurn() throws InterruptedException {
        // Given: stable members keep the room alive
        int stable = CONNECTIONS / 2;
        int messages = 200;
        List<RecordingTransport> stableTransports = new ArrayList<>();
        for (int i = 0; i < stable; i++) {
            RecordingTransport transport = new RecordingTransport();
            connect(transport).join("general");
            stableTransports.add(transport);
        }
        List<Connection> churners = new ArrayList<>();
        for (int i = 0; i < CONNECTIONS - stable; i++) {
            churners.add(connect(new RecordingTransport()));
        }

        // When: task 0 broadcasts, the others churn
        runConcurrently(churners.size() + 1, i -> {
            if (i == 0) {
                for (int n = 0; n < messages; n++) {
                    namespace.to("general").emit("tick", n);
                }
                return;
            }
            Connection connection = churners.get(i - 1);
            for (int round = 0; round < ROUNDS; round++) {
                connection.join("general");
                connection.leave("general");
            }
            connection.join("general");
            connection.close();
        });

        // Then
        for (RecordingTransport transport : stableTransports) {
            assertEquals(messages, transport.events("tick").size());
        }
        Room room = namespace.getRoom("general").orElseThrow();
        assertEquals(stable, room.size());
        for (Connection connection : churners) {
            assertFalse(room.contains(connection.getId()));
            assertTrue(connection.getRooms().isEmpty());
        }
    }

    // ========== Shutdown ==========

    @Test
    @DisplayName("Connections admitted while the namespace closes all end up closed")
    void testAdmissionRacingClose() throws InterruptedException {
        // Given
        List<RecordingTransport> transports = new ArrayList<>();
        for (int i = 0; i < CONNECTIONS; i++) {
            transports.add(new RecordingTransport());
        }
        Queue<Connection> admitted = new ConcurrentLinkedQueue<>();

        // When: the last task closes the namespace while the others are admitted
        runConcurrently(CONNECTIONS + 1, i -> {
            if (i == CONNECTIONS) {
                namespace.close();
                return;
            }
            Connection connection = namespace.add(transports.get(i), ContextFixtures.handshake("/chat")).block();
            if (connection != null) {
                admitted.add(connection);
            }
        });

        // Then
        assertTrue(namespace.isClosed());
        assertEquals(0, namespace.connectionCount());
        for (Connection connection : admitted) {
            assertFalse(connection.isOpen(), connection.getId() + " left open");
        }
        for (RecordingTransport transport : transports) {
            assertEquals(Namespace.GOING_AWAY, transport.getCloseCode());
        }
    }
}
