package com.roomgate.gateway.server;

import com.roomgate.core.msg.ClientCommand;
import com.roomgate.core.msg.Topics;
import com.roomgate.core.util.JsonUtils;
import com.roomgate.gateway.broker.BrokerAdapter;
import com.roomgate.gateway.broker.FailingBroker;
import com.roomgate.gateway.broker.LocalBroker;
import com.roomgate.gateway.config.GatewayConfig;
import com.roomgate.gateway.metrics.MetricsService;
import com.roomgate.gateway.session.Connection;
import com.roomgate.gateway.session.ContextFixtures;
import com.roomgate.gateway.session.Namespace;
import com.roomgate.gateway.transport.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GatewayServerTest {

    private VirtualTimeScheduler scheduler;
    private final List<GatewayServer> servers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
    }

    @AfterEach
    void tearDown() {
        servers.forEach(server -> server.stop().block());
        scheduler.dispose();
    }

    private GatewayServer server(String processId, BrokerAdapter broker) {
        GatewayServer server = new GatewayServer(
            ContextFixtures.context(processId, broker, scheduler), Duration.ofSeconds(10));
        servers.add(server);
        return server;
    }

    private GatewayServer started(String processId, BrokerAdapter broker) {
        GatewayServer server = server(processId, broker);
        StepVerifier.create(server.start()).verifyComplete();
        return server;
    }

    private static Connection connect(GatewayServer server, RecordingTransport transport) {
        Connection connection = server.accept(transport, ContextFixtures.handshake("/")).block();
        assertNotNull(connection);
        transport.clear();
        return connection;
    }

    private static String roomMessage(String room, String text) {
        return JsonUtils.writeValueAsString(Map.of(
            "event", ClientCommand.ROOM_MESSAGE,
            "payload", Map.of("roomId", room, "payload", Map.of("text", text))));
    }

    private static double counter(GatewayServer server, String name) {
        return server.getContext().getMetrics().getRegistry().get(name).counter().count();
    }

    // ========== Cross-process delivery ==========

    @Test
    @DisplayName("Room message reaches every member on both processes exactly once")
    void testCrossProcessRoomMessage() {
        // Given: two processes sharing one broker, two members each in "general"
        LocalBroker broker = new LocalBroker();
        GatewayServer first = started("proc-a", broker);
        GatewayServer second = started("proc-b", broker);

        RecordingTransport aliceTransport = new RecordingTransport();
        RecordingTransport bobTransport = new RecordingTransport();
        RecordingTransport carolTransport = new RecordingTransport();
        RecordingTransport daveTransport = new RecordingTransport();
        Connection alice = connect(first, aliceTransport);
        Connection bob = connect(first, bobTransport);
        Connection carol = connect(second, carolTransport);
        Connection dave = connect(second, daveTransport);
        for (Connection connection : List.of(alice, bob, carol, dave)) {
            assertTrue(connection.join("general"));
        }

        // When
        alice.onFrame(roomMessage("general", "hello"));

        // Then
        assertTrue(aliceTransport.events(ClientCommand.ROOM_MESSAGE).isEmpty());
        assertEquals(1, bobTransport.events(ClientCommand.ROOM_MESSAGE).size());
        assertEquals(1, carolTransport.events(ClientCommand.ROOM_MESSAGE).size());
        assertEquals(1, daveTransport.events(ClientCommand.ROOM_MESSAGE).size());
        assertEquals(alice.getId(), carolTransport.events(ClientCommand.ROOM_MESSAGE).get(0).getSender());
    }

    @Test
    @DisplayName("Broadcast echoed back by the broker is delivered locally only once")
    void testOriginLoopSuppressed() {
        LocalBroker broker = new LocalBroker();
        GatewayServer server = started("proc-a", broker);
        RecordingTransport transport = new RecordingTransport();
        Connection alice = connect(server, transport);
        alice.join("general");

        server.of("/").to("general").emit("notice", "restart soon");

        assertEquals(1, transport.events("notice").size());
        assertEquals(1.0, counter(server, "gateway.broker.echo.skipped.total"));
        assertEquals(1.0, counter(server, "gateway.broker.published.total"));
    }

    @Test
    @DisplayName("Broker publish failure does not affect local delivery")
    void testPublishFailureIsolated() {
        // Given
        FailingBroker broker = new FailingBroker(false);
        GatewayServer server = started("proc-a", broker);
        RecordingTransport aliceTransport = new RecordingTransport();
        RecordingTransport bobTransport = new RecordingTransport();
        Connection alice = connect(server, aliceTransport);
        Connection bob = connect(server, bobTransport);
        alice.join("general");
        bob.join("general");

        // When
        alice.onFrame(roomMessage("general", "still here"));

        // Then
        assertEquals(1, bobTransport.events(ClientCommand.ROOM_MESSAGE).size());
        assertEquals(1, broker.getPublishAttempts());
        assertEquals(1.0, counter(server, "gateway.broker.publish.failures.total"));
        assertTrue(alice.isOpen());
    }

    // ========== Lifecycle ==========

    @Test
    @DisplayName("Broker connect failure aborts start")
    void testStartFailure() {
        // Given
        GatewayServer server = server("proc-a", new FailingBroker(true));
        RecordingTransport transport = new RecordingTransport();

        // When / Then
        StepVerifier.create(server.start())
            .expectErrorMessage("broker unreachable")
            .verify();
        assertFalse(server.isRunning());
        StepVerifier.create(server.accept(transport, ContextFixtures.handshake("/")))
            .verifyComplete();
        assertEquals(Namespace.GOING_AWAY, transport.getCloseCode());
    }

    @Test
    @DisplayName("Start schedules the state refresh")
    void testStateRefreshScheduled() {
        GatewayServer server = started("proc-a", new LocalBroker());

        assertTrue(server.isRunning());
        assertTrue(server.getContext().getTaskManager()
            .hasTask(server.getTaskOwnerId(), GatewayServer.STATE_REFRESH_TASK));

        scheduler.advanceTimeBy(Duration.ofSeconds(30));
        assertEquals(3, server.getContext().getTaskManager()
            .getTask(server.getTaskOwnerId(), GatewayServer.STATE_REFRESH_TASK).orElseThrow()
            .getRunCount().get());
    }

    @Test
    @DisplayName("Stop closes every connection with 1001 and is idempotent")
    void testStop() {
        // Given
        LocalBroker broker = new LocalBroker();
        GatewayServer server = started("proc-a", broker);
        RecordingTransport transport = new RecordingTransport();
        Connection alice = connect(server, transport);
        alice.join("general");

        // When
        StepVerifier.create(server.stop()).verifyComplete();
        StepVerifier.create(server.stop()).verifyComplete();

        // Then
        assertFalse(server.isRunning());
        assertFalse(alice.isOpen());
        assertEquals(Namespace.GOING_AWAY, transport.getCloseCode());
        assertEquals(0, server.getContext().getTaskManager().size());
        assertFalse(broker.hasSubscribers("gateway:/:room:general"));
        assertEquals(0L, server.getContext().getStateAdapter().getCountInRoom("/", "general").block());
    }

    @Test
    @DisplayName("Connections are routed to the namespace of their handshake")
    void testAcceptRoutesByNamespace() {
        GatewayServer server = started("proc-a", new LocalBroker());

        Connection connection = server.accept(new RecordingTransport(), ContextFixtures.handshake("/chat")).block();

        assertNotNull(connection);
        assertEquals("/chat", connection.getNamespace().getName());
        assertSame(connection, server.of("chat").getConnection(connection.getId()));
    }

    @Test
    @DisplayName("Local configuration builds an in-process server")
    void testFromLocalConfig() {
        GatewayConfig config = GatewayConfig.local("node-1");
        GatewayServer server = GatewayServer.fromConfig(config, MetricsService.noop("node-1"));
        servers.add(server);

        StepVerifier.create(server.start()).verifyComplete();

        assertEquals("node-1", server.getProcessId());
        assertInstanceOf(LocalBroker.class, server.getContext().getBroker());
        assertEquals(Duration.ofSeconds(60), server.getContext().getDefaultRoomOptions().getEmptyTimeout());
        assertEquals(Topics.KAFKA_BROADCAST, config.getKafkaTopic());
    }

    @Test
    @DisplayName("Refresh interval is a third of the TTL, at least one second")
    void testRefreshInterval() {
        assertEquals(Duration.ofSeconds(20), GatewayServer.refreshIntervalFor(Duration.ofSeconds(60)));
        assertEquals(Duration.ofSeconds(1), GatewayServer.refreshIntervalFor(Duration.ofSeconds(2)));
    }
}
