package com.roomgate.gateway.session;

import com.roomgate.core.error.AuthorizationException;
import com.roomgate.core.error.GatewayException;
import com.roomgate.core.error.TransportException;
import com.roomgate.core.error.ValidationException;
import com.roomgate.core.msg.ClientCommand;
import com.roomgate.core.msg.EnvelopeCodec;
import com.roomgate.core.msg.MessageEnvelope;
import com.roomgate.core.msg.ServerEvents;
import com.roomgate.core.msg.Topics;
import com.roomgate.gateway.broker.BrokerAdapter;
import com.roomgate.gateway.scheduler.TaskOwner;
import com.roomgate.gateway.transport.HandshakeInfo;
import com.roomgate.gateway.transport.Transport;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Isolated scope of connections, rooms, middleware and event handlers under one path.
 * <p>
 * Admission: {@link #add} runs the middleware chain in order; the first rejection (or the
 * middleware timeout) answers the client with {@code connect_error} and closes the transport.
 * </p>
 * <p>
 * Dispatch: decoded client commands go through {@link #handleClientMessage}. The reserved
 * control events manage room membership; everything else is routed to the handler registered
 * for the event, then to the default handler.
 * </p>
 */
public class Namespace implements TaskOwner {
    private static final Logger log = LoggerFactory.getLogger(Namespace.class);

    private static final int MAX_JOIN_ATTEMPTS = 3;
    public static final int GOING_AWAY = 1001;

    @Getter
    private final String name;
    @Getter
    private final GatewayContext context;
    @Getter
    private final String topic;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    // user id -> ids of that user's local connections
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();
    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<Connection>> connectionListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Connection>> disconnectListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean brokerBound = new AtomicBoolean();

    private volatile EventHandler defaultHandler;
    private volatile RoomOptions defaultRoomOptions;
    private volatile Disposable brokerSubscription;

    Namespace(String name, GatewayContext context) {
        this.name = name;
        this.context = context;
        this.topic = Topics.namespaceTopic(name);
        this.defaultRoomOptions = context.getDefaultRoomOptions();
    }

    public Namespace use(Middleware middleware) {
        middlewares.add(middleware);
        return this;
    }

    /**
     * Registers the handler of an application event, replacing any previous one.
     *
     * @throws IllegalArgumentException for the reserved control events
     */
    public Namespace on(String event, EventHandler handler) {
        if (ClientCommand.JOIN_ROOM.equals(event) || ClientCommand.LEAVE_ROOM.equals(event)
            || ClientCommand.ROOM_MESSAGE.equals(event)) {
            throw new IllegalArgumentException("Event '" + event + "' is reserved");
        }
        handlers.put(event, handler);
        return this;
    }

    /**
     * Handler for application events without a dedicated handler.
     */
    public Namespace onAny(EventHandler handler) {
        this.defaultHandler = handler;
        return this;
    }

    public Namespace onConnection(Consumer<Connection> listener) {
        connectionListeners.add(listener);
        return this;
    }

    public Namespace onDisconnect(Consumer<Connection> listener) {
        disconnectListeners.add(listener);
        return this;
    }

    public Namespace setDefaultRoomOptions(RoomOptions options) {
        this.defaultRoomOptions = options;
        return this;
    }

    /**
     * Admits a new client.
     *
     * @param transport Client channel
     * @param handshake Handshake metadata
     * @return the registered connection, or empty if it was rejected
     */
    public Mono<Connection> add(Transport transport, HandshakeInfo handshake) {
        return Mono.defer(() -> {
            Connection connection = new Connection(UUID.randomUUID().toString(), this, transport, handshake);
            long startNanos = System.nanoTime();

            return Flux.fromIterable(middlewares)
                .concatMap(middleware -> Mono.defer(() -> middleware.apply(connection)))
                .then()
                .timeout(context.getMiddlewareTimeout(), context.getScheduler())
                .onErrorMap(TimeoutException.class,
                    e -> new ValidationException(ValidationException.TIMEOUT, "Handshake timed out"))
                .doFinally(signal -> context.getMetrics().recordMiddlewareLatency(startNanos))
                .then(Mono.fromCallable(() -> register(connection)))
                .onErrorResume(err -> {
                    reject(connection, err);
                    return Mono.empty();
                });
        });
    }

    private Connection register(Connection connection) {
        if (!connection.isOpen()) {
            throw new TransportException("Transport closed during handshake", null);
        }
        connections.put(connection.getId(), connection);
        // checked after the put: close() snapshots the map once the flag is set
        if (closed.get()) {
            connections.remove(connection.getId(), connection);
            throw new ValidationException(GOING_AWAY, "Namespace " + name + " is closed");
        }
        indexUser(connection);
        context.getMetrics().recordConnectionAccepted();

        connection.emit(ServerEvents.CONNECT, Map.of(
            "connectionId", connection.getId(),
            "namespace", name,
            "processId", context.getProcessId()
        ));
        log.info("Connection {} registered in {} (user={})", connection.getId(), name, connection.getUserId());

        for (Consumer<Connection> listener : connectionListeners) {
            try {
                listener.accept(connection);
            } catch (Exception e) {
                log.error("Connection listener failed for {}", connection.getId(), e);
            }
        }
        return connection;
    }

    private void indexUser(Connection connection) {
        String userId = connection.getUserId();
        if (userId != null) {
            userConnections.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(connection.getId());
        }
    }

    private void unindexUser(Connection connection) {
        String userId = connection.getUserId();
        if (userId != null) {
            userConnections.computeIfPresent(userId, (k, ids) -> {
                ids.remove(connection.getId());
                return ids.isEmpty() ? null : ids;
            });
        }
    }

    private void reject(Connection connection, Throwable err) {
        int code = err instanceof GatewayException ge ? ge.getCode() : TransportException.CODE;
        String reason = err.getMessage() != null ? err.getMessage() : "Connection rejected";

        String metricReason;
        if (code == ValidationException.TIMEOUT) {
            metricReason = "timeout";
        } else if (err instanceof AuthorizationException) {
            metricReason = "authorization";
        } else if (err instanceof ValidationException) {
            metricReason = "validation";
        } else {
            metricReason = "error";
        }
        context.getMetrics().recordConnectionRejected(metricReason);

        if (err instanceof GatewayException) {
            log.warn("Connection rejected in {}: {} ({})", name, reason, code);
        } else {
            log.error("Handshake failed in {}", name, err);
        }

        connection.emit(ServerEvents.CONNECT_ERROR, Map.of("reason", reason, "code", code));
        connection.close(code, reason);
    }

    /**
     * Returns the room, creating it with the namespace default options if absent.
     */
    public Room getOrCreateRoom(String roomName) {
        return getOrCreateRoom(roomName, null);
    }

    public Room getOrCreateRoom(String roomName, @Nullable RoomOptions options) {
        if (roomName == null || roomName.isBlank()) {
            throw new ValidationException("Room name is required");
        }
        if (closed.get()) {
            throw new ValidationException(GOING_AWAY, "Namespace " + name + " is closed");
        }
        Room room = rooms.computeIfAbsent(roomName,
            n -> new Room(n, this, options != null ? options : defaultRoomOptions));
        room.bindBroker();
        return room;
    }

    public Optional<Room> getRoom(String roomName) {
        return Optional.ofNullable(rooms.get(roomName));
    }

    /**
     * Destroys a room explicitly.
     *
     * @return false if no such room exists
     */
    public boolean deleteRoom(String roomName) {
        Room room = rooms.get(roomName);
        if (room == null) {
            return false;
        }
        room.destroy();
        return true;
    }

    void onRoomDestroyed(Room room) {
        rooms.remove(room.getName(), room);
    }

    /**
     * Adds a connection to a room, creating the room if needed.
     *
     * @return true if the connection is a member afterwards
     */
    boolean joinRoom(Connection connection, String roomName) {
        if (!connection.isOpen() || connection.getNamespace() != this) {
            return false;
        }
        for (int attempt = 0; attempt < MAX_JOIN_ATTEMPTS; attempt++) {
            Room room = getOrCreateRoom(roomName);
            if (room.add(connection)) {
                // closed while joining: the close cleanup may have missed this room
                if (!connection.isOpen()) {
                    room.remove(connection.getId());
                    return false;
                }
                return true;
            }
            rooms.remove(roomName, room);
        }
        log.warn("Connection {} could not join room {} in {}: room kept being destroyed",
            connection.getId(), roomName, name);
        return false;
    }

    boolean leaveRoom(Connection connection, String roomName) {
        Room room = rooms.get(roomName);
        if (room == null) {
            connection.removeRoom(roomName);
            return false;
        }
        return room.remove(connection.getId());
    }

    /**
     * Dispatches a decoded client command.
     *
     * @param connectionId Registered connection
     * @param command      Decoded command
     */
    public void handleClientMessage(String connectionId, ClientCommand command) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            log.debug("Dropping {} from unknown connection {}", command.getEvent(), connectionId);
            return;
        }

        if (command instanceof ClientCommand.JoinRoom join) {
            if (joinRoom(connection, join.getRoomId())) {
                connection.emit(ServerEvents.JOINED_ROOM, Map.of("roomId", join.getRoomId()));
            }
        } else if (command instanceof ClientCommand.LeaveRoom leave) {
            if (leaveRoom(connection, leave.getRoomId())) {
                connection.emit(ServerEvents.LEFT_ROOM, Map.of("roomId", leave.getRoomId()));
            }
        } else if (command instanceof ClientCommand.RoomMessage message) {
            handleRoomMessage(connection, message);
        } else if (command instanceof ClientCommand.AppEvent event) {
            handleAppEvent(connection, event);
        }
    }

    private void handleRoomMessage(Connection connection, ClientCommand.RoomMessage message) {
        Room room = rooms.get(message.getRoomId());
        if (room == null || !room.contains(connection.getId())) {
            context.getMetrics().recordAuthorizationDrop();
            log.warn("Connection {} sent roomMessage to room {} it has not joined; dropped",
                connection.getId(), message.getRoomId());
            return;
        }
        room.broadcast(MessageEnvelope.create(
            name, message.getRoomId(), ClientCommand.ROOM_MESSAGE,
            message.getPayload(), connection.getId(), message.getTraceId()
        ));
    }

    private void handleAppEvent(Connection connection, ClientCommand.AppEvent event) {
        EventHandler handler = handlers.get(event.getEvent());
        if (handler == null) {
            handler = defaultHandler;
        }
        if (handler == null) {
            log.warn("No handler for event {} in {}; dropped", event.getEvent(), name);
            return;
        }
        MessageEnvelope envelope = MessageEnvelope.create(
            name, event.getRoom(), event.getEvent(), event.getPayload(), connection.getId(), event.getTraceId()
        );
        try {
            handler.handle(connection, envelope);
        } catch (GatewayException e) {
            throw e;
        } catch (Exception e) {
            log.error("Handler for event {} in {} failed", event.getEvent(), name, e);
        }
    }

    /**
     * Starts a targeted emit.
     */
    public RoomEmitter to(String roomName) {
        return new RoomEmitter(this).to(roomName);
    }

    public RoomEmitter in(String roomName) {
        return to(roomName);
    }

    /**
     * Starts an emit targeting every connection of a user, on every process.
     */
    public RoomEmitter toUser(String userId) {
        return new RoomEmitter(this).toUser(userId);
    }

    /**
     * Emits to every connection of the namespace on every process.
     *
     * @return number of local connections the frame was written to
     */
    public int emit(String event, @Nullable Object payload) {
        return emitNamespaceWide(MessageEnvelope.create(name, null, event, payload, null));
    }

    int emitNamespaceWide(MessageEnvelope envelope) {
        int delivered = deliver(connections.values(), envelope);
        context.getMetrics().recordDeliverLocal(delivered);
        context.publish(topic, envelope.withOriginProcessId(context.getProcessId()));
        return delivered;
    }

    /**
     * Emits to the union of the rooms and users the envelope names, each local connection at
     * most once, and publishes a single envelope on the namespace topic carrying the targets.
     */
    int emitToTargets(MessageEnvelope envelope) {
        int delivered = deliver(localTargetsOf(envelope), envelope);
        context.getMetrics().recordDeliverLocal(delivered);
        context.publish(topic, envelope.withOriginProcessId(context.getProcessId()));
        return delivered;
    }

    /**
     * Handles an envelope received on the namespace topic.
     */
    void onBrokerMessage(MessageEnvelope envelope) {
        context.getMetrics().recordBrokerReceived();
        if (envelope.isOriginatedBy(context.getProcessId())) {
            context.getMetrics().recordBrokerEchoSkipped();
            return;
        }
        Collection<Connection> targets = envelope.isTargeted()
            ? localTargetsOf(envelope)
            : connections.values();
        int delivered = deliver(targets, envelope);
        context.getMetrics().recordDeliverBroker(delivered);
        log.debug("Namespace envelope {} delivered to {} local connection(s) of {}", envelope.getId(), delivered, name);
    }

    private Collection<Connection> localTargetsOf(MessageEnvelope envelope) {
        Map<String, Connection> union = new LinkedHashMap<>();
        if (envelope.getRooms() != null) {
            for (String roomName : envelope.getRooms()) {
                Room room = rooms.get(roomName);
                if (room != null) {
                    room.snapshot().forEach(connection -> union.putIfAbsent(connection.getId(), connection));
                }
            }
        }
        if (envelope.getUsers() != null) {
            for (Connection connection : userConnectionsOf(envelope.getUsers())) {
                union.putIfAbsent(connection.getId(), connection);
            }
        }
        return union.values();
    }

    private List<Connection> userConnectionsOf(List<String> userIds) {
        List<Connection> result = new ArrayList<>();
        for (String userId : userIds) {
            Set<String> ids = userConnections.get(userId);
            if (ids == null) {
                continue;
            }
            for (String id : List.copyOf(ids)) {
                Connection connection = connections.get(id);
                if (connection != null) {
                    result.add(connection);
                }
            }
        }
        return result;
    }

    private int deliver(Collection<Connection> targets, MessageEnvelope envelope) {
        String frame = null;
        int delivered = 0;
        for (Connection connection : new ArrayList<>(targets)) {
            if (envelope.isExcluded(connection.getId())) {
                continue;
            }
            if (frame == null) {
                frame = EnvelopeCodec.encode(envelope);
            }
            if (connection.sendFrame(frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Members of a room across all processes, from the state adapter.
     */
    public Mono<Set<String>> fetchRoomMembers(String roomName) {
        return context.getStateAdapter().getUsersInRoom(name, roomName);
    }

    public Mono<Long> globalRoomSize(String roomName) {
        return context.getStateAdapter().getCountInRoom(name, roomName);
    }

    void onConnectionClosed(Connection connection) {
        for (String roomName : connection.getRooms()) {
            Room room = rooms.get(roomName);
            if (room != null) {
                room.remove(connection.getId());
            } else {
                connection.removeRoom(roomName);
            }
        }
        context.getTaskManager().stopAll(connection.getTaskOwnerId());

        if (connections.remove(connection.getId(), connection)) {
            unindexUser(connection);
            context.getMetrics().recordConnectionClosed();
            log.info("Connection {} disconnected from {}", connection.getId(), name);
            for (Consumer<Connection> listener : disconnectListeners) {
                try {
                    listener.accept(connection);
                } catch (Exception e) {
                    log.error("Disconnect listener failed for {}", connection.getId(), e);
                }
            }
        }
    }

    /**
     * Subscribes the namespace to its broker topic once.
     */
    void bindBroker() {
        BrokerAdapter broker = context.getBroker();
        if (broker == null || !brokerBound.compareAndSet(false, true)) {
            return;
        }
        broker.subscribe(topic, this::onBrokerMessage)
            .subscribe(subscription -> {
                if (closed.get()) {
                    subscription.dispose();
                } else {
                    brokerSubscription = subscription;
                }
            }, err -> log.error("Failed to subscribe namespace {} to {}", name, topic, err));
    }

    /**
     * Closes every connection, destroys every room and releases the broker subscription.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<Connection> open = new ArrayList<>(connections.values());
        open.forEach(connection -> connection.close(GOING_AWAY, "Server shutting down"));
        new ArrayList<>(rooms.values()).forEach(Room::destroy);

        Disposable subscription = brokerSubscription;
        if (subscription != null) {
            subscription.dispose();
        }
        context.getTaskManager().stopAll(getTaskOwnerId());
        log.info("Namespace {} closed ({} connection(s) dropped)", name, open.size());
    }

    @Nullable
    public Connection getConnection(String connectionId) {
        return connections.get(connectionId);
    }

    public Collection<Connection> getConnections() {
        return List.copyOf(connections.values());
    }

    /**
     * Local connections of a user in this namespace.
     */
    public Collection<Connection> getUserConnections(String userId) {
        return userConnectionsOf(List.of(userId));
    }

    public int connectionCount() {
        return connections.size();
    }

    public Set<String> getRoomNames() {
        return Set.copyOf(rooms.keySet());
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String getTaskOwnerId() {
        return "ns:" + name;
    }

    @Override
    public boolean isAlive() {
        return !closed.get();
    }
}
