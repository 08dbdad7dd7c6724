package com.roomgate.gateway.session;

import com.roomgate.core.error.GatewayException;
import com.roomgate.core.error.ValidationException;
import com.roomgate.core.msg.ClientCommand;
import com.roomgate.core.msg.EnvelopeCodec;
import com.roomgate.core.msg.MessageEnvelope;
import com.roomgate.core.msg.ServerEvents;
import com.roomgate.core.util.BytesUtils;
import com.roomgate.core.util.JsonUtils;
import com.roomgate.gateway.scheduler.TaskOwner;
import com.roomgate.gateway.transport.HandshakeInfo;
import com.roomgate.gateway.transport.Transport;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client attached to a namespace through a {@link Transport}.
 * <p>
 * The set of joined room names mirrors the rooms that hold this connection; it is only
 * changed by {@link Room} under the room's lock.
 * </p>
 */
public class Connection implements TaskOwner {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    public static final int NORMAL_CLOSURE = 1000;

    @Getter
    private final String id;
    @Getter
    private final Namespace namespace;
    @Getter
    private final HandshakeInfo handshake;
    @Getter
    private final long connectedAt;

    private final Transport transport;
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);

    private volatile String userId;

    Connection(String id, Namespace namespace, Transport transport, HandshakeInfo handshake) {
        this.id = id;
        this.namespace = namespace;
        this.transport = transport;
        this.handshake = handshake;
        this.connectedAt = System.currentTimeMillis();
    }

    /**
     * Writes an envelope to the client. Dropped when the connection is closing or closed.
     *
     * @return true if the frame was queued on the transport
     */
    public boolean send(MessageEnvelope envelope) {
        if (!isOpen()) {
            return false;
        }
        return sendFrame(EnvelopeCodec.encode(envelope));
    }

    /**
     * Sends a server-initiated event to this client only.
     */
    public boolean emit(String event, @Nullable Object payload) {
        return send(MessageEnvelope.create(namespace.getName(), null, event, payload, null));
    }

    boolean sendFrame(String frame) {
        if (!isOpen() || !transport.isOpen()) {
            return false;
        }
        try {
            transport.send(frame);
            namespace.getContext().getMetrics().recordNetworkOutboundWs(BytesUtils.getBytesLength(frame));
            return true;
        } catch (Exception e) {
            log.warn("Failed to write frame to connection {}: {}", id, e.getMessage());
            return false;
        }
    }

    void sendError(int code, String reason) {
        emit(ServerEvents.ERROR, Map.of("reason", reason, "code", code));
    }

    public boolean join(String room) {
        return namespace.joinRoom(this, room);
    }

    public boolean leave(String room) {
        return namespace.leaveRoom(this, room);
    }

    public boolean isInRoom(String room) {
        return rooms.contains(room);
    }

    /**
     * @return snapshot of joined room names
     */
    public Set<String> getRooms() {
        return Set.copyOf(rooms);
    }

    void addRoom(String room) {
        rooms.add(room);
    }

    void removeRoom(String room) {
        rooms.remove(room);
    }

    /**
     * Handles one inbound text frame. Malformed frames are answered with an {@code error}
     * frame; the connection stays open.
     *
     * @param text raw frame
     */
    public void onFrame(String text) {
        if (!isOpen()) {
            return;
        }
        namespace.getContext().getMetrics().recordNetworkInboundWs(BytesUtils.getBytesLength(text));
        try (MDC.MDCCloseable ignored = MDC.putCloseable("connectionId", id)) {
            ClientCommand command;
            try {
                command = ClientCommand.parse(JsonUtils.readTree(text));
            } catch (ValidationException e) {
                log.debug("Rejected frame from {}: {}", id, e.getMessage());
                sendError(e.getCode(), e.getMessage());
                return;
            } catch (IllegalArgumentException e) {
                log.debug("Malformed frame from {}: {}", id, e.getMessage());
                sendError(ValidationException.DEFAULT_CODE, "Malformed frame");
                return;
            }

            try {
                namespace.handleClientMessage(id, command);
            } catch (GatewayException e) {
                log.debug("Command {} from {} refused: {}", command.getEvent(), id, e.getMessage());
                sendError(e.getCode(), e.getMessage());
            }
        }
    }

    /**
     * Schedules recurring work that stops when this connection closes.
     *
     * @return false if a task with this id is already scheduled or the connection is closed
     */
    public boolean schedule(String taskId, Duration interval, Runnable work) {
        return namespace.getContext().getTaskManager().addTask(this, taskId, interval, work);
    }

    public void close() {
        close(NORMAL_CLOSURE, "Normal closure");
    }

    /**
     * Closes the connection. Idempotent.
     * <p>
     * Room membership and scheduled tasks are released before this method returns; the
     * transport is closed last.
     * </p>
     *
     * @param code   close code sent to the client
     * @param reason close reason
     */
    public void close(int code, String reason) {
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSING)) {
            return;
        }
        try {
            namespace.onConnectionClosed(this);
        } finally {
            state.set(ConnectionState.CLOSED);
            try {
                transport.close(code, reason);
            } catch (Exception e) {
                log.warn("Failed to close transport of connection {}: {}", id, e.getMessage());
            }
            log.debug("Connection {} closed: {} {}", id, code, reason);
        }
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    public ConnectionState getState() {
        return state.get();
    }

    @Nullable
    public String getUserId() {
        return userId;
    }

    public void setUserId(@Nullable String userId) {
        this.userId = userId;
    }

    @SuppressWarnings("unchecked")
    @Nullable
    public <T> T getAttribute(String key) {
        return (T) attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    @Override
    public String getTaskOwnerId() {
        return "conn:" + id;
    }

    @Override
    public boolean isAlive() {
        return isOpen();
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", ns=" + namespace.getName() + ", state=" + state.get() + "}";
    }
}
