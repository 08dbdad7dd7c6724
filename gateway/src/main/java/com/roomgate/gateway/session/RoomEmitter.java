package com.roomgate.gateway.session;

import com.roomgate.core.msg.MessageEnvelope;
import com.roomgate.core.msg.Topics;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fluent targeted emit: {@code namespace.to("a").to("b").except(id).emit("event", payload)}.
 * <p>
 * Chained targets are OR-ed; every targeted local connection receives the frame at most once.
 * A single target room is published on the room topic. Several targets, or any user target
 * ({@link #toUser}), are published once on the namespace topic with the room and user lists.
 * With no target the emit is namespace-wide.
 * </p>
 */
public class RoomEmitter {
    private final Namespace namespace;
    private final Set<String> rooms = new LinkedHashSet<>();
    private final Set<String> users = new LinkedHashSet<>();
    private final Set<String> except = new LinkedHashSet<>();

    RoomEmitter(Namespace namespace) {
        this.namespace = namespace;
    }

    public RoomEmitter to(String room) {
        rooms.add(room);
        return this;
    }

    public RoomEmitter in(String room) {
        return to(room);
    }

    /**
     * Targets every connection authenticated as the user, on every process.
     */
    public RoomEmitter toUser(String userId) {
        users.add(userId);
        return this;
    }

    public RoomEmitter except(String connectionId) {
        except.add(connectionId);
        return this;
    }

    public int emit(String event, @Nullable Object payload) {
        return emit(event, payload, null);
    }

    /**
     * Emits the event.
     *
     * @param event    Event name
     * @param payload  Payload
     * @param senderId Authoring connection, excluded from delivery; null for system messages
     * @return number of local connections the frame was written to
     */
    public int emit(String event, @Nullable Object payload, @Nullable String senderId) {
        List<String> excluded = except.isEmpty() ? null : new ArrayList<>(except);

        if (rooms.isEmpty() && users.isEmpty()) {
            return namespace.emitNamespaceWide(
                MessageEnvelope.create(namespace.getName(), null, event, payload, senderId).withExcept(excluded));
        }

        if (rooms.size() == 1 && users.isEmpty()) {
            String room = rooms.iterator().next();
            MessageEnvelope envelope = MessageEnvelope.create(namespace.getName(), room, event, payload, senderId)
                .withExcept(excluded);
            Optional<Room> local = namespace.getRoom(room);
            if (local.isPresent() && !local.get().isDestroyed()) {
                return local.get().broadcast(envelope);
            }
            // no local members; other processes may still have some
            GatewayContext context = namespace.getContext();
            context.publish(Topics.roomTopic(namespace.getName(), room),
                envelope.withOriginProcessId(context.getProcessId()));
            return 0;
        }

        return namespace.emitToTargets(
            MessageEnvelope.create(namespace.getName(), null, event, payload, senderId)
                .withRooms(rooms.isEmpty() ? null : new ArrayList<>(rooms))
                .withUsers(users.isEmpty() ? null : new ArrayList<>(users))
                .withExcept(excluded));
    }
}
