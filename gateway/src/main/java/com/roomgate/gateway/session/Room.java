package com.roomgate.gateway.session;

import com.roomgate.core.msg.EnvelopeCodec;
import com.roomgate.core.msg.MessageEnvelope;
import com.roomgate.core.msg.Topics;
import com.roomgate.gateway.broker.BrokerAdapter;
import com.roomgate.gateway.scheduler.TaskOwner;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Named group of local connections inside a namespace.
 * <p>
 * Membership changes are serialized by the room lock and update the member's own room set in
 * the same critical section. Broadcasts snapshot the members under the lock and write frames
 * outside it. A room subscribes to its broker topic so that broadcasts made by other
 * processes reach its local members; envelopes this process published are skipped.
 * </p>
 */
public class Room implements TaskOwner {
    private static final Logger log = LoggerFactory.getLogger(Room.class);

    @Getter
    private final String name;
    @Getter
    private final Namespace namespace;
    @Getter
    private final RoomOptions options;
    @Getter
    private final long createdAt;
    @Getter
    private final String topic;

    private final GatewayContext context;
    private final Object lock = new Object();
    private final Map<String, Connection> members = new LinkedHashMap<>();
    private final AtomicBoolean brokerBound = new AtomicBoolean();

    private RoomState state = RoomState.ACTIVE;
    private Disposable emptyTimer;
    private Disposable brokerSubscription;

    Room(String name, Namespace namespace, RoomOptions options) {
        this.name = name;
        this.namespace = namespace;
        this.options = options;
        this.context = namespace.getContext();
        this.createdAt = System.currentTimeMillis();
        this.topic = Topics.roomTopic(namespace.getName(), name);
    }

    /**
     * Adds a member. Joining again is a no-op; joining cancels a running grace timer.
     *
     * @return false if the room has been destroyed
     */
    public boolean add(Connection connection) {
        synchronized (lock) {
            if (state == RoomState.DESTROYED) {
                return false;
            }
            cancelEmptyTimer();
            state = RoomState.ACTIVE;
            if (members.putIfAbsent(connection.getId(), connection) != null) {
                return true;
            }
            connection.addRoom(name);
        }
        context.updateState(
            context.getStateAdapter().addUserToRoom(namespace.getName(), name, connection.getId()),
            "join " + connection.getId() + " " + topic
        );
        log.debug("Connection {} joined room {} in {}", connection.getId(), name, namespace.getName());
        return true;
    }

    /**
     * Removes a member. When the room becomes empty and auto-delete is on, the grace timer
     * starts; with a zero timeout the room is destroyed right away.
     *
     * @return true if the connection was a member
     */
    public boolean remove(String connectionId) {
        boolean destroyNow = false;
        synchronized (lock) {
            Connection connection = members.remove(connectionId);
            if (connection == null) {
                return false;
            }
            connection.removeRoom(name);
            if (members.isEmpty() && options.isAutoDeleteEmpty() && state == RoomState.ACTIVE) {
                if (options.getEmptyTimeout().isZero() || options.getEmptyTimeout().isNegative()) {
                    destroyNow = true;
                } else {
                    state = RoomState.DRAINING;
                    emptyTimer = Mono.delay(options.getEmptyTimeout(), context.getScheduler())
                        .subscribe(tick -> destroyIfEmpty());
                    log.debug("Room {} in {} is empty, destroying in {}ms",
                        name, namespace.getName(), options.getEmptyTimeout().toMillis());
                }
            }
        }
        context.updateState(
            context.getStateAdapter().removeUserFromRoom(namespace.getName(), name, connectionId),
            "leave " + connectionId + " " + topic
        );
        log.debug("Connection {} left room {} in {}", connectionId, name, namespace.getName());
        if (destroyNow) {
            destroyIfEmpty();
        }
        return true;
    }

    /**
     * Broadcasts an event to every member except the sender, locally and through the broker.
     *
     * @param event    Event name
     * @param payload  Payload
     * @param senderId Authoring connection, excluded from delivery; null for system messages
     * @return number of local connections the frame was written to
     */
    public int broadcast(String event, @Nullable Object payload, @Nullable String senderId) {
        return broadcast(MessageEnvelope.create(namespace.getName(), name, event, payload, senderId));
    }

    public int broadcast(MessageEnvelope envelope) {
        if (isDestroyed()) {
            log.debug("Broadcast to destroyed room {} in {} ignored", name, namespace.getName());
            return 0;
        }
        int delivered = deliverLocal(envelope);
        context.getMetrics().recordDeliverLocal(delivered);
        context.publish(topic, envelope.withOriginProcessId(context.getProcessId()));
        return delivered;
    }

    /**
     * Handles an envelope received on this room's broker topic.
     */
    void onBrokerMessage(MessageEnvelope envelope) {
        context.getMetrics().recordBrokerReceived();
        if (envelope.isOriginatedBy(context.getProcessId())) {
            context.getMetrics().recordBrokerEchoSkipped();
            return;
        }
        int delivered = deliverLocal(envelope);
        context.getMetrics().recordDeliverBroker(delivered);
        log.debug("Broker envelope {} delivered to {} member(s) of {}", envelope.getId(), delivered, topic);
    }

    int deliverLocal(MessageEnvelope envelope) {
        List<Connection> targets = snapshot();
        String frame = null;
        int delivered = 0;
        for (Connection connection : targets) {
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

    List<Connection> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(members.values());
        }
    }

    /**
     * Subscribes the room to its broker topic once.
     */
    void bindBroker() {
        BrokerAdapter broker = context.getBroker();
        if (broker == null || !brokerBound.compareAndSet(false, true)) {
            return;
        }
        broker.subscribe(topic, this::onBrokerMessage)
            .subscribe(subscription -> {
                boolean destroyed;
                synchronized (lock) {
                    destroyed = state == RoomState.DESTROYED;
                    if (!destroyed) {
                        brokerSubscription = subscription;
                    }
                }
                if (destroyed) {
                    subscription.dispose();
                }
            }, err -> log.error("Failed to subscribe room {} to {}", name, topic, err));
    }

    /**
     * Destroys the room if it has no members.
     *
     * @return true if this call destroyed the room
     */
    boolean destroyIfEmpty() {
        return destroy(true);
    }

    /**
     * Destroys the room: unsubscribes its broker topic, clears membership without individual
     * leaves, stops its tasks and removes it from the namespace. Safe to repeat.
     */
    public void destroy() {
        destroy(false);
    }

    private boolean destroy(boolean onlyIfEmpty) {
        List<Connection> evicted;
        Disposable subscription;
        synchronized (lock) {
            if (state == RoomState.DESTROYED || (onlyIfEmpty && !members.isEmpty())) {
                return false;
            }
            state = RoomState.DESTROYED;
            cancelEmptyTimer();
            evicted = new ArrayList<>(members.values());
            members.clear();
            evicted.forEach(connection -> connection.removeRoom(name));
            subscription = brokerSubscription;
            brokerSubscription = null;
        }

        if (subscription != null) {
            subscription.dispose();
        }
        context.getTaskManager().stopAll(getTaskOwnerId());
        namespace.onRoomDestroyed(this);
        for (Connection connection : evicted) {
            context.updateState(
                context.getStateAdapter().removeUserFromRoom(namespace.getName(), name, connection.getId()),
                "evict " + connection.getId() + " " + topic
            );
        }
        log.info("Room {} in {} destroyed ({} member(s) evicted)", name, namespace.getName(), evicted.size());
        return true;
    }

    private void cancelEmptyTimer() {
        if (emptyTimer != null) {
            emptyTimer.dispose();
            emptyTimer = null;
        }
    }

    public int size() {
        synchronized (lock) {
            return members.size();
        }
    }

    public boolean contains(String connectionId) {
        synchronized (lock) {
            return members.containsKey(connectionId);
        }
    }

    public Set<String> memberIds() {
        synchronized (lock) {
            return Set.copyOf(members.keySet());
        }
    }

    public RoomState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isDestroyed() {
        return getState() == RoomState.DESTROYED;
    }

    @Override
    public String getTaskOwnerId() {
        return "room:" + namespace.getName() + ":" + name;
    }

    @Override
    public boolean isAlive() {
        return !isDestroyed();
    }
}
