package com.roomgate.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.roomgate.core.error.ValidationException;
import com.roomgate.core.util.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import javax.annotation.Nullable;
import java.util.List;
import java.util.UUID;

/**
 * Canonical message record exchanged between clients, gateway processes and the broker.
 * <p>
 * <b>Immutability:</b> the payload tree is deep-copied on construction and on every read,
 * target lists are copied into unmodifiable lists. Derived envelopes are produced with the
 * {@code with*} methods.
 * </p>
 * <p>
 * <b>Echo suppression:</b> {@code sender} identifies the authoring connection (or
 * {@value #SYSTEM_SENDER}) and {@code originProcessId} the gateway process that published
 * the envelope to the broker. Receivers skip both.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageEnvelope {
    public static final int SCHEMA_VERSION = 1;
    public static final String SYSTEM_SENDER = "system";

    /**
     * Globally unique message ID (UUID).
     */
    @JsonProperty("id")
    String id;

    /**
     * Namespace path, e.g. "/" or "/chat".
     */
    @JsonProperty("ns")
    String namespace;

    /**
     * Target room; null means namespace-wide.
     */
    @JsonProperty("room")
    String room;

    @JsonProperty("event")
    String event;

    /**
     * Authoring connection ID, or "system" for server-initiated messages.
     */
    @JsonProperty("sender")
    String sender;

    /**
     * Application payload, opaque to the gateway.
     */
    @JsonProperty("payload")
    JsonNode payload;

    /**
     * Creation timestamp (epoch millis).
     */
    @JsonProperty("ts")
    long ts;

    @JsonProperty("v")
    int version;

    /**
     * Correlation ID carried across processes.
     */
    @JsonProperty("traceId")
    String traceId;

    /**
     * Process that published this envelope to the broker; null until published.
     */
    @JsonProperty("originProcessId")
    String originProcessId;

    /**
     * Room targets of a multi-room emit sent over the namespace channel.
     */
    @JsonProperty("rooms")
    List<String> rooms;

    /**
     * Connection IDs excluded from delivery.
     */
    @JsonProperty("except")
    List<String> except;

    /**
     * User IDs targeted by a user emit; every connection of those users receives the envelope.
     */
    @JsonProperty("users")
    List<String> users;

    @JsonCreator
    public MessageEnvelope(
        @JsonProperty("id") String id,
        @JsonProperty("ns") String namespace,
        @JsonProperty("room") String room,
        @JsonProperty("event") String event,
        @JsonProperty("sender") String sender,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("ts") long ts,
        @JsonProperty("v") int version,
        @JsonProperty("traceId") String traceId,
        @JsonProperty("originProcessId") String originProcessId,
        @JsonProperty("rooms") List<String> rooms,
        @JsonProperty("except") List<String> except,
        @JsonProperty("users") List<String> users
    ) {
        if (isBlank(namespace)) {
            throw new ValidationException("Envelope namespace is required");
        }
        if (isBlank(event)) {
            throw new ValidationException("Envelope event is required");
        }
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.namespace = namespace;
        this.room = room;
        this.event = event;
        this.sender = sender != null ? sender : SYSTEM_SENDER;
        this.payload = payload == null ? null : payload.deepCopy();
        this.ts = ts;
        this.version = version > 0 ? version : SCHEMA_VERSION;
        this.traceId = traceId;
        this.originProcessId = originProcessId;
        this.rooms = rooms == null ? null : List.copyOf(rooms);
        this.except = except == null ? null : List.copyOf(except);
        this.users = users == null ? null : List.copyOf(users);
    }

    /**
     * Creates a fully populated envelope.
     *
     * @param namespace Namespace path (required)
     * @param room      Target room, or null for namespace-wide
     * @param event     Event name (required)
     * @param payload   Payload; a {@link JsonNode} or any Jackson-convertible value
     * @param sender    Authoring connection ID; null means "system"
     * @param traceId   Correlation ID; generated when null
     * @return new envelope
     * @throws ValidationException if namespace or event is missing
     */
    public static MessageEnvelope create(String namespace, @Nullable String room, String event,
                                         @Nullable Object payload, @Nullable String sender,
                                         @Nullable String traceId) {
        return new MessageEnvelope(
            UUID.randomUUID().toString(),
            namespace,
            room,
            event,
            sender,
            toPayload(payload),
            System.currentTimeMillis(),
            SCHEMA_VERSION,
            traceId != null ? traceId : UUID.randomUUID().toString(),
            null,
            null,
            null,
            null
        );
    }

    public static MessageEnvelope create(String namespace, @Nullable String room, String event,
                                         @Nullable Object payload, @Nullable String sender) {
        return create(namespace, room, event, payload, sender, null);
    }

    /**
     * Structural check used on data received from the broker or other untrusted sources.
     * Never throws.
     *
     * @param candidate JSON tree to check
     * @return true if the tree carries textual id, ns and event fields and a numeric ts
     */
    public static boolean isValid(@Nullable JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            return false;
        }
        return hasText(candidate, "id")
            && hasText(candidate, "ns")
            && hasText(candidate, "event")
            && candidate.path("ts").isNumber();
    }

    public JsonNode getPayload() {
        return payload == null ? null : payload.deepCopy();
    }

    @JsonIgnore
    public boolean isNamespaceWide() {
        return room == null;
    }

    /**
     * True if the envelope names rooms or users; a targeted envelope never falls back to
     * namespace-wide delivery.
     */
    @JsonIgnore
    public boolean isTargeted() {
        return (rooms != null && !rooms.isEmpty()) || (users != null && !users.isEmpty());
    }

    @JsonIgnore
    public boolean isOriginatedBy(String processId) {
        return originProcessId != null && originProcessId.equals(processId);
    }

    @JsonIgnore
    public boolean isExcluded(String connectionId) {
        return connectionId.equals(sender) || (except != null && except.contains(connectionId));
    }

    private static JsonNode toPayload(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        return JsonUtils.mapper().valueToTree(payload);
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
