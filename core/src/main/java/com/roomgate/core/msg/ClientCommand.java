package com.roomgate.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.roomgate.core.error.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Decoded client-to-server frame.
 * <p>
 * The reserved control events form a closed set of variants ({@link JoinRoom},
 * {@link LeaveRoom}, {@link RoomMessage}); every other event name becomes an
 * {@link AppEvent} routed to namespace handlers.
 * </p>
 * <p>
 * Frame shape: {@code {"event": "...", "payload": {...}, "room": "...", "traceId": "..."}};
 * {@code room} and {@code traceId} are optional and only read for application events.
 * </p>
 */
public abstract class ClientCommand {
    public static final String JOIN_ROOM = "joinRoom";
    public static final String LEAVE_ROOM = "leaveRoom";
    public static final String ROOM_MESSAGE = "roomMessage";

    private ClientCommand() {
    }

    public abstract String getEvent();

    /**
     * Decodes a client frame.
     *
     * @param frame parsed JSON frame
     * @return command variant
     * @throws ValidationException if the frame has no event name or a control event lacks its roomId
     */
    public static ClientCommand parse(JsonNode frame) {
        if (frame == null || !frame.isObject()) {
            throw new ValidationException("Frame must be a JSON object");
        }
        JsonNode eventNode = frame.get("event");
        if (eventNode == null || !eventNode.isTextual() || eventNode.asText().isBlank()) {
            throw new ValidationException("Missing event name");
        }
        String event = eventNode.asText();
        JsonNode payload = frame.get("payload");
        String traceId = textOrNull(frame, "traceId");

        return switch (event) {
            case JOIN_ROOM -> new JoinRoom(requireRoomId(event, payload));
            case LEAVE_ROOM -> new LeaveRoom(requireRoomId(event, payload));
            case ROOM_MESSAGE -> new RoomMessage(requireRoomId(event, payload), payload.get("payload"), traceId);
            default -> new AppEvent(event, textOrNull(frame, "room"), payload, traceId);
        };
    }

    private static String requireRoomId(String event, JsonNode payload) {
        String roomId = payload == null ? null : textOrNull(payload, "roomId");
        if (roomId == null || roomId.isBlank()) {
            throw new ValidationException(event + " requires payload.roomId");
        }
        return roomId;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class JoinRoom extends ClientCommand {
        String roomId;

        @Override
        public String getEvent() {
            return JOIN_ROOM;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class LeaveRoom extends ClientCommand {
        String roomId;

        @Override
        public String getEvent() {
            return LEAVE_ROOM;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class RoomMessage extends ClientCommand {
        String roomId;
        @Nullable
        JsonNode payload;
        @Nullable
        String traceId;

        @Override
        public String getEvent() {
            return ROOM_MESSAGE;
        }
    }

    /**
     * Application-defined event, forwarded unchanged to namespace handlers.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class AppEvent extends ClientCommand {
        String event;
        @Nullable
        String room;
        @Nullable
        JsonNode payload;
        @Nullable
        String traceId;
    }
}
