package com.roomgate.core.msg;

/**
 * Event names of frames the gateway itself sends to clients.
 */
public final class ServerEvents {
    private ServerEvents() {
    }

    /**
     * Welcome frame: {connectionId, namespace, processId}.
     */
    public static final String CONNECT = "connect";

    /**
     * Handshake rejected by middleware: {reason, code}. The transport is closed right after.
     */
    public static final String CONNECT_ERROR = "connect_error";

    /**
     * Malformed or refused client frame: {reason, code}. The connection stays open.
     */
    public static final String ERROR = "error";

    public static final String JOINED_ROOM = "joinedRoom";

    public static final String LEFT_ROOM = "leftRoom";
}
