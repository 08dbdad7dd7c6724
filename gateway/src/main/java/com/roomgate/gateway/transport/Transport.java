package com.roomgate.gateway.transport;

/**
 * One physical duplex channel to a client.
 * <p>
 * The gateway only needs discrete text frames out and a close signal; the wire protocol
 * underneath (WebSocket, test doubles) is up to the implementation.
 * </p>
 */
public interface Transport {

    boolean isOpen();

    /**
     * Writes one text frame.
     *
     * @param frame serialized frame
     * @throws com.roomgate.core.error.TransportException if the frame cannot be queued
     */
    void send(String frame);

    /**
     * Closes the channel. Idempotent.
     *
     * @param code   close code (WebSocket semantics)
     * @param reason human-readable reason
     */
    void close(int code, String reason);
}
