package com.roomgate.gateway.session;

import com.roomgate.core.msg.MessageEnvelope;

/**
 * Handler for an application event sent by a client.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(Connection connection, MessageEnvelope envelope);
}
