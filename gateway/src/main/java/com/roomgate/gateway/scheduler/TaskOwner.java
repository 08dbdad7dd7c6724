package com.roomgate.gateway.scheduler;

/**
 * Entity that recurring tasks can be attached to (connection, room, namespace, server).
 */
public interface TaskOwner {

    /**
     * Stable identity used to key tasks, e.g. {@code conn:<id>}.
     */
    String getTaskOwnerId();

    /**
     * Whether tasks owned by this entity should keep running.
     */
    boolean isAlive();
}
