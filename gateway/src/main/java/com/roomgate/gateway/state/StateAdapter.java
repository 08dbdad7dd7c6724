package com.roomgate.gateway.state;

import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Cluster-wide view of room membership.
 * <p>
 * Used for observability and cross-process queries only; local broadcast never reads it.
 * Entries written by a process are re-stamped by {@link #refresh()} so entries of a process
 * that died without cleanup age out.
 * </p>
 */
public interface StateAdapter {

    Mono<Void> connect();

    /**
     * Records a connection as a member of a room.
     */
    Mono<Void> addUserToRoom(String namespace, String room, String connectionId);

    /**
     * Removes a connection from a room; the room entry disappears with its last member.
     */
    Mono<Void> removeUserFromRoom(String namespace, String room, String connectionId);

    /**
     * Connection IDs of a room across all processes.
     */
    Mono<Set<String>> getUsersInRoom(String namespace, String room);

    Mono<Long> getCountInRoom(String namespace, String room);

    Mono<Boolean> isMember(String namespace, String room, String connectionId);

    /**
     * Rooms a connection belongs to.
     */
    Mono<Set<String>> getConnectionRooms(String namespace, String connectionId);

    /**
     * Re-stamps every entry this process owns and purges expired ones.
     */
    Mono<Void> refresh();

    /**
     * Removes every entry this process owns. Called on shutdown.
     */
    Mono<Void> clearProcessData();

    Mono<Void> close();
}
