package com.roomgate.gateway.state;

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process state adapter. Entries never expire; they live as long as the process.
 */
public class InMemoryStateAdapter implements StateAdapter {

    private final Map<String, Set<String>> roomMembers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> connectionRooms = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> connect() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> addUserToRoom(String namespace, String room, String connectionId) {
        return Mono.fromRunnable(() -> {
            roomMembers.computeIfAbsent(roomKey(namespace, room), k -> ConcurrentHashMap.newKeySet())
                .add(connectionId);
            connectionRooms.computeIfAbsent(connectionKey(namespace, connectionId), k -> ConcurrentHashMap.newKeySet())
                .add(room);
        });
    }

    @Override
    public Mono<Void> removeUserFromRoom(String namespace, String room, String connectionId) {
        return Mono.fromRunnable(() -> {
            roomMembers.computeIfPresent(roomKey(namespace, room), (k, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
            connectionRooms.computeIfPresent(connectionKey(namespace, connectionId), (k, rooms) -> {
                rooms.remove(room);
                return rooms.isEmpty() ? null : rooms;
            });
        });
    }

    @Override
    public Mono<Set<String>> getUsersInRoom(String namespace, String room) {
        return Mono.fromSupplier(() -> Set.copyOf(roomMembers.getOrDefault(roomKey(namespace, room), Set.of())));
    }

    @Override
    public Mono<Long> getCountInRoom(String namespace, String room) {
        return Mono.fromSupplier(() -> (long) roomMembers.getOrDefault(roomKey(namespace, room), Set.of()).size());
    }

    @Override
    public Mono<Boolean> isMember(String namespace, String room, String connectionId) {
        return Mono.fromSupplier(() ->
            roomMembers.getOrDefault(roomKey(namespace, room), Set.of()).contains(connectionId));
    }

    @Override
    public Mono<Set<String>> getConnectionRooms(String namespace, String connectionId) {
        return Mono.fromSupplier(() ->
            Set.copyOf(connectionRooms.getOrDefault(connectionKey(namespace, connectionId), Set.of())));
    }

    @Override
    public Mono<Void> refresh() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> clearProcessData() {
        return Mono.fromRunnable(() -> {
            roomMembers.clear();
            connectionRooms.clear();
        });
    }

    @Override
    public Mono<Void> close() {
        return clearProcessData();
    }

    private static String roomKey(String namespace, String room) {
        return namespace + "\u0000" + room;
    }

    private static String connectionKey(String namespace, String connectionId) {
        return namespace + "\u0000" + connectionId;
    }
}
