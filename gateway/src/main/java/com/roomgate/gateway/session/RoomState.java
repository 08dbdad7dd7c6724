package com.roomgate.gateway.session;

/**
 * Room lifecycle: {@code ACTIVE -> DRAINING -> ACTIVE | DESTROYED}.
 * <p>
 * A room is DRAINING while its grace timer runs after the last member left.
 * </p>
 */
public enum RoomState {
    ACTIVE,
    DRAINING,
    DESTROYED
}
