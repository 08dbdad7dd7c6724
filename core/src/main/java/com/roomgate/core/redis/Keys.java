package com.roomgate.core.redis;

/**
 * Redis keyspace for cross-process room membership.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (rooms:, u_rooms:)</li>
 *   <li>Every key carries a TTL so a crashed process cannot leave entries behind forever</li>
 *   <li>Membership entries are sorted-set members scored by their expiry (epoch millis)</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Room members: {@code rooms:{namespace}:{room}}
     * <p>
     * <b>Type:</b> Sorted set; member = connection ID, score = expiry epoch millis
     * </p>
     *
     * @param namespace Namespace path
     * @param room      Room name
     * @return Redis key
     */
    public static String roomMembers(String namespace, String room) {
        return "rooms:" + namespace + ":" + room;
    }

    /**
     * Rooms of one connection: {@code u_rooms:{namespace}:{connectionId}}
     * <p>
     * <b>Type:</b> Set of room names
     * </p>
     *
     * @param namespace    Namespace path
     * @param connectionId Connection identifier
     * @return Redis key
     */
    public static String connectionRooms(String namespace, String connectionId) {
        return "u_rooms:" + namespace + ":" + connectionId;
    }
}
