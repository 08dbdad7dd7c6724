package com.roomgate.core.msg;

/**
 * Broker topic naming.
 * <p>
 * Topic naming convention:
 * <ul>
 *   <li>{@code gateway:<namespace>} for namespace-wide emits</li>
 *   <li>{@code gateway:<namespace>:room:<room>} for room broadcasts</li>
 * </ul>
 * Example: {@code gateway:/chat:room:general}
 * </p>
 */
public final class Topics {
    private Topics() {
    }

    public static final String PREFIX = "gateway:";

    /**
     * Kafka topic carrying all gateway traffic; the logical topic travels as the record key.
     */
    public static final String KAFKA_BROADCAST = "gateway.broadcast";

    public static String namespaceTopic(String namespace) {
        return PREFIX + namespace;
    }

    public static String roomTopic(String namespace, String room) {
        return PREFIX + namespace + ":room:" + room;
    }
}
