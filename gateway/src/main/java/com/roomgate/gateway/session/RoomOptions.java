package com.roomgate.gateway.session;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-room behaviour.
 */
@Value
@Builder(toBuilder = true)
public class RoomOptions {
    /**
     * Destroy the room once it has been empty for {@link #emptyTimeout}.
     */
    @Builder.Default
    boolean autoDeleteEmpty = true;

    /**
     * Grace period before an empty room is destroyed; zero destroys it immediately.
     */
    @Builder.Default
    Duration emptyTimeout = Duration.ofSeconds(60);

    public static RoomOptions defaults() {
        return RoomOptions.builder().build();
    }
}
