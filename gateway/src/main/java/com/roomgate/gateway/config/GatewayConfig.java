package com.roomgate.gateway.config;

import com.roomgate.core.msg.Topics;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.UUID;

/**
 * Configuration for a gateway process, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {

    public enum BrokerType { LOCAL, REDIS, KAFKA }

    public enum StateType { MEMORY, REDIS }

    String nodeId;
    int httpPort;
    BrokerType brokerType;
    StateType stateType;
    String redisUrl;
    String kafkaBootstrap;
    String kafkaTopic;
    int stateTtlSec;
    Duration publishTimeout;
    Duration middlewareTimeout;
    boolean roomAutoDelete;
    Duration roomEmptyTimeout;
    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;

    /**
     * Header carrying the user id set by an authenticating proxy; null disables authentication.
     */
    @Nullable
    String trustedIdentityHeader;

    public static GatewayConfig fromEnv() {
        return GatewayConfig.builder()
                .nodeId(getEnv("NODE_ID", "gateway-" + UUID.randomUUID().toString().substring(0, 8)))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .brokerType(BrokerType.valueOf(getEnv("BROKER", "local").toUpperCase()))
                .stateType(StateType.valueOf(getEnv("STATE", "memory").toUpperCase()))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .kafkaTopic(getEnv("KAFKA_TOPIC", Topics.KAFKA_BROADCAST))
                .stateTtlSec(Integer.parseInt(getEnv("STATE_TTL_SEC", "60")))
                .publishTimeout(Duration.ofMillis(Long.parseLong(getEnv("PUBLISH_TIMEOUT_MS", "2000"))))
                .middlewareTimeout(Duration.ofMillis(Long.parseLong(getEnv("MIDDLEWARE_TIMEOUT_MS", "5000"))))
                .roomAutoDelete(Boolean.parseBoolean(getEnv("ROOM_AUTO_DELETE", "true")))
                .roomEmptyTimeout(Duration.ofMillis(Long.parseLong(getEnv("ROOM_EMPTY_TIMEOUT_MS", "60000"))))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "30")))
                .trustedIdentityHeader(System.getenv("TRUSTED_IDENTITY_HEADER"))
                .build();
    }

    /**
     * Defaults suitable for a single in-process instance (tests, local runs).
     */
    public static GatewayConfig local(String nodeId) {
        return GatewayConfig.builder()
                .nodeId(nodeId)
                .httpPort(0)
                .brokerType(BrokerType.LOCAL)
                .stateType(StateType.MEMORY)
                .redisUrl("redis://localhost:6379")
                .kafkaBootstrap("localhost:9092")
                .kafkaTopic(Topics.KAFKA_BROADCAST)
                .stateTtlSec(60)
                .publishTimeout(Duration.ofSeconds(2))
                .middlewareTimeout(Duration.ofSeconds(5))
                .roomAutoDelete(true)
                .roomEmptyTimeout(Duration.ofSeconds(60))
                .perConnBufferSize(256)
                .pingInterval(10)
                .idleTimeout(30)
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
