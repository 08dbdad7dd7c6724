package com.roomgate.core.metrics;

/**
 * Micrometer metric names used by the gateway.
 * <p>
 * <b>Naming convention:</b> {@code gateway.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Connections admitted after middleware.
     */
    public static final String CONNECTIONS_ACCEPTED_TOTAL = "gateway.connections.accepted.total";

    /**
     * Counter: Handshakes rejected by middleware.
     * <p>
     * Tags: nodeId, reason (validation/authorization/timeout)
     * </p>
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "gateway.connections.rejected.total";

    /**
     * Gauge: Currently open connections on this process.
     */
    public static final String CONNECTIONS_ACTIVE = "gateway.connections.active";

    /**
     * Counter: Frames handed to local connections.
     * <p>
     * Tags: nodeId, type (local/broker)
     * </p>
     */
    public static final String DELIVERED_TOTAL = "gateway.deliver.total";

    public static final String BROKER_PUBLISHED_TOTAL = "gateway.broker.published.total";

    public static final String BROKER_PUBLISH_FAILURES_TOTAL = "gateway.broker.publish.failures.total";

    public static final String BROKER_RECEIVED_TOTAL = "gateway.broker.received.total";

    /**
     * Counter: Broker messages skipped because this process published them.
     */
    public static final String BROKER_ECHO_SKIPPED_TOTAL = "gateway.broker.echo.skipped.total";

    /**
     * Counter: Client commands dropped for lack of room membership.
     */
    public static final String AUTHORIZATION_DROPS_TOTAL = "gateway.authorization.drops.total";

    public static final String NETWORK_INBOUND_WS_BYTES = "gateway.network.inbound.ws.bytes";

    public static final String NETWORK_OUTBOUND_WS_BYTES = "gateway.network.outbound.ws.bytes";

    public static final String MESSAGE_SIZE_INBOUND = "gateway.message.size.inbound";

    /**
     * Timer: Duration of the middleware chain per handshake.
     */
    public static final String MIDDLEWARE_LATENCY = "gateway.middleware.latency";
}
