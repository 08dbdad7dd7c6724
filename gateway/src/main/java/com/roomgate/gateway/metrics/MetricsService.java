package com.roomgate.gateway.metrics;

import com.roomgate.core.metrics.MetricsNames;
import com.roomgate.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics service for a gateway process.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsAccepted;
    private final Counter deliverLocal;
    private final Counter deliverBroker;
    private final Counter brokerPublished;
    private final Counter brokerPublishFailures;
    private final Counter brokerReceived;
    private final Counter brokerEchoSkipped;
    private final Counter authorizationDrops;

    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeInbound;

    private final Timer middlewareLatency;

    private final AtomicInteger activeConnections = new AtomicInteger();

    public MetricsService(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsAccepted = Counter.builder(MetricsNames.CONNECTIONS_ACCEPTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections admitted after middleware")
            .register(registry);

        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, activeConnections, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections currently open on this process")
            .register(registry);

        deliverLocal = Counter.builder(MetricsNames.DELIVERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "local")
            .description("Frames delivered to local connections from local emits")
            .register(registry);

        deliverBroker = Counter.builder(MetricsNames.DELIVERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "broker")
            .description("Frames delivered to local connections from broker messages")
            .register(registry);

        brokerPublished = Counter.builder(MetricsNames.BROKER_PUBLISHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        brokerPublishFailures = Counter.builder(MetricsNames.BROKER_PUBLISH_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Broker publishes that failed or timed out")
            .register(registry);

        brokerReceived = Counter.builder(MetricsNames.BROKER_RECEIVED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        brokerEchoSkipped = Counter.builder(MetricsNames.BROKER_ECHO_SKIPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Broker messages ignored because this process originated them")
            .register(registry);

        authorizationDrops = Counter.builder(MetricsNames.AUTHORIZATION_DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "not_member")
            .description("Room messages dropped because the sender is not a member")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_INBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        middlewareLatency = Timer.builder(MetricsNames.MIDDLEWARE_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Time spent running the middleware chain of a handshake")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofMillis(1000)
            )
            .register(registry);
    }

    /**
     * Metrics bound to a throwaway in-memory registry, for tests and embedded use.
     *
     * @param nodeId process id used as tag
     * @return metrics service
     */
    public static MetricsService noop(String nodeId) {
        return new MetricsService(new SimpleMeterRegistry(), nodeId);
    }

    public void recordConnectionAccepted() {
        connectionsAccepted.increment();
        activeConnections.incrementAndGet();
    }

    public void recordConnectionClosed() {
        activeConnections.decrementAndGet();
    }

    /**
     * Records a handshake rejected by middleware.
     *
     * @param reason validation, authorization or timeout
     */
    public void recordConnectionRejected(String reason) {
        Counter.builder(MetricsNames.CONNECTIONS_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordDeliverLocal(int count) {
        deliverLocal.increment(count);
    }

    public void recordDeliverBroker(int count) {
        deliverBroker.increment(count);
    }

    public void recordBrokerPublished() {
        brokerPublished.increment();
    }

    public void recordBrokerPublishFailure() {
        brokerPublishFailures.increment();
    }

    public void recordBrokerReceived() {
        brokerReceived.increment();
    }

    public void recordBrokerEchoSkipped() {
        brokerEchoSkipped.increment();
    }

    public void recordAuthorizationDrop() {
        authorizationDrops.increment();
    }

    public void recordMiddlewareLatency(long startNanos) {
        middlewareLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records bytes received from a WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    /**
     * Records bytes sent to a WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
