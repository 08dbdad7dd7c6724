package com.roomgate.gateway.server;

import com.roomgate.gateway.broker.BrokerAdapter;
import com.roomgate.gateway.broker.KafkaBrokerAdapter;
import com.roomgate.gateway.broker.LocalBroker;
import com.roomgate.gateway.broker.RedisBrokerAdapter;
import com.roomgate.gateway.config.GatewayConfig;
import com.roomgate.gateway.metrics.MetricsService;
import com.roomgate.gateway.scheduler.ScheduledTaskManager;
import com.roomgate.gateway.scheduler.TaskOwner;
import com.roomgate.gateway.session.Connection;
import com.roomgate.gateway.session.GatewayContext;
import com.roomgate.gateway.session.Namespace;
import com.roomgate.gateway.session.NamespaceRegistry;
import com.roomgate.gateway.session.RoomOptions;
import com.roomgate.gateway.state.InMemoryStateAdapter;
import com.roomgate.gateway.state.RedisStateAdapter;
import com.roomgate.gateway.state.StateAdapter;
import com.roomgate.gateway.transport.HandshakeInfo;
import com.roomgate.gateway.transport.Transport;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One gateway process: owns the process id, the namespace registry, the broker and state
 * adapters, the task manager and metrics.
 * <p>
 * Lifecycle: {@link #start()} connects the broker and the state adapter (a failure aborts
 * start) and schedules the periodic state refresh; {@link #stop()} closes every namespace,
 * clears this process's state entries and closes the adapters.
 * </p>
 */
public class GatewayServer implements TaskOwner {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    static final String STATE_REFRESH_TASK = "state-refresh";

    @Getter
    private final GatewayContext context;
    @Getter
    private final NamespaceRegistry namespaces;
    private final Duration stateRefreshInterval;
    private final AtomicBoolean running = new AtomicBoolean();

    public GatewayServer(GatewayContext context, Duration stateRefreshInterval) {
        this.context = context;
        this.namespaces = new NamespaceRegistry(context);
        this.stateRefreshInterval = stateRefreshInterval;
    }

    /**
     * Builds a server with the adapters selected by the configuration.
     *
     * @param config  Process configuration
     * @param metrics Metrics service
     * @return server, not started
     */
    public static GatewayServer fromConfig(GatewayConfig config, MetricsService metrics) {
        Scheduler scheduler = Schedulers.parallel();

        BrokerAdapter broker = switch (config.getBrokerType()) {
            case LOCAL -> new LocalBroker();
            case REDIS -> new RedisBrokerAdapter(config.getRedisUrl());
            case KAFKA -> new KafkaBrokerAdapter(config.getKafkaBootstrap(), config.getKafkaTopic(), config.getNodeId());
        };

        Duration ttl = Duration.ofSeconds(config.getStateTtlSec());
        StateAdapter stateAdapter = switch (config.getStateType()) {
            case MEMORY -> new InMemoryStateAdapter();
            case REDIS -> new RedisStateAdapter(config.getRedisUrl(), ttl);
        };

        GatewayContext context = GatewayContext.builder()
            .processId(config.getNodeId())
            .broker(broker)
            .stateAdapter(stateAdapter)
            .taskManager(new ScheduledTaskManager(scheduler))
            .scheduler(scheduler)
            .metrics(metrics)
            .publishTimeout(config.getPublishTimeout())
            .middlewareTimeout(config.getMiddlewareTimeout())
            .defaultRoomOptions(RoomOptions.builder()
                .autoDeleteEmpty(config.isRoomAutoDelete())
                .emptyTimeout(config.getRoomEmptyTimeout())
                .build())
            .build();

        return new GatewayServer(context, refreshIntervalFor(ttl));
    }

    /**
     * Entries are re-stamped three times per TTL, at most once per second.
     */
    static Duration refreshIntervalFor(Duration ttl) {
        Duration third = ttl.dividedBy(3);
        return third.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : third;
    }

    /**
     * Connects the adapters and starts the state refresh task.
     *
     * @return Mono completing when the server accepts connections; errors if an adapter cannot connect
     */
    public Mono<Void> start() {
        return Mono.defer(() -> {
                BrokerAdapter broker = context.getBroker();
                Mono<Void> brokerReady = broker != null ? broker.connect() : Mono.empty();
                return brokerReady.then(Mono.defer(() -> context.getStateAdapter().connect()));
            })
            .doOnSuccess(v -> {
                running.set(true);
                context.getTaskManager().addTask(this, STATE_REFRESH_TASK, stateRefreshInterval,
                    () -> context.updateState(context.getStateAdapter().refresh(), "refresh"));
                log.info("Gateway {} started", context.getProcessId());
            })
            .doOnError(err -> log.error("Gateway {} failed to start", context.getProcessId(), err));
    }

    /**
     * Returns the namespace, creating it if absent.
     */
    public Namespace of(String name) {
        return namespaces.of(name);
    }

    /**
     * Admits a client into the namespace named by its handshake.
     *
     * @return the registered connection, or empty if it was rejected
     */
    public Mono<Connection> accept(Transport transport, HandshakeInfo handshake) {
        if (!running.get()) {
            log.warn("Refusing connection: gateway {} is not running", context.getProcessId());
            transport.close(Namespace.GOING_AWAY, "Gateway is not running");
            return Mono.empty();
        }
        return namespaces.of(handshake.getNamespace()).add(transport, handshake);
    }

    /**
     * Closes every namespace, removes this process's state entries and closes the adapters.
     *
     * @return Mono completing when shutdown is done
     */
    public Mono<Void> stop() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(true, false)) {
                return Mono.empty();
            }
            log.info("Stopping gateway {}", context.getProcessId());
            context.getTaskManager().stopAll(getTaskOwnerId());
            namespaces.clear();

            BrokerAdapter broker = context.getBroker();
            StateAdapter stateAdapter = context.getStateAdapter();
            return stateAdapter.clearProcessData()
                .onErrorResume(err -> {
                    log.warn("Failed to clear state of gateway {}: {}", context.getProcessId(), err.toString());
                    return Mono.empty();
                })
                .then(stateAdapter.close())
                .then(broker != null ? broker.close() : Mono.empty())
                .doFinally(signal -> {
                    context.getTaskManager().shutdown();
                    log.info("Gateway {} stopped", context.getProcessId());
                });
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getProcessId() {
        return context.getProcessId();
    }

    @Override
    public String getTaskOwnerId() {
        return "server:" + context.getProcessId();
    }

    @Override
    public boolean isAlive() {
        return running.get();
    }
}
