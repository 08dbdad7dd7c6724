package com.roomgate.gateway.session;

import com.roomgate.core.msg.MessageEnvelope;
import com.roomgate.gateway.broker.BrokerAdapter;
import com.roomgate.gateway.metrics.MetricsService;
import com.roomgate.gateway.scheduler.ScheduledTaskManager;
import com.roomgate.gateway.state.StateAdapter;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Collaborators shared by every namespace, room and connection of one gateway process.
 */
@Value
@Builder(toBuilder = true)
public class GatewayContext {
    private static final Logger log = LoggerFactory.getLogger(GatewayContext.class);

    /**
     * Identity of this process, stamped on published envelopes for echo suppression.
     */
    String processId;

    /**
     * Null runs the gateway as a single process.
     */
    @Nullable
    BrokerAdapter broker;

    StateAdapter stateAdapter;

    ScheduledTaskManager taskManager;

    /**
     * Scheduler for room grace timers and timeouts.
     */
    Scheduler scheduler;

    MetricsService metrics;

    @Builder.Default
    Duration publishTimeout = Duration.ofSeconds(2);

    @Builder.Default
    Duration middlewareTimeout = Duration.ofSeconds(5);

    @Builder.Default
    RoomOptions defaultRoomOptions = RoomOptions.defaults();

    /**
     * Publishes best-effort: failures and timeouts are logged and counted, never propagated.
     *
     * @param topic    Broker topic
     * @param envelope Envelope already stamped with this process id
     */
    public void publish(String topic, MessageEnvelope envelope) {
        if (broker == null) {
            return;
        }
        Mono.defer(() -> broker.publish(topic, envelope))
            .timeout(publishTimeout, scheduler)
            .doOnSuccess(v -> metrics.recordBrokerPublished())
            .onErrorResume(err -> {
                metrics.recordBrokerPublishFailure();
                log.warn("Failed to publish envelope {} on {}: {}", envelope.getId(), topic, err.toString());
                return Mono.empty();
            })
            .subscribe();
    }

    /**
     * Runs a state adapter write in the background.
     *
     * @param operation   State write
     * @param description What is written, for the log
     */
    public void updateState(Mono<Void> operation, String description) {
        operation
            .timeout(publishTimeout, scheduler)
            .onErrorResume(err -> {
                log.warn("State update failed ({}): {}", description, err.toString());
                return Mono.empty();
            })
            .subscribe();
    }
}
