package com.roomgate.gateway.broker;

import com.roomgate.core.msg.EnvelopeCodec;
import com.roomgate.core.msg.MessageEnvelope;
import com.roomgate.core.util.BytesUtils;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.reactive.ChannelMessage;
import io.lettuce.core.pubsub.api.reactive.RedisPubSubReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.Consumer;

/**
 * Redis pub/sub broker: one Redis channel per logical topic, JSON payloads.
 * <p>
 * Uses two Lettuce connections since a connection in subscriber mode cannot publish.
 * Inbound messages are validated and decoded before reaching handlers; foreign or
 * malformed payloads are dropped.
 * </p>
 */
public class RedisBrokerAdapter implements BrokerAdapter {
    private static final Logger log = LoggerFactory.getLogger(RedisBrokerAdapter.class);

    private final String redisUrl;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private RedisClient client;
    private StatefulRedisConnection<String, String> publishConnection;
    private StatefulRedisPubSubConnection<String, String> subscribeConnection;
    private RedisReactiveCommands<String, String> commands;
    private RedisPubSubReactiveCommands<String, String> pubSub;
    private Disposable channelListener;

    public RedisBrokerAdapter(String redisUrl) {
        this.redisUrl = redisUrl;
    }

    @Override
    public Mono<Void> connect() {
        return Mono.fromRunnable(() -> {
                client = RedisClient.create(redisUrl);
                publishConnection = client.connect();
                subscribeConnection = client.connectPubSub();
                commands = publishConnection.reactive();
                pubSub = subscribeConnection.reactive();
                channelListener = pubSub.observeChannels()
                    .subscribe(this::onChannelMessage,
                        err -> log.error("Redis channel listener terminated", err));
                log.info("Redis broker connected: {}", redisUrl);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private void onChannelMessage(ChannelMessage<String, String> message) {
        MessageEnvelope envelope = EnvelopeCodec.decode(message.getMessage());
        if (envelope == null) {
            log.warn("Ignoring invalid message on channel {} ({} bytes)",
                message.getChannel(), BytesUtils.getBytesLength(message.getMessage()));
            return;
        }
        registry.dispatch(message.getChannel(), envelope);
    }

    @Override
    public Mono<Void> publish(String topic, MessageEnvelope envelope) {
        if (commands == null) {
            return Mono.error(new IllegalStateException("Redis broker is not connected"));
        }
        return Mono.fromCallable(() -> EnvelopeCodec.encode(envelope))
            .flatMap(json -> commands.publish(topic, json))
            .doOnNext(receivers -> log.debug("Published envelope {} on {} to {} subscriber(s)",
                envelope.getId(), topic, receivers))
            .then();
    }

    @Override
    public Mono<Disposable> subscribe(String topic, Consumer<MessageEnvelope> handler) {
        return Mono.defer(() -> {
            SubscriptionRegistry.Registration registration = registry.add(topic, handler, () -> releaseChannel(topic));
            if (!registration.isFirst()) {
                return Mono.just(registration);
            }
            return pubSub.subscribe(topic)
                .doOnSuccess(v -> log.debug("Subscribed to Redis channel {}", topic))
                .onErrorResume(err -> {
                    registration.dispose();
                    return Mono.error(err);
                })
                .thenReturn(registration);
        });
    }

    private void releaseChannel(String topic) {
        if (pubSub == null) {
            return;
        }
        pubSub.unsubscribe(topic)
            .subscribe(
                v -> { },
                err -> log.warn("Failed to unsubscribe Redis channel {}: {}", topic, err.getMessage()),
                () -> log.debug("Unsubscribed from Redis channel {}", topic)
            );
    }

    @Override
    public Mono<Void> unsubscribe(String topic) {
        return Mono.defer(() -> {
            if (!registry.removeAll(topic) || pubSub == null) {
                return Mono.empty();
            }
            return pubSub.unsubscribe(topic);
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
                registry.clear();
                if (channelListener != null) {
                    channelListener.dispose();
                }
                if (subscribeConnection != null) {
                    subscribeConnection.close();
                }
                if (publishConnection != null) {
                    publishConnection.close();
                }
                if (client != null) {
                    client.shutdown();
                }
                log.info("Redis broker closed");
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }
}
