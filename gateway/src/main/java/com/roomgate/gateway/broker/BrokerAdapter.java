package com.roomgate.gateway.broker;

import com.roomgate.core.msg.MessageEnvelope;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Cross-process pub/sub used to fan envelopes out to every gateway process.
 * <p>
 * Implementations hold no domain state. Several local handlers on the same topic share one
 * underlying subscription; the subscription is released when the last handler is disposed
 * or the topic is unsubscribed.
 * </p>
 */
public interface BrokerAdapter {

    /**
     * Establishes the broker connection. An error aborts gateway start.
     *
     * @return Mono completing when the broker is usable
     */
    Mono<Void> connect();

    /**
     * Publishes an envelope on a topic.
     *
     * @param topic    Logical topic (see {@link com.roomgate.core.msg.Topics})
     * @param envelope Envelope carrying origin process and sender
     * @return Mono completing when the broker accepted the message
     */
    Mono<Void> publish(String topic, MessageEnvelope envelope);

    /**
     * Registers a handler for a topic.
     *
     * @param topic   Logical topic
     * @param handler Invoked for every envelope received on the topic
     * @return Mono emitting a handle that removes this handler when disposed
     */
    Mono<Disposable> subscribe(String topic, Consumer<MessageEnvelope> handler);

    /**
     * Drops every handler of a topic and the underlying subscription.
     *
     * @param topic Logical topic
     * @return Mono completing when unsubscribed
     */
    Mono<Void> unsubscribe(String topic);

    Mono<Void> close();
}
