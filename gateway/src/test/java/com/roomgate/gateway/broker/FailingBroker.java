package com.roomgate.gateway.broker;

import com.roomgate.core.msg.MessageEnvelope;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Broker stub whose publishes fail; optionally fails to connect as well.
 */
public class FailingBroker implements BrokerAdapter {
    private final boolean failConnect;
    private final AtomicInteger publishAttempts = new AtomicInteger();

    public FailingBroker(boolean failConnect) {
        this.failConnect = failConnect;
    }

    @Override
    public Mono<Void> connect() {
        return failConnect ? Mono.error(new IllegalStateException("broker unreachable")) : Mono.empty();
    }

    @Override
    public Mono<Void> publish(String topic, MessageEnvelope envelope) {
        publishAttempts.incrementAndGet();
        return Mono.error(new IllegalStateException("publish failed"));
    }

    @Override
    public Mono<Disposable> subscribe(String topic, Consumer<MessageEnvelope> handler) {
        return Mono.<Disposable>just(() -> { });
    }

    @Override
    public Mono<Void> unsubscribe(String topic) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> close() {
        return Mono.empty();
    }

    public int getPublishAttempts() {
        return publishAttempts.get();
    }
}
