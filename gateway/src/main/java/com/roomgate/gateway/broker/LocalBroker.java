package com.roomgate.gateway.broker;

import com.roomgate.core.msg.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * In-process broker: publish calls every handler of the topic synchronously, without
 * serialization. One instance may be shared by several gateway servers in the same JVM.
 */
public class LocalBroker implements BrokerAdapter {
    private static final Logger log = LoggerFactory.getLogger(LocalBroker.class);

    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    @Override
    public Mono<Void> connect() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> publish(String topic, MessageEnvelope envelope) {
        return Mono.fromRunnable(() -> {
            int handled = registry.dispatch(topic, envelope);
            log.debug("Local publish on {}: envelope {} reached {} handler(s)", topic, envelope.getId(), handled);
        });
    }

    @Override
    public Mono<Disposable> subscribe(String topic, Consumer<MessageEnvelope> handler) {
        return Mono.fromSupplier(() -> registry.add(topic, handler, () -> log.debug("Local topic {} released", topic)));
    }

    @Override
    public Mono<Void> unsubscribe(String topic) {
        return Mono.fromRunnable(() -> registry.removeAll(topic));
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(registry::clear);
    }

    public boolean hasSubscribers(String topic) {
        return registry.hasHandlers(topic);
    }
}
