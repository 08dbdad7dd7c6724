package com.roomgate.gateway.broker;

import com.roomgate.core.msg.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Local handler bookkeeping shared by the broker adapters.
 * <p>
 * Tracks handlers per topic so an adapter opens one underlying subscription per topic and
 * closes it when the last handler goes away.
 * </p>
 */
public class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<String, List<Consumer<MessageEnvelope>>> handlers = new ConcurrentHashMap<>();

    /**
     * Adds a handler.
     *
     * @param topic         Logical topic
     * @param handler       Envelope handler
     * @param onLastRemoved Called once the topic has no handlers left after disposal
     * @return registration; {@link Registration#isFirst()} tells whether the topic was new
     */
    public Registration add(String topic, Consumer<MessageEnvelope> handler, Runnable onLastRemoved) {
        boolean[] first = new boolean[1];
        handlers.compute(topic, (t, list) -> {
            List<Consumer<MessageEnvelope>> target = list;
            if (target == null) {
                target = new CopyOnWriteArrayList<>();
                first[0] = true;
            }
            target.add(handler);
            return target;
        });
        return new Registration(topic, handler, first[0], onLastRemoved);
    }

    /**
     * Removes every handler of a topic.
     *
     * @return true if the topic had handlers
     */
    public boolean removeAll(String topic) {
        return handlers.remove(topic) != null;
    }

    /**
     * Invokes every handler of the topic. A failing handler does not affect the others.
     *
     * @return number of handlers invoked
     */
    public int dispatch(String topic, MessageEnvelope envelope) {
        List<Consumer<MessageEnvelope>> list = handlers.get(topic);
        if (list == null) {
            return 0;
        }
        int count = 0;
        for (Consumer<MessageEnvelope> handler : list) {
            try {
                handler.accept(envelope);
                count++;
            } catch (Exception e) {
                log.error("Handler for topic {} failed on envelope {}", topic, envelope.getId(), e);
            }
        }
        return count;
    }

    public boolean hasHandlers(String topic) {
        return handlers.containsKey(topic);
    }

    public void clear() {
        handlers.clear();
    }

    /**
     * Handle for one registered handler.
     */
    public final class Registration implements Disposable {
        private final String topic;
        private final Consumer<MessageEnvelope> handler;
        private final boolean first;
        private final Runnable onLastRemoved;
        private final AtomicBoolean disposed = new AtomicBoolean();

        private Registration(String topic, Consumer<MessageEnvelope> handler, boolean first,
                             Runnable onLastRemoved) {
            this.topic = topic;
            this.handler = handler;
            this.first = first;
            this.onLastRemoved = onLastRemoved;
        }

        public boolean isFirst() {
            return first;
        }

        @Override
        public void dispose() {
            if (!disposed.compareAndSet(false, true)) {
                return;
            }
            boolean[] last = new boolean[1];
            handlers.computeIfPresent(topic, (t, list) -> {
                list.remove(handler);
                if (list.isEmpty()) {
                    last[0] = true;
                    return null;
                }
                return list;
            });
            if (last[0]) {
                onLastRemoved.run();
            }
        }

        @Override
        public boolean isDisposed() {
            return disposed.get();
        }
    }
}
