package com.roomgate.gateway.transport;

import com.roomgate.core.error.TransportException;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket-backed transport.
 * <p>
 * Frames are queued in a bounded multicast sink that the WebSocket handler drains into
 * {@code WebsocketOutbound#sendString}. Frames queued before the handler subscribes
 * (e.g. a {@code connect_error} written during the handshake) are kept and flushed first.
 * Closing completes the sink; the handler sends the close frame once the queue is flushed.
 * </p>
 */
public class WebSocketTransport implements Transport {
    private final Sinks.Many<String> sink;
    private final AtomicBoolean open = new AtomicBoolean(true);

    @Getter
    private volatile int closeCode = 1000;
    @Getter
    private volatile String closeReason = "";

    public WebSocketTransport(int bufferSize) {
        this.sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
    }

    public Flux<String> frames() {
        return sink.asFlux();
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void send(String frame) {
        if (!open.get()) {
            return;
        }
        Sinks.EmitResult result;
        // Emission must be serialized; broadcasts reach one connection from several threads.
        synchronized (sink) {
            result = sink.tryEmitNext(frame);
        }
        if (result.isFailure()) {
            throw new TransportException("Failed to queue frame: " + result, null);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (open.compareAndSet(true, false)) {
            this.closeCode = code;
            this.closeReason = reason;
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }
}
