package com.roomgate.gateway.ws;

import com.roomgate.gateway.config.GatewayConfig;
import com.roomgate.gateway.server.GatewayServer;
import com.roomgate.gateway.session.Connection;
import com.roomgate.gateway.session.Namespace;
import com.roomgate.gateway.transport.HandshakeInfo;
import com.roomgate.gateway.transport.WebSocketTransport;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket lifecycle of one client.
 * <p>
 * Protocol (server → client): {@code connect} welcome, {@code connect_error} on rejection,
 * {@code error} for refused frames, {@code joinedRoom}/{@code leftRoom} acknowledgements and
 * relayed envelopes.
 * </p>
 * <p>
 * Protocol (client → server): {@code joinRoom {roomId}}, {@code leaveRoom {roomId}},
 * {@code roomMessage {roomId, payload}} and application events {@code {event, payload}}.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final GatewayConfig config;
    private final GatewayServer server;

    public WebSocketHandler(GatewayConfig config, GatewayServer server) {
        this.config = config;
        this.server = server;
    }

    /**
     * Handles the WebSocket connection lifecycle.
     *
     * @param inbound   WebSocket inbound
     * @param outbound  WebSocket outbound
     * @param handshake Handshake metadata extracted before the upgrade
     * @return Publisher completing when the connection ends
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, HandshakeInfo handshake) {
        WebSocketTransport transport = new WebSocketTransport(config.getPerConnBufferSize());

        // Drains queued frames, then sends the close frame with the code the transport was closed with.
        Mono<Void> outboundPipeline = outbound.sendString(transport.frames())
            .then()
            .then(Mono.defer(() -> outbound.sendClose(transport.getCloseCode(), transport.getCloseReason())))
            .onErrorResume(err -> {
                log.debug("Outbound stream ended with error: {}", err.toString());
                return Mono.empty();
            });

        return server.accept(transport, handshake)
            .flatMap(connection -> {
                handleConnectionStateUpdates(inbound, connection);
                return Mono.when(outboundPipeline, handleInboundMessages(inbound, connection)).thenReturn(true);
            })
            // rejected: flush connect_error and the close frame
            .switchIfEmpty(Mono.defer(() -> outboundPipeline.thenReturn(false)))
            .then()
            .onErrorResume(err -> {
                log.error("WebSocket error in namespace {}", handshake.getNamespace(), err);
                return outbound.sendClose();
            });
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, Connection connection) {
        inbound.withConnection(nettyConnection -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingIntervalInMillis = config.getPingInterval() * 1000L;

            nettyConnection.onWriteIdle(pingIntervalInMillis, () -> nettyConnection.outbound().sendObject(
                    Mono.just(new PingWebSocketFrame())
                ).then().subscribe())
                .onReadIdle(idleTimeoutInMillis, () -> {
                    log.debug("Connection {} idle for {}ms, closing", connection.getId(), idleTimeoutInMillis);
                    connection.close(Namespace.GOING_AWAY, "Idle timeout");
                })
                .onDispose(() -> {
                    log.debug("WebSocket disposed for connection {}", connection.getId());
                    connection.close();
                });
        });
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, Connection connection) {
        return inbound.aggregateFrames()
            .receive()
            .asString()
            .onBackpressureBuffer(config.getPerConnBufferSize())
            .doOnNext(frame -> {
                try {
                    connection.onFrame(frame);
                } catch (Exception e) {
                    log.error("Failed to handle frame from {}", connection.getId(), e);
                }
            })
            .doOnError(err -> {
                // AbortedException is expected on close
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", connection.getId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then(Mono.fromRunnable(connection::close));
    }
}
