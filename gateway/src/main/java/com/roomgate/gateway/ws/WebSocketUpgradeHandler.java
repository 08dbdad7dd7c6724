package com.roomgate.gateway.ws;

import com.roomgate.gateway.config.GatewayConfig;
import com.roomgate.gateway.server.GatewayServer;
import com.roomgate.gateway.session.NamespaceRegistry;
import com.roomgate.gateway.transport.HandshakeInfo;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.net.InetSocketAddress;
import java.util.Locale;

/**
 * Turns an upgrade request into {@link HandshakeInfo} before the WebSocket upgrade.
 * <p>
 * {@code /ws} maps to namespace {@code /}, {@code /ws/{namespace}} to {@code /{namespace}}.
 * Query parameters keep their first value; header names are lower-cased.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final GatewayServer server;
    private final WebSocketHandler wsHandler;

    public WebSocketUpgradeHandler(GatewayConfig config, GatewayServer server) {
        this.server = server;
        this.wsHandler = new WebSocketHandler(config, server);
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (!server.isRunning()) {
            log.warn("Rejecting WebSocket upgrade - gateway is not running");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - gateway is not running"))
                .then();
        }

        HandshakeInfo handshake = toHandshake(req);
        log.debug("WebSocket upgrade for namespace {} from {}", handshake.getNamespace(), handshake.getRemoteAddress());

        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, handshake));
    }

    static HandshakeInfo toHandshake(HttpServerRequest req) {
        HandshakeInfo.HandshakeInfoBuilder builder = HandshakeInfo.builder()
            .namespace(NamespaceRegistry.normalize(req.param("namespace")));

        new QueryStringDecoder(req.uri()).parameters().forEach((name, values) -> {
            if (!values.isEmpty()) {
                builder.queryParam(name, values.get(0));
            }
        });
        req.requestHeaders().forEach(header -> builder.header(header.getKey().toLowerCase(Locale.ROOT), header.getValue()));

        InetSocketAddress remote = req.remoteAddress();
        if (remote != null) {
            builder.remoteAddress(remote.toString());
        }
        return builder.build();
    }
}
