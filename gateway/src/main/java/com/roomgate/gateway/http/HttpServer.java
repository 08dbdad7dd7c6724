package com.roomgate.gateway.http;

import com.roomgate.gateway.config.GatewayConfig;
import com.roomgate.gateway.metrics.PrometheusMetricsExporter;
import com.roomgate.gateway.server.GatewayServer;
import com.roomgate.gateway.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final GatewayConfig config;
    private final GatewayServer gateway;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Binds the HTTP server.
     *
     * @return bound server
     */
    public DisposableServer start() {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(config, gateway);

        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness: only once adapters are connected
                .get("/readyz", (req, res) -> {
                    if (!gateway.isRunning()) {
                        return res.status(503).sendString(Mono.just("Not Ready"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/ws", upgradeHandler::handle)
                .get("/ws/{namespace}", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
