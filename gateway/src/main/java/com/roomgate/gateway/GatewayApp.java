package com.roomgate.gateway;

import com.roomgate.gateway.auth.AuthMiddleware;
import com.roomgate.gateway.auth.HeaderIdentityVerifier;
import com.roomgate.gateway.config.GatewayConfig;
import com.roomgate.gateway.http.HttpServer;
import com.roomgate.gateway.metrics.MetricsService;
import com.roomgate.gateway.metrics.PrometheusMetricsExporter;
import com.roomgate.gateway.server.GatewayServer;
import com.roomgate.gateway.session.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;

/**
 * Main entry point for a gateway process.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws and /ws/{namespace}</li>
 *   <li>Fan room broadcasts out through the configured broker</li>
 *   <li>Keep cluster-wide room membership in the configured state store</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting gateway: {}", config.getNodeId());
        log.info("  Broker: {}", config.getBrokerType());
        log.info("  State: {}", config.getStateType());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config.getNodeId());

        GatewayServer gateway = GatewayServer.fromConfig(config, metricsService);
        configureDefaultNamespace(config, gateway.of("/"));

        // Adapter connection failure aborts startup
        gateway.start().block(Duration.ofSeconds(30));

        HttpServer httpServer = new HttpServer(config, gateway, metricsExporter);
        httpServer.start();

        log.info("Gateway {} is ready", config.getNodeId());

        handleShutdown(config, gateway, httpServer);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    static void configureDefaultNamespace(GatewayConfig config, Namespace namespace) {
        if (config.getTrustedIdentityHeader() != null) {
            namespace.use(new AuthMiddleware(new HeaderIdentityVerifier(config.getTrustedIdentityHeader())));
            log.info("  Identity header: {}", config.getTrustedIdentityHeader());
        }
        namespace.on("ping", (connection, envelope) ->
            connection.emit("pong", Map.of("ts", System.currentTimeMillis())));
    }

    private static void handleShutdown(GatewayConfig config, GatewayServer gateway, HttpServer httpServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            httpServer.stop();
            gateway.stop().block(Duration.ofSeconds(30));

            log.info("Shutdown complete");
        }));
    }
}
