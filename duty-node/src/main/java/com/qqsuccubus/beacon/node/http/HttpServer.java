package com.qqsuccubus.beacon.node.http;

import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import com.qqsuccubus.beacon.node.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.beacon.node.session.ServiceContext;
import com.qqsuccubus.beacon.node.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, duty queries and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final DutyNodeConfig config;
    private final DutyApiHandler apiHandler;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final ServiceContext serviceContext;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Binds and starts the server, blocking until it listens.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness fails once shutdown starts
                .get("/readyz", (req, res) -> {
                    if (serviceContext.isShuttingDown()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                // Metrics endpoint with Prometheus scraping
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/v1/assignments", apiHandler::assignments)
                .get("/v1/committees", apiHandler::committees)
                .get("/v1/validator-queue", apiHandler::validatorQueue)
                .get("/v1/validators/status", apiHandler::validatorStatus)
                .get("/ws/duties", upgradeHandler::handleDuties)
                .get("/ws/validators", upgradeHandler::handleValidators)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server listening on port {}", bound.port()))
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
