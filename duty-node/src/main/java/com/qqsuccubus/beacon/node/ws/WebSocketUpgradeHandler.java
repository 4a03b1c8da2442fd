package com.qqsuccubus.beacon.node.ws;

import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.node.http.QueryParams;
import com.qqsuccubus.beacon.node.session.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.UUID;

/**
 * Handles WebSocket upgrades with query parameter extraction.
 * <p>
 * Parameters are read from the HTTP request before the upgrade so malformed requests are refused
 * with a plain HTTP status instead of an opened-then-closed socket.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final DutyWebSocketHandler wsHandler;
    private final ServiceContext serviceContext;

    public WebSocketUpgradeHandler(DutyWebSocketHandler wsHandler, ServiceContext serviceContext) {
        this.wsHandler = wsHandler;
        this.serviceContext = serviceContext;
    }

    /**
     * Upgrades {@code /ws/duties?startEpoch=&sessionId=}.
     */
    public Mono<Void> handleDuties(HttpServerRequest req, HttpServerResponse res) {
        if (serviceContext.isShuttingDown()) {
            return rejectShuttingDown(res);
        }
        QueryParams params = QueryParams.of(req.uri());
        String sessionId = params.first("sessionId").orElseGet(() -> UUID.randomUUID().toString());

        Long startEpoch;
        try {
            startEpoch = params.optionalLong("startEpoch").orElse(null);
        } catch (DutyException e) {
            log.warn("Rejecting duty stream {}: {}", sessionId, e.getMessage());
            return res.status(e.getKind().getHttpStatus()).sendString(Mono.just(e.getMessage())).then();
        }

        return res.sendWebsocket((inbound, outbound) ->
            wsHandler.handleDuties(inbound, outbound, sessionId, startEpoch)
        );
    }

    /**
     * Upgrades {@code /ws/validators?sessionId=}.
     */
    public Mono<Void> handleValidators(HttpServerRequest req, HttpServerResponse res) {
        if (serviceContext.isShuttingDown()) {
            return rejectShuttingDown(res);
        }
        String sessionId = QueryParams.of(req.uri()).first("sessionId")
            .orElseGet(() -> UUID.randomUUID().toString());

        return res.sendWebsocket((inbound, outbound) ->
            wsHandler.handleValidators(inbound, outbound, sessionId)
        );
    }

    private Mono<Void> rejectShuttingDown(HttpServerResponse res) {
        log.warn("Rejecting new WebSocket connection - node is shutting down");
        return res.status(503)
            .sendString(Mono.just("Service unavailable - node is shutting down"))
            .then();
    }
}
