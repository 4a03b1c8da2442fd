package com.qqsuccubus.beacon.node.http;

import com.qqsuccubus.beacon.assignment.service.AssignmentFilter;
import com.qqsuccubus.beacon.assignment.service.IAssignmentService;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.EpochSelector;
import com.qqsuccubus.beacon.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Map;

/**
 * JSON request/response endpoints over {@link IAssignmentService}.
 * <p>
 * Failures are rendered as {@code {"code": <kind>, "message": ...}} with the HTTP status of the
 * error kind.
 * </p>
 */
public class DutyApiHandler {
    private static final Logger log = LoggerFactory.getLogger(DutyApiHandler.class);

    private final IAssignmentService assignmentService;

    public DutyApiHandler(IAssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    /**
     * {@code GET /v1/assignments?epoch=|genesis=true&index=..&pubkey=..}
     */
    public Mono<Void> assignments(HttpServerRequest req, HttpServerResponse res) {
        return respond(res, Mono.defer(() -> {
            QueryParams params = QueryParams.of(req.uri());
            AssignmentFilter.AssignmentFilterBuilder filter = AssignmentFilter.builder();
            for (String index : params.all("index")) {
                filter.index(QueryParams.parseLong("index", index));
            }
            for (String pubkey : params.all("pubkey")) {
                filter.publicKey(parsePublicKey(pubkey));
            }
            return assignmentService.listAssignments(selector(params), filter.build());
        }));
    }

    /**
     * {@code GET /v1/committees?epoch=|genesis=true}
     */
    public Mono<Void> committees(HttpServerRequest req, HttpServerResponse res) {
        return respond(res, Mono.defer(() ->
                assignmentService.listCommittees(selector(QueryParams.of(req.uri())))));
    }

    public Mono<Void> validatorQueue(HttpServerRequest req, HttpServerResponse res) {
        return respond(res, assignmentService.getValidatorQueue());
    }

    /**
     * {@code GET /v1/validators/status?pubkey=}
     */
    public Mono<Void> validatorStatus(HttpServerRequest req, HttpServerResponse res) {
        return respond(res, Mono.defer(() -> {
            String pubkey = QueryParams.of(req.uri()).first("pubkey")
                    .orElseThrow(() -> DutyException.invalidRequest("Must specify a public key"));
            return assignmentService.validatorStatus(parsePublicKey(pubkey));
        }));
    }

    /**
     * {@code genesis=true} wins over {@code epoch}; neither means the current epoch.
     */
    static EpochSelector selector(QueryParams params) {
        if (params.flag("genesis")) {
            return EpochSelector.genesis();
        }
        return params.optionalLong("epoch")
                .map(EpochSelector::at)
                .orElseGet(EpochSelector::current);
    }

    private static BlsPublicKey parsePublicKey(String hex) {
        try {
            return BlsPublicKey.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw DutyException.invalidRequest("Invalid public key " + hex + ": " + e.getMessage());
        }
    }

    private Mono<Void> respond(HttpServerResponse res, Mono<?> body) {
        return body
                .map(JsonUtils::toJson)
                .flatMap(json -> res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(json))
                        .then())
                .onErrorResume(err -> {
                    DutyException failure = err instanceof DutyException duty
                            ? duty
                            : new DutyException(DutyException.ErrorKind.COMPUTATION_FAILURE, err.getMessage(), null, false, err);
                    if (failure.getKind().getHttpStatus() >= 500) {
                        log.error("Request failed: {}", failure.getMessage(), err);
                    } else {
                        log.debug("Request rejected: {}", failure.getMessage());
                    }
                    String json = JsonUtils.toJson(Map.of(
                            "code", failure.getKind().name(),
                            "message", String.valueOf(failure.getMessage())));
                    return res.status(failure.getKind().getHttpStatus())
                            .header("Content-Type", "application/json")
                            .sendString(Mono.just(json))
                            .then();
                });
    }
}
