package com.qqsuccubus.beacon.node.ws;

import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.ValidatorChangeSet;
import com.qqsuccubus.beacon.core.util.JsonUtils;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import com.qqsuccubus.beacon.node.metrics.MetricsService;
import com.qqsuccubus.beacon.node.session.IStreamSessionManager;
import com.qqsuccubus.beacon.node.session.StreamSession;
import com.qqsuccubus.beacon.node.session.StreamType;
import com.qqsuccubus.beacon.node.stream.DutyStreamCoordinator;
import com.qqsuccubus.beacon.node.stream.ValidatorInfoStream;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.nio.charset.StandardCharsets;

/**
 * WebSocket handler for duty and validator info streams.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>/ws/duties: one DutySnapshot JSON frame per delivered epoch</li>
 *   <li>/ws/validators: one ValidatorInfo JSON frame per reported key</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (client → server, /ws/validators only):
 * <ul>
 *   <li>ValidatorChangeSet: {action: ADD|REMOVE|SET, publicKeys: [hex, ...]}</li>
 * </ul>
 * </p>
 * Streams end with a close frame whose status code follows the error kind.
 */
public class DutyWebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(DutyWebSocketHandler.class);

	// RFC 6455 limits the close reason to 123 bytes
	private static final int MAX_CLOSE_REASON_BYTES = 123;

	private final DutyNodeConfig config;
	private final DutyStreamCoordinator coordinator;
	private final ValidatorInfoStream validatorInfoStream;
	private final IStreamSessionManager sessionManager;
	private final MetricsService metricsService;

	public DutyWebSocketHandler(
			DutyNodeConfig config,
			DutyStreamCoordinator coordinator,
			ValidatorInfoStream validatorInfoStream,
			IStreamSessionManager sessionManager,
			MetricsService metricsService
	) {
		this.config = config;
		this.coordinator = coordinator;
		this.validatorInfoStream = validatorInfoStream;
		this.sessionManager = sessionManager;
		this.metricsService = metricsService;
	}

	/**
	 * Streams duty snapshots until the stream terminates.
	 *
	 * @param inbound    WebSocket inbound
	 * @param outbound   WebSocket outbound
	 * @param sessionId  Session identifier (extracted from query params)
	 * @param startEpoch First epoch to deliver, null for the finalized checkpoint
	 * @return Publisher for the connection
	 */
	public Publisher<Void> handleDuties(WebsocketInbound inbound, WebsocketOutbound outbound,
										String sessionId, Long startEpoch) {
		MDC.put("sessionId", sessionId);
		log.debug("Duty stream handshake for session {} (startEpoch={})", sessionId, startEpoch);
		StreamSession session = sessionManager.open(sessionId, StreamType.DUTIES);

		Flux<String> frames = coordinator.streamDuties(startEpoch, connectionClosed(inbound))
				.map(JsonUtils::toJson);

		return send(FrameSink.of(outbound), frames, session);
	}

	/**
	 * Streams validator info for the keys the client manages over the same socket.
	 */
	public Publisher<Void> handleValidators(WebsocketInbound inbound, WebsocketOutbound outbound, String sessionId) {
		MDC.put("sessionId", sessionId);
		log.debug("Validator info stream handshake for session {}", sessionId);
		StreamSession session = sessionManager.open(sessionId, StreamType.VALIDATORS);

		Flux<String> frames = validatorInfoStream
				.streamValidatorInfo(receiveChangeSets(inbound, sessionId), connectionClosed(inbound))
				.map(JsonUtils::toJson);

		return send(FrameSink.of(outbound), frames, session);
	}

	/**
	 * Writes frames until the stream ends; any failure, from the stream or from the transport, ends
	 * the connection with a close frame for its error kind.
	 */
	Mono<Void> send(FrameSink sink, Flux<String> frames, StreamSession session) {
		Flux<String> buffered = frames
				.onBackpressureBuffer(config.getPerConnBufferSize())
				.doOnNext(frame -> metricsService.recordNetworkOutboundWs(frame.getBytes(StandardCharsets.UTF_8).length));

		return sink.sendFrames(buffered)
				.onErrorResume(err -> close(sink, err, session.getSessionId()))
				.doFinally(signal -> sessionManager.close(session));
	}

	private Mono<Void> close(FrameSink sink, Throwable err, String sessionId) {
		DutyException failure = failureOf(err);

		switch (failure.getKind()) {
			case CANCELED -> log.debug("Stream {} canceled: {}", sessionId, failure.getMessage());
			case INVALID_REQUEST, NOT_FOUND -> log.warn("Rejected stream {}: {}", sessionId, failure.getMessage());
			default -> {
				if (err instanceof AbortedException) {
					log.debug("Stream {} aborted by peer", sessionId);
				} else {
					log.error("Stream {} failed: {}", sessionId, failure.getMessage(), err);
				}
			}
		}

		return sink.sendClose(failure.getKind().getCloseCode(), closeReason(failure.getMessage()))
				.onErrorResume(closeErr -> {
					log.debug("Could not send close frame to {}: {}", sessionId, closeErr.toString());
					return Mono.empty();
				});
	}

	private Flux<ValidatorChangeSet> receiveChangeSets(WebsocketInbound inbound, String sessionId) {
		return inbound.aggregateFrames()
				.receive()
				.asString()
				.onBackpressureBuffer(config.getPerConnBufferSize())
				.concatMap(json -> parseChangeSet(json, sessionId))
				.onErrorResume(err -> {
					// Peer went away; the stream sees the completion as a canceled context
					if (!(err instanceof AbortedException)) {
						log.warn("Inbound stream for {} failed: {}", sessionId, err.toString());
					}
					return Mono.empty();
				});
	}

	private Mono<ValidatorChangeSet> parseChangeSet(String json, String sessionId) {
		metricsService.recordNetworkInboundWs(json.getBytes(StandardCharsets.UTF_8).length);
		try {
			return Mono.just(JsonUtils.fromJson(json, ValidatorChangeSet.class));
		} catch (DutyException e) {
			log.warn("Dropping malformed change set from {}: message='{}', error={}", sessionId, json, e.getMessage());
			return Mono.empty();
		}
	}

	private static Mono<Void> connectionClosed(WebsocketInbound inbound) {
		return Mono.create(sink -> inbound.withConnection(connection -> connection.onDispose(sink::success)));
	}

	/**
	 * Stream failures keep their kind; anything else happened on the transport and is UNAVAILABLE.
	 */
	static DutyException failureOf(Throwable err) {
		return err instanceof DutyException duty
				? duty
				: DutyException.unavailable("Failed to send on stream", err);
	}

	static String closeReason(String message) {
		if (message == null) {
			return "";
		}
		byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
		if (bytes.length <= MAX_CLOSE_REASON_BYTES) {
			return message;
		}
		String truncated = new String(bytes, 0, MAX_CLOSE_REASON_BYTES, StandardCharsets.UTF_8);
		// a cut multi-byte sequence decodes to U+FFFD
		while (truncated.getBytes(StandardCharsets.UTF_8).length > MAX_CLOSE_REASON_BYTES) {
			truncated = truncated.substring(0, truncated.length() - 1);
		}
		return truncated;
	}
}
