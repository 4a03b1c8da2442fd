package com.qqsuccubus.beacon.node.session;

import com.qqsuccubus.beacon.node.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks open streams for the active-stream gauge and for logging on shutdown.
 */
public class StreamSessionManager implements IStreamSessionManager {
	private static final Logger log = LoggerFactory.getLogger(StreamSessionManager.class);

	private final Clock clock;
	private final AtomicLong connectionIds = new AtomicLong();

	// Open streams: connectionId -> StreamSession
	private final Map<Long, StreamSession> activeSessions = new ConcurrentHashMap<>();

	public StreamSessionManager(MetricsService metricsService, Clock clock) {
		this.clock = clock;
		metricsService.registerActiveStreams(this::activeCount);
	}

	public StreamSessionManager(MetricsService metricsService) {
		this(metricsService, Clock.systemUTC());
	}

	@Override
	public StreamSession open(String sessionId, StreamType type) {
		StreamSession session = new StreamSession(connectionIds.incrementAndGet(), sessionId, type, clock.instant());
		boolean shared = activeSessions.values().stream().anyMatch(open -> open.getSessionId().equals(sessionId));
		if (shared) {
			log.warn("Session id {} is already in use by another open stream", sessionId);
		}
		activeSessions.put(session.getConnectionId(), session);
		log.debug("Opened {} stream {} (connection {})", type, sessionId, session.getConnectionId());
		return session;
	}

	@Override
	public void close(StreamSession session) {
		if (activeSessions.remove(session.getConnectionId(), session)) {
			log.debug("Closed {} stream {} (connection {})", session.getType(), session.getSessionId(), session.getConnectionId());
		}
	}

	@Override
	public int activeCount() {
		return activeSessions.size();
	}

	@Override
	public Collection<StreamSession> activeSessions() {
		return List.copyOf(activeSessions.values());
	}
}
