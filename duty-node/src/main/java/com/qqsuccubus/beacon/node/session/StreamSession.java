package com.qqsuccubus.beacon.node.session;

import lombok.Value;

import java.time.Instant;

/**
 * One open WebSocket stream.
 * <p>
 * {@code sessionId} is chosen by the client and may repeat across connections; {@code connectionId}
 * is assigned by the node and is unique per open.
 * </p>
 */
@Value
public class StreamSession {
    long connectionId;
    String sessionId;
    StreamType type;
    Instant openedAt;
}
