package com.qqsuccubus.beacon.node.session;

import java.util.Collection;

/**
 * Interface for stream session tracking (Dependency Inversion Principle).
 */
public interface IStreamSessionManager {

    /**
     * Registers a stream.
     *
     * @param sessionId Client-supplied or generated session identifier
     * @param type      Stream kind
     * @return the registered session, to be passed back to {@link #close(StreamSession)}
     */
    StreamSession open(String sessionId, StreamType type);

    /**
     * Unregisters one stream. Other streams sharing its session id stay open; closing twice is a no-op.
     */
    void close(StreamSession session);

    int activeCount();

    Collection<StreamSession> activeSessions();
}
