package com.qqsuccubus.beacon.node.stream;

/**
 * Phases of one duty stream. Transitions only move forward.
 */
public enum StreamState {
    /**
     * Replaying finalized epochs from the requested start.
     */
    BACKFILLING,
    /**
     * Following epoch boundaries and reorgs.
     */
    LIVE_TAILING,
    CLOSED
}
