package com.qqsuccubus.beacon.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code beacon.duties.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Committee cache lookups.
     * <p>
     * Tags: result (hit/miss)
     * </p>
     */
    public static final String COMMITTEE_CACHE_TOTAL = "beacon.duties.committee.cache.total";

    /**
     * Counter: Committee cache entries dropped after a reorg.
     */
    public static final String COMMITTEE_CACHE_INVALIDATIONS_TOTAL = "beacon.duties.committee.cache.invalidations.total";

    /**
     * Timer: Time to assemble one duty snapshot.
     */
    public static final String SNAPSHOT_LATENCY = "beacon.duties.snapshot.latency";

    /**
     * Counter: Duty snapshots pushed to subscribers.
     * <p>
     * Tags: nodeId, type (backfill/live/reorg)
     * </p>
     */
    public static final String SNAPSHOTS_DELIVERED_TOTAL = "beacon.duties.stream.snapshots.total";

    /**
     * Counter: Epochs skipped on a stream because their computation failed.
     * <p>
     * Tags: nodeId, reason (error kind)
     * </p>
     */
    public static final String EPOCHS_SKIPPED_TOTAL = "beacon.duties.stream.skipped.total";

    /**
     * Counter: Streams ended.
     * <p>
     * Tags: nodeId, type (duties/validators), reason (error kind)
     * </p>
     */
    public static final String STREAMS_CLOSED_TOTAL = "beacon.duties.stream.closed.total";

    /**
     * Gauge: Streams currently open.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String STREAMS_ACTIVE = "beacon.duties.stream.active";

    /**
     * Counter: Validator info records pushed.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String VALIDATOR_INFO_TOTAL = "beacon.duties.validators.info.total";

    /**
     * Counter: Bytes sent to WebSocket clients.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "beacon.duties.network.outbound.ws.bytes";

    /**
     * Counter: Bytes received from WebSocket clients.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "beacon.duties.network.inbound.ws.bytes";
}
