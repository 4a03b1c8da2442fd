package com.qqsuccubus.beacon.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the chain preset a node serves.
     */
    public static final String CHAIN = "chain";

    /**
     * Tag key for snapshot or stream type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for failure/termination reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for cache lookup result.
     */
    public static final String RESULT = "result";
}
