package com.qqsuccubus.beacon.node.metrics;

import com.qqsuccubus.beacon.core.metrics.MetricsTags;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the node's meters in the Prometheus text format.
 * <p>
 * The scrape registry joins a composite parent ({@link Metrics#globalRegistry} in the node, which also
 * receives reactor-netty's server meters), so one scrape covers duty, stream and transport metrics.
 * Every meter carries the node id and chain preset as common tags.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final CompositeMeterRegistry parent;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(DutyNodeConfig config) {
        this(Metrics.globalRegistry, config);
    }

    PrometheusMetricsExporter(CompositeMeterRegistry parent, DutyNodeConfig config) {
        this.parent = parent;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        parent.config().commonTags(
            MetricsTags.NODE_ID, config.getNodeId(),
            MetricsTags.CHAIN, config.getChainPreset()
        );
        parent.add(prometheusRegistry);
        log.info("Prometheus exporter attached (node_id={}, chain={})", config.getNodeId(), config.getChainPreset());
    }

    /**
     * Registry every node component records into.
     */
    public MeterRegistry getRegistry() {
        return parent;
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    /**
     * Detaches the scrape registry; meters recorded afterwards are no longer exported.
     */
    public void close() {
        parent.remove(prometheusRegistry);
        prometheusRegistry.close();
        log.info("Prometheus exporter detached");
    }
}
