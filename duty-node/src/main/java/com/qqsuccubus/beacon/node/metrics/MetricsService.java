package com.qqsuccubus.beacon.node.metrics;

import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.metrics.MetricsNames;
import com.qqsuccubus.beacon.core.metrics.MetricsTags;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import com.qqsuccubus.beacon.node.session.StreamType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for the duty node.
 */
public class MetricsService {

    public static final String SNAPSHOT_BACKFILL = "backfill";
    public static final String SNAPSHOT_LIVE = "live";
    public static final String SNAPSHOT_REORG = "reorg";

    private final MeterRegistry registry;
    private final String nodeId;

    // Snapshots per delivery type
    private final Counter backfillSnapshots;
    private final Counter liveSnapshots;
    private final Counter reorgSnapshots;

    private final Counter validatorInfo;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeOutbound;

    private final Timer snapshotLatency;

    public MetricsService(MeterRegistry registry, DutyNodeConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        backfillSnapshots = snapshotCounter(SNAPSHOT_BACKFILL, "Snapshots replayed from the start epoch to finality");
        liveSnapshots = snapshotCounter(SNAPSHOT_LIVE, "Snapshots pushed on epoch boundaries");
        reorgSnapshots = snapshotCounter(SNAPSHOT_REORG, "Snapshots recomputed after a reorg");

        validatorInfo = Counter.builder(MetricsNames.VALIDATOR_INFO_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Validator info records pushed to subscribers")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeOutbound = DistributionSummary.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Outbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        // Percentile histogram for p95/p99 of per-epoch computation
        snapshotLatency = Timer.builder(MetricsNames.SNAPSHOT_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Time to assemble one duty snapshot")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);
    }

    private Counter snapshotCounter(String type, String description) {
        return Counter.builder(MetricsNames.SNAPSHOTS_DELIVERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, type)
            .description(description)
            .register(registry);
    }

    public void recordSnapshotDelivered(String type) {
        switch (type) {
            case SNAPSHOT_BACKFILL -> backfillSnapshots.increment();
            case SNAPSHOT_REORG -> reorgSnapshots.increment();
            default -> liveSnapshots.increment();
        }
    }

    /**
     * @param startNanos {@link System#nanoTime()} before the computation
     */
    public void recordSnapshotLatency(long startNanos) {
        snapshotLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordEpochSkipped(DutyException.ErrorKind kind) {
        Counter.builder(MetricsNames.EPOCHS_SKIPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, kind.name().toLowerCase())
            .description("Epochs skipped on a stream because their computation failed")
            .register(registry)
            .increment();
    }

    /**
     * @param type   Stream kind
     * @param reason Error kind name, or "complete"/"cancel" for signal-driven endings
     */
    public void recordStreamClosed(StreamType type, String reason) {
        Counter.builder(MetricsNames.STREAMS_CLOSED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, type.tag())
            .tag(MetricsTags.REASON, reason)
            .description("Streams ended, by reason")
            .register(registry)
            .increment();
    }

    public void recordValidatorInfo(int count) {
        validatorInfo.increment(count);
    }

    public void registerActiveStreams(Supplier<Number> activeCount) {
        Gauge.builder(MetricsNames.STREAMS_ACTIVE, activeCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Streams currently open")
            .register(registry);
    }

    /**
     * Records bytes received from a WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    /**
     * Records bytes sent to a WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
        messageSizeOutbound.record(bytes);
    }
}
