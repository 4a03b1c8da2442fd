package com.qqsuccubus.beacon.node.stream;

import com.qqsuccubus.beacon.assignment.snapshot.IDutySnapshotAssembler;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.DutySnapshot;
import com.qqsuccubus.beacon.core.model.ReorgInfo;
import com.qqsuccubus.beacon.core.msg.ChainEvents;
import com.qqsuccubus.beacon.core.state.IChainEventFeed;
import com.qqsuccubus.beacon.core.state.IStateProvider;
import com.qqsuccubus.beacon.core.time.Epochs;
import com.qqsuccubus.beacon.core.time.SlotClock;
import com.qqsuccubus.beacon.node.metrics.MetricsService;
import com.qqsuccubus.beacon.node.session.ServiceContext;
import com.qqsuccubus.beacon.node.session.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.LongStream;

/**
 * Per-connection duty streams: backfill from a start epoch, then follow the chain.
 * <p>
 * Each stream owns a cursor holding the next epoch the client is owed. Delivery rules:
 * <ul>
 *   <li>Backfill pushes every epoch from the start through the finalized checkpoint.</li>
 *   <li>An epoch boundary at slot {@code s} pushes every epoch from the cursor through
 *       {@code toEpoch(s) + 1}; boundaries behind the cursor are ignored.</li>
 *   <li>A reorg at epoch {@code r} drops cached committees from {@code r}, fills any gap below
 *       {@code r}, then pushes a snapshot of {@code r} tagged with the reorg. A reorg behind the
 *       cursor re-delivers {@code r} and leaves the cursor where it is.</li>
 * </ul>
 * Events are handled one at a time in arrival order, so snapshots of one stream never interleave.
 * </p>
 * <p>
 * Per-epoch failures that {@link DutyException#isSkippable() can be skipped} are logged and counted;
 * anything else closes the stream as {@code CANCELED}.
 * </p>
 */
public class DutyStreamCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DutyStreamCoordinator.class);

    private final ChainConfig config;
    private final SlotClock clock;
    private final IStateProvider stateProvider;
    private final IChainEventFeed eventFeed;
    private final IDutySnapshotAssembler assembler;
    private final ServiceContext serviceContext;
    private final MetricsService metricsService;

    public DutyStreamCoordinator(ChainConfig config,
                                 SlotClock clock,
                                 IStateProvider stateProvider,
                                 IChainEventFeed eventFeed,
                                 IDutySnapshotAssembler assembler,
                                 ServiceContext serviceContext,
                                 MetricsService metricsService) {
        this.config = config;
        this.clock = clock;
        this.stateProvider = stateProvider;
        this.eventFeed = eventFeed;
        this.assembler = assembler;
        this.serviceContext = serviceContext;
        this.metricsService = metricsService;
    }

    /**
     * Streams duty snapshots for one connection.
     *
     * @param startEpoch       First epoch to deliver, or null for the finalized checkpoint
     * @param connectionClosed Completes when the client connection goes away
     * @return snapshots in delivery order; errors with a {@link DutyException} on termination
     */
    public Flux<DutySnapshot> streamDuties(Long startEpoch, Mono<Void> connectionClosed) {
        return Flux.defer(() -> open(startEpoch).snapshots(connectionClosed));
    }

    /**
     * Validates the start epoch and creates the stream without subscribing to anything.
     *
     * @throws DutyException {@code INVALID_REQUEST} when the start epoch is in the future
     */
    public DutyStream open(Long startEpoch) {
        long currentEpoch = clock.currentEpoch();
        long start = startEpoch != null ? startEpoch : stateProvider.finalizedCheckpointEpoch();
        if (start > currentEpoch) {
            throw DutyException.invalidRequest(String.format(
                    "Cannot stream duties from an epoch in the future, current epoch %d, requesting %d",
                    currentEpoch, start));
        }
        return new DutyStream(start);
    }

    /**
     * State of one connection's stream.
     */
    public final class DutyStream {
        private final AtomicLong cursor;
        private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.BACKFILLING);
        private final AtomicReference<String> closeReason = new AtomicReference<>("complete");

        private DutyStream(long start) {
            this.cursor = new AtomicLong(start);
        }

        public StreamState getState() {
            return state.get();
        }

        /**
         * Next epoch the client is owed.
         */
        public long getCursor() {
            return cursor.get();
        }

        public Flux<DutySnapshot> snapshots(Mono<Void> connectionClosed) {
            Flux<DutySnapshot> body = backfill()
                    .doOnComplete(() -> {
                        state.compareAndSet(StreamState.BACKFILLING, StreamState.LIVE_TAILING);
                        log.debug("Backfill done, tailing from epoch {}", cursor.get());
                    })
                    .concatWith(live());

            return Flux.merge(
                            body,
                            connectionClosed.then(Mono.<DutySnapshot>error(
                                    () -> DutyException.canceled("Stream context canceled"))),
                            serviceContext.onShutdown().then(Mono.<DutySnapshot>error(
                                    () -> DutyException.canceled("Service context canceled"))))
                    .doOnError(err -> closeReason.set(reasonOf(err)))
                    .doFinally(signal -> {
                        state.set(StreamState.CLOSED);
                        String reason = signal == SignalType.CANCEL ? "cancel" : closeReason.get();
                        metricsService.recordStreamClosed(StreamType.DUTIES, reason);
                        log.debug("Duty stream closed at cursor {} ({})", cursor.get(), reason);
                    });
        }

        private Flux<DutySnapshot> backfill() {
            return Flux.defer(() -> {
                long finalized = stateProvider.finalizedCheckpointEpoch();
                long from = cursor.get();
                if (finalized < from) {
                    return Flux.empty();
                }
                cursor.set(finalized + 1);
                log.debug("Backfilling epochs {}..{}", from, finalized);
                return deliverRange(from, finalized, MetricsService.SNAPSHOT_BACKFILL);
            });
        }

        private Flux<DutySnapshot> live() {
            Flux<Object> boundaries = eventFeed.epochBoundaries()
                    .cast(Object.class)
                    .concatWith(Mono.error(() -> DutyException.aborted("Subscriber closed")));
            Flux<Object> reorgs = eventFeed.reorgs()
                    .cast(Object.class)
                    .concatWith(Mono.error(() -> DutyException.aborted("Subscriber closed")));

            return Flux.merge(boundaries, reorgs)
                    .concatMap(event -> {
                        if (event instanceof ChainEvents.Reorg reorg) {
                            return onReorg(reorg);
                        }
                        return onEpochBoundary((ChainEvents.EpochBoundary) event);
                    });
        }

        private Flux<DutySnapshot> onEpochBoundary(ChainEvents.EpochBoundary boundary) {
            long target = Epochs.toEpoch(boundary.getSlot(), config) + 1;
            long from = cursor.get();
            if (target < from) {
                log.debug("Epoch boundary at slot {} already delivered (cursor {})", boundary.getSlot(), from);
                return Flux.empty();
            }
            cursor.set(target + 1);
            return deliverRange(from, target, MetricsService.SNAPSHOT_LIVE);
        }

        private Flux<DutySnapshot> onReorg(ChainEvents.Reorg reorg) {
            assembler.onReorg(reorg);
            long epoch = reorg.getEpoch();
            long from = cursor.get();
            log.info("Reorg at epoch {} (slot {}, depth {}), cursor {}", epoch, reorg.getSlot(), reorg.getDepth(), from);

            Flux<DutySnapshot> gap = Flux.empty();
            if (epoch >= from) {
                gap = deliverRange(from, epoch - 1, MetricsService.SNAPSHOT_LIVE);
                cursor.set(epoch + 1);
            }
            return gap.concatWith(deliver(epoch, reorg.toInfo(), MetricsService.SNAPSHOT_REORG));
        }

        private Flux<DutySnapshot> deliverRange(long fromInclusive, long toInclusive, String type) {
            if (toInclusive < fromInclusive) {
                return Flux.empty();
            }
            return Flux.fromStream(() -> LongStream.rangeClosed(fromInclusive, toInclusive).boxed())
                    .concatMap(epoch -> deliver(epoch, null, type));
        }

        private Mono<DutySnapshot> deliver(long epoch, ReorgInfo reorgInfo, String type) {
            return Mono.fromCallable(() -> {
                        long started = System.nanoTime();
                        DutySnapshot snapshot = assembler.assemble(epoch, reorgInfo);
                        metricsService.recordSnapshotLatency(started);
                        return snapshot;
                    })
                    .doOnNext(snapshot -> {
                        metricsService.recordSnapshotDelivered(type);
                        log.debug("Pushing {} snapshot for epoch {}", type, epoch);
                    })
                    .onErrorResume(err -> {
                        if (err instanceof DutyException duty && duty.isSkippable()) {
                            log.warn("Skipping epoch {} on duty stream: {}", epoch, duty.getMessage());
                            metricsService.recordEpochSkipped(duty.getKind());
                            return Mono.empty();
                        }
                        log.error("Duty computation for epoch {} failed, closing stream", epoch, err);
                        return Mono.error(DutyException.canceled("Could not compute duties for epoch " + epoch, err));
                    });
        }
    }

    static String reasonOf(Throwable err) {
        if (err instanceof DutyException duty) {
            return duty.getKind().name().toLowerCase();
        }
        return "error";
    }
}
