package com.qqsuccubus.beacon.node.stream;

import com.qqsuccubus.beacon.assignment.snapshot.IDutySnapshotAssembler;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.metrics.MetricsNames;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.Domain;
import com.qqsuccubus.beacon.core.model.DutySnapshot;
import com.qqsuccubus.beacon.core.model.ReorgInfo;
import com.qqsuccubus.beacon.core.msg.ChainEvents;
import com.qqsuccubus.beacon.core.state.IChainEventFeed;
import com.qqsuccubus.beacon.core.state.IStateProvider;
import com.qqsuccubus.beacon.core.time.SlotClock;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import com.qqsuccubus.beacon.node.metrics.MetricsService;
import com.qqsuccubus.beacon.node.session.ServiceContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DutyStreamCoordinator} using hand-written stubs (without Mockito).
 * <p>
 * The chain is in epoch 7 (minimal preset, 8 slots per epoch) with the finalized checkpoint at 5.
 * </p>
 */
class DutyStreamCoordinatorTest {

    private static final long GENESIS = 1_700_000_000L;
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private StubStateProvider stateProvider;
    private StubEventFeed eventFeed;
    private RecordingAssembler assembler;
    private ServiceContext serviceContext;
    private SimpleMeterRegistry registry;
    private DutyStreamCoordinator coordinator;
    private Sinks.Empty<Void> connectionClosed;

    @BeforeEach
    void setUp() {
        ChainConfig config = ChainConfig.minimal();
        SlotClock clock = new SlotClock(GENESIS, config,
                Clock.fixed(Instant.ofEpochSecond(GENESIS + 7 * 8 * 6 + 6), ZoneOffset.UTC));
        stateProvider = new StubStateProvider(5);
        eventFeed = new StubEventFeed();
        assembler = new RecordingAssembler();
        serviceContext = new ServiceContext();
        registry = new SimpleMeterRegistry();
        MetricsService metricsService = new MetricsService(registry,
                DutyNodeConfig.builder().nodeId("test-node").build());
        coordinator = new DutyStreamCoordinator(config, clock, stateProvider, eventFeed, assembler,
                serviceContext, metricsService);
        connectionClosed = Sinks.empty();
    }

    // ========== Delivery Order Tests ==========

    @Test
    @DisplayName("Stream from before finality delivers every epoch exactly once")
    void testNoGapFromBeforeFinality() {
        StepVerifier.create(epochs(coordinator.streamDuties(2L, connectionClosed.asMono())))
                .expectNext(2L, 3L, 4L, 5L)
                .then(() -> eventFeed.publishEpochBoundary(48))
                .expectNext(6L, 7L)
                .then(() -> eventFeed.publishEpochBoundary(56))
                .expectNext(8L)
                .then(connectionClosed::tryEmitEmpty)
                .expectErrorMatches(err -> isKind(err, DutyException.ErrorKind.CANCELED)
                        && err.getMessage().equals("Stream context canceled"))
                .verify(TIMEOUT);

        assertEquals(List.of(2L, 3L, 4L, 5L, 6L, 7L, 8L), assembler.assembled);
        assertEquals(4.0, registry.get(MetricsNames.SNAPSHOTS_DELIVERED_TOTAL).tag("type", "backfill").counter().count());
        assertEquals(3.0, registry.get(MetricsNames.SNAPSHOTS_DELIVERED_TOTAL).tag("type", "live").counter().count());
    }

    @Test
    @DisplayName("Unset start epoch begins at the finalized checkpoint and fills the seam gap")
    void testDefaultStartAndSeamGap() {
        StepVerifier.create(epochs(coordinator.streamDuties(null, connectionClosed.asMono())))
                .expectNext(5L)
                .then(() -> eventFeed.publishEpochBoundary(56))
                .expectNext(6L, 7L, 8L)
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void testDuplicateBoundaryIgnored() {
        StepVerifier.create(epochs(coordinator.streamDuties(5L, connectionClosed.asMono())))
                .expectNext(5L)
                .then(() -> eventFeed.publishEpochBoundary(48))
                .expectNext(6L, 7L)
                .then(() -> {
                    eventFeed.publishEpochBoundary(50);
                    eventFeed.publishEpochBoundary(56);
                })
                .expectNext(8L)
                .thenCancel()
                .verify(TIMEOUT);
    }

    @Test
    void testStartInFutureRejected() {
        StepVerifier.create(coordinator.streamDuties(8L, connectionClosed.asMono()))
                .expectErrorMatches(err -> isKind(err, DutyException.ErrorKind.INVALID_REQUEST))
                .verify(TIMEOUT);

        assertTrue(assembler.assembled.isEmpty());
    }

    @Test
    void testStateTransitions() {
        DutyStreamCoordinator.DutyStream stream = coordinator.open(3L);
        assertEquals(StreamState.BACKFILLING, stream.getState());

        StepVerifier.create(stream.snapshots(connectionClosed.asMono()))
                .expectNextCount(3)
                .then(() -> {
                    assertEquals(StreamState.LIVE_TAILING, stream.getState());
                    assertEquals(6L, stream.getCursor());
                })
                .thenCancel()
                .verify(TIMEOUT);

        assertEquals(StreamState.CLOSED, stream.getState());
    }

    // ========== Reorg Tests ==========

    @Test
    @DisplayName("Reorg ahead of the cursor fills the gap, then pushes the tagged snapshot")
    void testReorgAheadOfCursor() {
        StepVerifier.create(coordinator.streamDuties(5L, connectionClosed.asMono()))
                .assertNext(s -> assertEquals(5L, s.getEpoch()))
                .then(() -> eventFeed.publishReorg(reorg(7)))
                .assertNext(s -> {
                    assertEquals(6L, s.getEpoch());
                    assertFalse(s.isReorg());
                })
                .assertNext(s -> {
                    assertEquals(7L, s.getEpoch());
                    assertTrue(s.isReorg());
                    assertEquals(60L, s.getReorgInfo().getSlot());
                })
                .then(() -> eventFeed.publishEpochBoundary(56))
                .assertNext(s -> assertEquals(8L, s.getEpoch()))
                .thenCancel()
                .verify(TIMEOUT);

        assertEquals(List.of(7L), assembler.invalidatedFrom);
    }

    @Test
    @DisplayName("Reorg behind the cursor re-delivers the epoch without rewinding")
    void testReorgBehindCursor() {
        StepVerifier.create(coordinator.streamDuties(4L, connectionClosed.asMono()))
                .expectNextCount(2)
                .then(() -> eventFeed.publishReorg(reorg(4)))
                .assertNext(s -> {
                    assertEquals(4L, s.getEpoch());
                    assertTrue(s.isReorg());
                })
                .then(() -> eventFeed.publishEpochBoundary(48))
                .assertNext(s -> assertEquals(6L, s.getEpoch()))
                .assertNext(s -> assertEquals(7L, s.getEpoch()))
                .thenCancel()
                .verify(TIMEOUT);

        assertEquals(List.of(4L), assembler.invalidatedFrom);
    }

    // ========== Failure Tests ==========

    @Test
    void testSkippableFailuresSkipEpoch() {
        assembler.failures.put(3L, DutyException.computationFailure(24, "shuffle failed", null));
        assembler.failures.put(4L, DutyException.notFound("No state available at slot 32"));

        StepVerifier.create(epochs(coordinator.streamDuties(2L, connectionClosed.asMono())))
                .expectNext(2L, 5L)
                .then(() -> eventFeed.publishEpochBoundary(48))
                .expectNext(6L, 7L)
                .thenCancel()
                .verify(TIMEOUT);

        assertEquals(1.0, registry.get(MetricsNames.EPOCHS_SKIPPED_TOTAL)
                .tag("reason", "computation_failure").counter().count());
        assertEquals(1.0, registry.get(MetricsNames.EPOCHS_SKIPPED_TOTAL)
                .tag("reason", "not_found").counter().count());
    }

    @Test
    @DisplayName("Structural failure tears the stream down as canceled")
    void testStructuralFailureCancels() {
        DutyException structural = DutyException.structuralFailure("Expected 8 proposers, got 7");
        assembler.failures.put(4L, structural);

        StepVerifier.create(epochs(coordinator.streamDuties(2L, connectionClosed.asMono())))
                .expectNext(2L, 3L)
                .expectErrorMatches(err -> isKind(err, DutyException.ErrorKind.CANCELED)
                        && err.getCause() == structural)
                .verify(TIMEOUT);
    }

    // ========== Termination Tests ==========

    @Test
    void testServiceShutdownCancels() {
        StepVerifier.create(epochs(coordinator.streamDuties(5L, connectionClosed.asMono())))
                .expectNext(5L)
                .then(serviceContext::shutdown)
                .expectErrorMatches(err -> isKind(err, DutyException.ErrorKind.CANCELED)
                        && err.getMessage().equals("Service context canceled"))
                .verify(TIMEOUT);

        assertEquals(1.0, registry.get(MetricsNames.STREAMS_CLOSED_TOTAL)
                .tag("reason", "canceled").counter().count());
    }

    @Test
    void testFeedCompletionAborts() {
        StepVerifier.create(epochs(coordinator.streamDuties(5L, connectionClosed.asMono())))
                .expectNext(5L)
                .then(eventFeed::close)
                .expectErrorMatches(err -> isKind(err, DutyException.ErrorKind.ABORTED)
                        && err.getMessage().equals("Subscriber closed"))
                .verify(TIMEOUT);
    }

    private static Flux<Long> epochs(Flux<DutySnapshot> snapshots) {
        return snapshots.map(DutySnapshot::getEpoch);
    }

    private static boolean isKind(Throwable err, DutyException.ErrorKind kind) {
        return err instanceof DutyException duty && duty.getKind() == kind;
    }

    private static ChainEvents.Reorg reorg(long epoch) {
        return ChainEvents.Reorg.builder()
                .epoch(epoch)
                .slot(60)
                .depth(2)
                .oldHeadRoot(Bytes32.ZERO)
                .newHeadRoot(Bytes32.ZERO)
                .build();
    }

    // ========== Stubs ==========

    private static class StubStateProvider implements IStateProvider {
        private final long finalized;

        StubStateProvider(long finalized) {
            this.finalized = finalized;
        }

        @Override
        public Optional<BeaconStateSnapshot> stateAtSlot(long slot) {
            return Optional.empty();
        }

        @Override
        public List<Long> activeValidatorIndices(BeaconStateSnapshot snapshot, long epoch) {
            return List.of();
        }

        @Override
        public Bytes32 seed(BeaconStateSnapshot snapshot, long epoch, Domain domain) {
            return Bytes32.ZERO;
        }

        @Override
        public long finalizedCheckpointEpoch() {
            return finalized;
        }

        @Override
        public BeaconStateSnapshot headState() {
            throw DutyException.notFound("No head state available");
        }
    }

    /**
     * Replaying feed, so events published before the live phase subscribes are still seen.
     */
    private static class StubEventFeed implements IChainEventFeed {
        private final Sinks.Many<ChainEvents.EpochBoundary> boundaries = Sinks.many().replay().all();
        private final Sinks.Many<ChainEvents.Reorg> reorgs = Sinks.many().replay().all();

        @Override
        public Flux<ChainEvents.EpochBoundary> epochBoundaries() {
            return boundaries.asFlux();
        }

        @Override
        public Flux<ChainEvents.Reorg> reorgs() {
            return reorgs.asFlux();
        }

        void publishEpochBoundary(long slot) {
            boundaries.tryEmitNext(new ChainEvents.EpochBoundary(slot));
        }

        void publishReorg(ChainEvents.Reorg reorg) {
            reorgs.tryEmitNext(reorg);
        }

        void close() {
            boundaries.tryEmitComplete();
            reorgs.tryEmitComplete();
        }
    }

    private static class RecordingAssembler implements IDutySnapshotAssembler {
        private final List<Long> assembled = new CopyOnWriteArrayList<>();
        private final List<Long> invalidatedFrom = new CopyOnWriteArrayList<>();
        private final Map<Long, RuntimeException> failures = new ConcurrentHashMap<>();

        @Override
        public DutySnapshot assemble(long epoch, ReorgInfo reorgInfo) {
            RuntimeException failure = failures.get(epoch);
            if (failure != null) {
                throw failure;
            }
            if (reorgInfo == null) {
                assembled.add(epoch);
            }
            return DutySnapshot.builder()
                    .epoch(epoch)
                    .epochStartTimestamp(GENESIS + epoch * 48)
                    .proposerPubkeysBySlot(new TreeMap<>())
                    .reorgInfo(reorgInfo)
                    .build();
        }

        @Override
        public void onReorg(ChainEvents.Reorg reorg) {
            invalidatedFrom.add(reorg.getEpoch());
        }
    }
}
