package com.qqsuccubus.beacon.assignment.snapshot;

import com.qqsuccubus.beacon.assignment.committee.CommitteeAssignmentEngine;
import com.qqsuccubus.beacon.assignment.committee.CommitteeCache;
import com.qqsuccubus.beacon.assignment.proposer.ProposerDutyComputer;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.Domain;
import com.qqsuccubus.beacon.core.model.DutySnapshot;
import com.qqsuccubus.beacon.core.model.ReorgInfo;
import com.qqsuccubus.beacon.core.msg.ChainEvents;
import com.qqsuccubus.beacon.core.shuffle.SwapOrNotShuffler;
import com.qqsuccubus.beacon.core.state.GenesisStateFactory;
import com.qqsuccubus.beacon.core.state.IStateProvider;
import com.qqsuccubus.beacon.core.state.InMemoryStateProvider;
import com.qqsuccubus.beacon.core.time.Epochs;
import com.qqsuccubus.beacon.core.time.SlotClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DutySnapshotAssemblerTest {

    private static final long GENESIS = 1_700_000_000L;

    private ChainConfig config;
    private SlotClock clock;
    private InMemoryStateProvider stateProvider;
    private CommitteeCache cache;
    private CommitteeAssignmentEngine engine;
    private DutySnapshotAssembler assembler;
    private BeaconStateSnapshot genesis;

    @BeforeEach
    void setUp() {
        config = ChainConfig.minimal();
        clock = new SlotClock(GENESIS, config,
                Clock.fixed(Instant.ofEpochSecond(GENESIS + 6 * 8 * 6), ZoneOffset.UTC));
        stateProvider = new InMemoryStateProvider(config, clock);
        genesis = GenesisStateFactory.create(config, GENESIS, 32);
        stateProvider.putState(genesis);

        SwapOrNotShuffler shuffler = new SwapOrNotShuffler(config);
        cache = new CommitteeCache(16, new SimpleMeterRegistry());
        engine = new CommitteeAssignmentEngine(config, shuffler, cache);
        assembler = new DutySnapshotAssembler(config, stateProvider, new ProposerDutyComputer(config, shuffler), engine);
    }

    @Test
    @DisplayName("Snapshot lists one proposer key per slot of the epoch")
    void testAssemble() {
        DutySnapshot snapshot = assembler.assemble(2, null);

        assertEquals(2, snapshot.getEpoch());
        assertEquals(Epochs.toTimestamp(2, GENESIS, config), snapshot.getEpochStartTimestamp());
        assertEquals(List.of(16L, 17L, 18L, 19L, 20L, 21L, 22L, 23L),
                List.copyOf(snapshot.getProposerPubkeysBySlot().keySet()));
        Set<BlsPublicKey> registry = genesis.getValidators().stream()
                .map(v -> v.getPubkey()).collect(Collectors.toSet());
        assertTrue(registry.containsAll(snapshot.getProposerPubkeysBySlot().values()));
        assertFalse(snapshot.isReorg());
    }

    @Test
    void testGenesisEpochSkipsSlotZero() {
        DutySnapshot snapshot = assembler.assemble(0, null);

        assertEquals(7, snapshot.getProposerPubkeysBySlot().size());
        assertFalse(snapshot.getProposerPubkeysBySlot().containsKey(0L));
    }

    @Test
    void testReorgInfoAttached() {
        ReorgInfo info = ReorgInfo.builder().slot(40).depth(2)
                .oldHeadRoot(Bytes32.ZERO).newHeadRoot(Bytes32.ZERO).build();

        DutySnapshot snapshot = assembler.assemble(5, info);

        assertTrue(snapshot.isReorg());
        assertEquals(info, snapshot.getReorgInfo());
        assertEquals(assembler.assemble(5, null).getProposerPubkeysBySlot(), snapshot.getProposerPubkeysBySlot());
    }

    @Test
    void testMissingStateIsNotFound() {
        InMemoryStateProvider empty = new InMemoryStateProvider(config, clock);
        SwapOrNotShuffler shuffler = new SwapOrNotShuffler(config);
        DutySnapshotAssembler bare = new DutySnapshotAssembler(config, empty, new ProposerDutyComputer(config, shuffler), engine);

        DutyException error = assertThrows(DutyException.class, () -> bare.assemble(1, null));

        assertEquals(DutyException.ErrorKind.NOT_FOUND, error.getKind());
        assertTrue(error.isSkippable());
    }

    @Test
    @DisplayName("Reorg drops cached committees from the reorged epoch on")
    void testReorgInvalidatesCommittees() {
        List<Long> active = stateProvider.activeValidatorIndices(genesis, 2);
        engine.computeCommittees(2, active, stateProvider.seed(genesis, 2, Domain.BEACON_ATTESTER));
        engine.computeCommittees(4, active, stateProvider.seed(genesis, 4, Domain.BEACON_ATTESTER));
        assertEquals(2, cache.size());

        assembler.onReorg(ChainEvents.Reorg.builder().epoch(3).slot(30).depth(1).build());

        assertEquals(1, cache.size());
    }

    // ========== Lookahead Tests ==========

    @Test
    @DisplayName("Next epoch duties come from the head state when its start slot is not reached yet")
    void testLookaheadEpochFromHeadState() {
        ExactSlotStateProvider exact = new ExactSlotStateProvider(stateProvider, 48);
        DutySnapshotAssembler lookahead = new DutySnapshotAssembler(config, exact,
                new ProposerDutyComputer(config, new SwapOrNotShuffler(config)), engine);

        DutySnapshot snapshot = lookahead.assemble(7, null);

        assertEquals(7, snapshot.getEpoch());
        assertEquals(List.of(56L, 57L, 58L, 59L, 60L, 61L, 62L, 63L),
                List.copyOf(snapshot.getProposerPubkeysBySlot().keySet()));
        assertEquals(assembler.assemble(7, null).getProposerPubkeysBySlot(), snapshot.getProposerPubkeysBySlot());
        assertTrue(exact.requestedSlots.stream().allMatch(slot -> slot <= 48));
    }

    @Test
    void testPastEpochStillReadsItsStartSlot() {
        ExactSlotStateProvider exact = new ExactSlotStateProvider(stateProvider, 48);
        DutySnapshotAssembler lookahead = new DutySnapshotAssembler(config, exact,
                new ProposerDutyComputer(config, new SwapOrNotShuffler(config)), engine);

        lookahead.assemble(3, null);

        assertTrue(exact.requestedSlots.contains(24L));
    }

    @Test
    void testBeyondLookaheadIsNotFound() {
        ExactSlotStateProvider exact = new ExactSlotStateProvider(stateProvider, 48);
        DutySnapshotAssembler lookahead = new DutySnapshotAssembler(config, exact,
                new ProposerDutyComputer(config, new SwapOrNotShuffler(config)), engine);

        DutyException error = assertThrows(DutyException.class, () -> lookahead.assemble(8, null));

        assertEquals(DutyException.ErrorKind.NOT_FOUND, error.getKind());
        assertTrue(error.isSkippable());
    }

    /**
     * Provider that only resolves slots the chain has reached, without Mockito.
     */
    private static class ExactSlotStateProvider implements IStateProvider {
        private final InMemoryStateProvider delegate;
        private final long headSlot;
        private final List<Long> requestedSlots = new CopyOnWriteArrayList<>();

        ExactSlotStateProvider(InMemoryStateProvider delegate, long headSlot) {
            this.delegate = delegate;
            this.headSlot = headSlot;
        }

        @Override
        public Optional<BeaconStateSnapshot> stateAtSlot(long slot) {
            requestedSlots.add(slot);
            return slot > headSlot ? Optional.empty() : delegate.stateAtSlot(slot);
        }

        @Override
        public List<Long> activeValidatorIndices(BeaconStateSnapshot snapshot, long epoch) {
            return delegate.activeValidatorIndices(snapshot, epoch);
        }

        @Override
        public Bytes32 seed(BeaconStateSnapshot snapshot, long epoch, Domain domain) {
            return delegate.seed(snapshot, epoch, domain);
        }

        @Override
        public long finalizedCheckpointEpoch() {
            return delegate.finalizedCheckpointEpoch();
        }

        @Override
        public BeaconStateSnapshot headState() {
            return stateAtSlot(headSlot).orElseThrow();
        }
    }
}
