package com.qqsuccubus.beacon.assignment.snapshot;

import com.qqsuccubus.beacon.assignment.committee.CommitteeAssignmentEngine;
import com.qqsuccubus.beacon.assignment.proposer.ProposerDutyComputer;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.Domain;
import com.qqsuccubus.beacon.core.model.DutySnapshot;
import com.qqsuccubus.beacon.core.model.ProposerDuties;
import com.qqsuccubus.beacon.core.model.ReorgInfo;
import com.qqsuccubus.beacon.core.msg.ChainEvents;
import com.qqsuccubus.beacon.core.state.IStateProvider;
import com.qqsuccubus.beacon.core.time.Epochs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Resolves the state for an epoch and turns its proposer schedule into a {@link DutySnapshot}.
 * <p>
 * Epochs the head has already reached are read from the state at their start slot. Lookahead epochs
 * (at most {@code MIN_SEED_LOOKAHEAD} past the head epoch) are computed from the head state, since
 * their seeds and active sets are already fixed there.
 * </p>
 */
public class DutySnapshotAssembler implements IDutySnapshotAssembler {
    private static final Logger log = LoggerFactory.getLogger(DutySnapshotAssembler.class);

    private final ChainConfig config;
    private final IStateProvider stateProvider;
    private final ProposerDutyComputer proposerComputer;
    private final CommitteeAssignmentEngine committeeEngine;

    public DutySnapshotAssembler(ChainConfig config,
                                 IStateProvider stateProvider,
                                 ProposerDutyComputer proposerComputer,
                                 CommitteeAssignmentEngine committeeEngine) {
        this.config = config;
        this.stateProvider = stateProvider;
        this.proposerComputer = proposerComputer;
        this.committeeEngine = committeeEngine;
    }

    @Override
    public DutySnapshot assemble(long epoch, ReorgInfo reorgInfo) {
        BeaconStateSnapshot state = resolveState(epoch);

        List<Long> active = stateProvider.activeValidatorIndices(state, epoch);
        Bytes32 seed = stateProvider.seed(state, epoch, Domain.BEACON_PROPOSER);
        ProposerDuties duties = proposerComputer.computeProposers(epoch, active, seed, state.getValidators());

        SortedMap<Long, BlsPublicKey> pubkeys = new TreeMap<>();
        duties.getProposerBySlot().forEach((slot, index) -> pubkeys.put(slot, state.validatorAt(index).getPubkey()));

        log.debug("Assembled duty snapshot for epoch {} from state {}{}",
                epoch, state.getStateRoot(), reorgInfo != null ? " (reorg)" : "");

        return DutySnapshot.builder()
                .epoch(epoch)
                .epochStartTimestamp(Epochs.toTimestamp(epoch, state.getGenesisTime(), config))
                .proposerPubkeysBySlot(Collections.unmodifiableSortedMap(pubkeys))
                .reorgInfo(reorgInfo)
                .build();
    }

    private BeaconStateSnapshot resolveState(long epoch) {
        long startSlot = Epochs.startSlot(epoch, config);
        BeaconStateSnapshot head = stateProvider.headState();
        if (startSlot < head.getSlot()) {
            return stateProvider.stateAtSlot(startSlot)
                    .orElseThrow(() -> DutyException.notFound("No state available at slot " + startSlot));
        }
        long headEpoch = Epochs.toEpoch(head.getSlot(), config);
        if (epoch > headEpoch + config.getMinSeedLookahead()) {
            throw DutyException.notFound(String.format(
                    "Epoch %d is beyond the lookahead of head epoch %d", epoch, headEpoch));
        }
        return head;
    }

    @Override
    public void onReorg(ChainEvents.Reorg reorg) {
        committeeEngine.invalidateFrom(reorg.getEpoch());
    }
}
