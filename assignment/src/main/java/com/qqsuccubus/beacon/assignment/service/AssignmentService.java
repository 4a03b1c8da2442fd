package com.qqsuccubus.beacon.assignment.service;

import com.qqsuccubus.beacon.assignment.churn.ChurnQueueSimulator;
import com.qqsuccubus.beacon.assignment.committee.CommitteeAssignmentEngine;
import com.qqsuccubus.beacon.assignment.info.ValidatorInfoGenerator;
import com.qqsuccubus.beacon.assignment.proposer.ProposerDutyComputer;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.CommitteeAssignment;
import com.qqsuccubus.beacon.core.model.Domain;
import com.qqsuccubus.beacon.core.model.EpochSelector;
import com.qqsuccubus.beacon.core.model.ProposerDuties;
import com.qqsuccubus.beacon.core.model.ValidatorInfo;
import com.qqsuccubus.beacon.core.model.ValidatorQueue;
import com.qqsuccubus.beacon.core.state.IStateProvider;
import com.qqsuccubus.beacon.core.time.Epochs;
import com.qqsuccubus.beacon.core.time.SlotClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Answers duty queries from the state provider and the duty computations.
 * <p>
 * Computation is synchronous and CPU-bound; each call is wrapped in a Mono so callers compose it
 * with their transport pipeline.
 * </p>
 */
public class AssignmentService implements IAssignmentService {
    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private final ChainConfig config;
    private final SlotClock clock;
    private final IStateProvider stateProvider;
    private final CommitteeAssignmentEngine committeeEngine;
    private final ProposerDutyComputer proposerComputer;
    private final ChurnQueueSimulator churnSimulator;
    private final ValidatorInfoGenerator infoGenerator;

    public AssignmentService(ChainConfig config,
                             SlotClock clock,
                             IStateProvider stateProvider,
                             CommitteeAssignmentEngine committeeEngine,
                             ProposerDutyComputer proposerComputer,
                             ChurnQueueSimulator churnSimulator,
                             ValidatorInfoGenerator infoGenerator) {
        this.config = config;
        this.clock = clock;
        this.stateProvider = stateProvider;
        this.committeeEngine = committeeEngine;
        this.proposerComputer = proposerComputer;
        this.churnSimulator = churnSimulator;
        this.infoGenerator = infoGenerator;
    }

    @Override
    public Mono<List<ValidatorAssignment>> listAssignments(EpochSelector selector, AssignmentFilter filter) {
        return Mono.fromCallable(() -> {
            long epoch = resolveEpoch(selector);
            BeaconStateSnapshot state = stateAtEpoch(epoch);
            List<Long> active = stateProvider.activeValidatorIndices(state, epoch);
            List<Long> requested = filter == null || filter.isEmpty() ? active : resolveFilter(filter, state);

            SortedMap<Long, List<CommitteeAssignment>> committees = committeeEngine.computeCommittees(
                    epoch, active, stateProvider.seed(state, epoch, Domain.BEACON_ATTESTER));
            ProposerDuties proposers = active.isEmpty()
                    ? ProposerDuties.of(epoch, new TreeMap<>())
                    : proposerComputer.computeProposers(
                            epoch, active, stateProvider.seed(state, epoch, Domain.BEACON_PROPOSER), state.getValidators());

            Map<Long, CommitteeAssignment> committeeByValidator = new HashMap<>();
            committees.values().forEach(perSlot -> perSlot.forEach(committee ->
                    committee.getMembers().forEach(member -> committeeByValidator.put(member, committee))));

            List<ValidatorAssignment> result = new ArrayList<>(requested.size());
            for (Long index : requested) {
                CommitteeAssignment committee = committeeByValidator.get(index);
                result.add(ValidatorAssignment.builder()
                        .validatorIndex(index)
                        .publicKey(state.validatorAt(index).getPubkey())
                        .epoch(epoch)
                        .attesterSlot(committee != null ? committee.getSlot() : null)
                        .committeeIndex(committee != null ? committee.getCommitteeIndex() : null)
                        .beaconCommittee(committee != null ? committee.getMembers() : null)
                        .proposerSlots(proposers.slotsOf(index))
                        .build());
            }
            log.debug("Listed {} assignments for epoch {}", result.size(), epoch);
            return result;
        });
    }

    @Override
    public Mono<CommitteeListing> listCommittees(EpochSelector selector) {
        return Mono.fromCallable(() -> {
            long epoch = resolveEpoch(selector);
            BeaconStateSnapshot state = stateAtEpoch(epoch);
            List<Long> active = stateProvider.activeValidatorIndices(state, epoch);
            SortedMap<Long, List<CommitteeAssignment>> committees = committeeEngine.computeCommittees(
                    epoch, active, stateProvider.seed(state, epoch, Domain.BEACON_ATTESTER));
            return new CommitteeListing(epoch, active.size(), committees);
        });
    }

    @Override
    public Mono<ValidatorQueue> getValidatorQueue() {
        return Mono.fromCallable(() -> {
            BeaconStateSnapshot head = stateProvider.headState();
            long currentEpoch = Epochs.toEpoch(head.getSlot(), config);
            long activeCount = stateProvider.activeValidatorIndices(head, currentEpoch).size();
            return churnSimulator.computeQueues(head, currentEpoch, activeCount);
        });
    }

    @Override
    public Mono<ValidatorInfo> validatorStatus(BlsPublicKey publicKey) {
        return Mono.fromCallable(() -> {
            if (publicKey == null) {
                throw DutyException.invalidRequest("Must specify a public key");
            }
            BeaconStateSnapshot head = stateProvider.headState();
            if (head.indexOf(publicKey).isEmpty()) {
                throw DutyException.notFound("Could not find validator with public key " + publicKey.toHex());
            }
            return infoGenerator.generate(publicKey, head);
        });
    }

    private long resolveEpoch(EpochSelector selector) {
        if (selector == null) {
            throw DutyException.invalidRequest("Must specify a filter criteria for the epoch");
        }
        long currentEpoch = clock.currentEpoch();
        long epoch = selector.resolve(currentEpoch);
        if (epoch > currentEpoch) {
            throw DutyException.invalidRequest(String.format(
                    "Cannot retrieve information about an epoch in the future, current epoch %d, requesting %d",
                    currentEpoch, epoch));
        }
        return epoch;
    }

    private BeaconStateSnapshot stateAtEpoch(long epoch) {
        long slot = Epochs.startSlot(epoch, config);
        return stateProvider.stateAtSlot(slot)
                .orElseThrow(() -> DutyException.notFound("Could not find state at slot " + slot));
    }

    private List<Long> resolveFilter(AssignmentFilter filter, BeaconStateSnapshot state) {
        TreeSet<Long> indices = new TreeSet<>();
        for (BlsPublicKey key : filter.getPublicKeys()) {
            indices.add(state.indexOf(key).orElseThrow(() ->
                    DutyException.notFound("Could not find validator index for public key " + key.toHex())));
        }
        for (Long index : filter.getIndices()) {
            if (index < 0 || index >= state.validatorCount()) {
                throw DutyException.invalidRequest(String.format(
                        "Validator index %d >= validator count %d", index, state.validatorCount()));
            }
            indices.add(index);
        }
        return new ArrayList<>(indices);
    }
}
