package com.qqsuccubus.beacon.assignment.churn;

import com.qqsuccubus.beacon.assignment.lifecycle.ValidatorLifecycleClassifier;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.ValidatorQueue;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.time.Epochs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Activation/exit queues and churn-limited activation projection.
 * <p>
 * <b>Queues</b> (see {@link #computeQueues}):
 * <ul>
 *   <li>activation: eligible validators whose activation epoch is not yet fixed before the
 *       finalized checkpoint, ordered by (eligibility epoch, index)</li>
 *   <li>exit: exiting validators not yet withdrawable past the exit queue horizon and not yet
 *       exited, ordered by (withdrawable epoch, index)</li>
 * </ul>
 * </p>
 * <p>
 * <b>Projection</b> (see {@link #projectActivations}): admits candidates epoch by epoch at the
 * activation churn of the growing attesting set.
 * </p>
 */
public class ChurnQueueSimulator {
    private static final Logger log = LoggerFactory.getLogger(ChurnQueueSimulator.class);

    private static final Comparator<Candidate> BY_ELIGIBILITY = Comparator
            .comparingLong((Candidate c) -> c.record().getActivationEligibilityEpoch())
            .thenComparingLong(Candidate::index);

    private static final Comparator<Candidate> BY_WITHDRAWABLE = Comparator
            .comparingLong((Candidate c) -> c.record().getWithdrawableEpoch())
            .thenComparingLong(Candidate::index);

    private final ChainConfig config;
    private final ValidatorLifecycleClassifier classifier;

    public ChurnQueueSimulator(ChainConfig config, ValidatorLifecycleClassifier classifier) {
        this.config = config;
        this.classifier = classifier;
    }

    private record Candidate(long index, ValidatorRecord record) {
    }

    /**
     * Builds the activation and exit queues of {@code state}.
     *
     * @param state        Head state (registry, finalized checkpoint and version)
     * @param currentEpoch Epoch of the head
     * @param activeCount  Validators active at {@code currentEpoch}
     */
    public ValidatorQueue computeQueues(BeaconStateSnapshot state, long currentEpoch, long activeCount) {
        ChurnLimitStrategy strategy = ChurnLimitStrategies.forVersion(state.getVersion());
        long activationChurn = strategy.activationChurnLimit(activeCount, config);
        long exitChurn = strategy.exitChurnLimit(activeCount, config);

        long activationFloor = Epochs.activationExitEpoch(state.getFinalizedCheckpointEpoch(), config);
        List<ValidatorRecord> validators = state.getValidators();

        List<Candidate> activation = new ArrayList<>();
        List<Candidate> exiting = new ArrayList<>();
        long exitQueueEpoch = 0L;
        for (int i = 0; i < validators.size(); i++) {
            ValidatorRecord v = validators.get(i);
            if (!Epochs.isFarFuture(v.getActivationEligibilityEpoch()) && v.getActivationEpoch() >= activationFloor) {
                activation.add(new Candidate(i, v));
            }
            if (!Epochs.isFarFuture(v.getExitEpoch())) {
                exiting.add(new Candidate(i, v));
                exitQueueEpoch = Math.max(exitQueueEpoch, v.getExitEpoch());
            }
        }
        activation.sort(BY_ELIGIBILITY);
        exiting.sort(BY_WITHDRAWABLE);

        final long queueEpoch = exitQueueEpoch;
        long churnAtQueueEpoch = exiting.stream().filter(c -> c.record().getExitEpoch() == queueEpoch).count();
        if (churnAtQueueEpoch >= exitChurn) {
            exitQueueEpoch = Epochs.add(exitQueueEpoch, 1);
        }
        long withdrawableHorizon = Epochs.add(exitQueueEpoch, config.getMinValidatorWithdrawabilityDelay());

        List<Long> activationIndices = new ArrayList<>(activation.size());
        List<BlsPublicKey> activationKeys = new ArrayList<>(activation.size());
        for (Candidate c : activation) {
            activationIndices.add(c.index());
            activationKeys.add(c.record().getPubkey());
        }

        List<Long> exitIndices = new ArrayList<>();
        List<BlsPublicKey> exitKeys = new ArrayList<>();
        for (Candidate c : exiting) {
            if (c.record().getWithdrawableEpoch() < withdrawableHorizon && !classifier.hasExited(c.record(), currentEpoch)) {
                exitIndices.add(c.index());
                exitKeys.add(c.record().getPubkey());
            }
        }

        log.debug("Queues at epoch {}: {} activating, {} exiting, churn {}/{}",
                currentEpoch, activationIndices.size(), exitIndices.size(), activationChurn, exitChurn);

        return ValidatorQueue.builder()
                .churnLimit(activationChurn)
                .exitChurnLimit(exitChurn)
                .activationPublicKeys(List.copyOf(activationKeys))
                .activationValidatorIndices(List.copyOf(activationIndices))
                .exitPublicKeys(List.copyOf(exitKeys))
                .exitValidatorIndices(List.copyOf(exitIndices))
                .build();
    }

    /**
     * Projects the activation epoch of pending validators without a scheduled activation.
     * <p>
     * Candidates are validators with a set eligibility epoch and no activation epoch, in
     * (eligibility, index) order. Starting at {@code fromEpoch + 1}, each simulated epoch admits
     * {@code activationChurn(attesting)} candidates from the front; every admission grows the
     * attesting count. An admitted target activates at {@code activationExitEpoch(simulatedEpoch)}.
     * </p>
     *
     * @param state     State providing the registry and version
     * @param fromEpoch Epoch the simulation starts after
     * @param targets   Indices to project
     * @return projected activation epoch per target; targets that are not candidates are absent
     */
    public Map<Long, Long> projectActivations(BeaconStateSnapshot state, long fromEpoch, Set<Long> targets) {
        Map<Long, Long> projected = new HashMap<>();
        if (targets.isEmpty()) {
            return projected;
        }
        ChurnLimitStrategy strategy = ChurnLimitStrategies.forVersion(state.getVersion());
        List<ValidatorRecord> validators = state.getValidators();

        List<Candidate> candidates = new ArrayList<>();
        long attesting = 0L;
        for (int i = 0; i < validators.size(); i++) {
            ValidatorRecord v = validators.get(i);
            if (!Epochs.isFarFuture(v.getActivationEligibilityEpoch()) && Epochs.isFarFuture(v.getActivationEpoch())) {
                candidates.add(new Candidate(i, v));
            }
            if (v.isActive(fromEpoch)) {
                attesting++;
            }
        }
        candidates.sort(BY_ELIGIBILITY);

        Deque<Candidate> queue = new ArrayDeque<>(candidates);
        Set<Long> remaining = new HashSet<>(targets);
        long simulatedEpoch = fromEpoch;
        while (!queue.isEmpty() && !remaining.isEmpty()) {
            simulatedEpoch = Epochs.add(simulatedEpoch, 1);
            long admit = Math.max(1L, strategy.activationChurnLimit(attesting, config));
            for (long j = 0; j < admit && !queue.isEmpty(); j++) {
                Candidate next = queue.pollFirst();
                if (remaining.remove(next.index())) {
                    projected.put(next.index(), Epochs.activationExitEpoch(simulatedEpoch, config));
                }
                attesting++;
            }
        }
        return projected;
    }
}
