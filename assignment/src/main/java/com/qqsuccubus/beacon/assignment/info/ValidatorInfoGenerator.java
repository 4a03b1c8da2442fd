package com.qqsuccubus.beacon.assignment.info;

import com.qqsuccubus.beacon.assignment.churn.ChurnQueueSimulator;
import com.qqsuccubus.beacon.assignment.lifecycle.ValidatorLifecycleClassifier;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.LifecycleState;
import com.qqsuccubus.beacon.core.model.ValidatorInfo;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.model.ValidatorStatus;
import com.qqsuccubus.beacon.core.time.Epochs;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds {@link ValidatorInfo} records for a set of keys against the head state.
 * <p>
 * Records describe the last complete epoch ({@code headEpoch - 1}); nothing is reported while the
 * head is still in epoch 0. Pending validators without a scheduled activation get a projected
 * activation timestamp from the churn simulation.
 * </p>
 */
public class ValidatorInfoGenerator {

    private static final Set<LifecycleState> ATTESTING =
            EnumSet.of(LifecycleState.ACTIVE, LifecycleState.EXITING, LifecycleState.SLASHING);

    private final ChainConfig config;
    private final ValidatorLifecycleClassifier classifier;
    private final ChurnQueueSimulator simulator;

    public ValidatorInfoGenerator(ChainConfig config, ValidatorLifecycleClassifier classifier,
                                  ChurnQueueSimulator simulator) {
        this.config = config;
        this.classifier = classifier;
        this.simulator = simulator;
    }

    public List<ValidatorInfo> generate(List<BlsPublicKey> keys, BeaconStateSnapshot head) {
        long headEpoch = Epochs.toEpoch(head.getSlot(), config);
        if (headEpoch == Epochs.GENESIS_EPOCH || keys.isEmpty()) {
            return List.of();
        }
        long epoch = headEpoch - 1;

        List<ValidatorInfo> result = new ArrayList<>(keys.size());
        Set<Long> unscheduled = new HashSet<>();
        for (BlsPublicKey key : keys) {
            ValidatorInfo info = describe(key, head, headEpoch, epoch);
            result.add(info);
            if (info.getStatus() == LifecycleState.PENDING
                    && Epochs.isFarFuture(head.validatorAt(info.getIndex()).getActivationEpoch())) {
                unscheduled.add(info.getIndex());
            }
        }

        if (!unscheduled.isEmpty()) {
            Map<Long, Long> projected = simulator.projectActivations(head, epoch, unscheduled);
            result.replaceAll(info -> {
                Long activation = info.getIndex() != null ? projected.get(info.getIndex()) : null;
                if (activation == null) {
                    return info;
                }
                return info.withTransitionTimestamp(Epochs.toTimestamp(activation, head.getGenesisTime(), config));
            });
        }
        return result;
    }

    /**
     * Single-key variant for status lookups.
     */
    public ValidatorInfo generate(BlsPublicKey key, BeaconStateSnapshot head) {
        long headEpoch = Epochs.toEpoch(head.getSlot(), config);
        if (headEpoch == Epochs.GENESIS_EPOCH) {
            return describe(key, head, headEpoch, headEpoch);
        }
        return generate(List.of(key), head).get(0);
    }

    private ValidatorInfo describe(BlsPublicKey key, BeaconStateSnapshot head, long headEpoch, long epoch) {
        Optional<Long> index = head.indexOf(key);
        if (index.isEmpty()) {
            return ValidatorInfo.builder()
                    .publicKey(key)
                    .epoch(epoch)
                    .status(LifecycleState.UNKNOWN)
                    .build();
        }
        ValidatorRecord record = head.validatorAt(index.get());
        ValidatorStatus status = classifier.classify(record, headEpoch, head.getGenesisTime());
        return ValidatorInfo.builder()
                .publicKey(key)
                .index(index.get())
                .epoch(epoch)
                .status(status.getState())
                .transitionTimestamp(status.getTransitionTimestamp())
                .balance(head.balanceAt(index.get()))
                .effectiveBalance(ATTESTING.contains(status.getState()) ? record.getEffectiveBalance() : 0L)
                .build();
    }
}
