package com.qqsuccubus.beacon.assignment.lifecycle;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.model.LifecycleState;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.model.ValidatorStatus;
import com.qqsuccubus.beacon.core.time.Epochs;

/**
 * Maps a registry entry and the current epoch to a lifecycle state.
 * <p>
 * Checks run in a fixed order, so every input matches exactly one state:
 * <ul>
 *   <li>no record: UNKNOWN</li>
 *   <li>{@code E < activationEligibilityEpoch}: DEPOSITED (next: eligibility)</li>
 *   <li>{@code E < activationEpoch}: PENDING (next: activation)</li>
 *   <li>{@code exitEpoch} unset: ACTIVE</li>
 *   <li>{@code E < exitEpoch}: SLASHING when slashed, EXITING otherwise (next: exit)</li>
 *   <li>otherwise EXITED (next: withdrawable)</li>
 * </ul>
 * Nothing is stored between calls.
 * </p>
 */
public class ValidatorLifecycleClassifier {

    private final ChainConfig config;

    public ValidatorLifecycleClassifier(ChainConfig config) {
        this.config = config;
    }

    /**
     * @param record       Registry entry, or null when the key is unknown
     * @param currentEpoch Epoch the state is evaluated at
     * @param genesisTime  Chain genesis (unix seconds) for timestamp conversion
     */
    public ValidatorStatus classify(ValidatorRecord record, long currentEpoch, long genesisTime) {
        if (record == null) {
            return ValidatorStatus.unknown();
        }
        if (currentEpoch < record.getActivationEligibilityEpoch()) {
            return status(LifecycleState.DEPOSITED, record.getActivationEligibilityEpoch(), genesisTime);
        }
        if (currentEpoch < record.getActivationEpoch()) {
            return status(LifecycleState.PENDING, record.getActivationEpoch(), genesisTime);
        }
        if (Epochs.isFarFuture(record.getExitEpoch())) {
            return new ValidatorStatus(LifecycleState.ACTIVE, 0L);
        }
        if (currentEpoch < record.getExitEpoch()) {
            LifecycleState state = record.isSlashed() ? LifecycleState.SLASHING : LifecycleState.EXITING;
            return status(state, record.getExitEpoch(), genesisTime);
        }
        return status(LifecycleState.EXITED, record.getWithdrawableEpoch(), genesisTime);
    }

    public boolean hasExited(ValidatorRecord record, long currentEpoch) {
        return classify(record, currentEpoch, 0L).getState() == LifecycleState.EXITED;
    }

    private ValidatorStatus status(LifecycleState state, long boundaryEpoch, long genesisTime) {
        return new ValidatorStatus(state, Epochs.toTimestamp(boundaryEpoch, genesisTime, config));
    }
}
