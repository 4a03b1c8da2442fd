package com.qqsuccubus.beacon.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Registry entry of one validator as held by a state snapshot.
 * <p>
 * Epoch fields use {@link com.qqsuccubus.beacon.core.time.Epochs#FAR_FUTURE_EPOCH} for
 * "not scheduled". Balances are in Gwei.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ValidatorRecord {
    BlsPublicKey pubkey;
    long activationEligibilityEpoch;
    long activationEpoch;
    long exitEpoch;
    long withdrawableEpoch;
    long effectiveBalance;
    boolean slashed;

    /**
     * Active means {@code activationEpoch <= epoch < exitEpoch}.
     */
    public boolean isActive(long epoch) {
        return activationEpoch <= epoch && epoch < exitEpoch;
    }
}
