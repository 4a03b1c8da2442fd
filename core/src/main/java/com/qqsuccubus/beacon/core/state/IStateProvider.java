package com.qqsuccubus.beacon.core.state;

import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.Domain;

import java.util.List;
import java.util.Optional;

/**
 * Source of beacon state snapshots (Dependency Inversion Principle).
 * <p>
 * Storage and block replay live behind this interface; duty computation only reads the snapshots
 * it returns.
 * </p>
 */
public interface IStateProvider {

    /**
     * Returns the state as of {@code slot}.
     *
     * @param slot Slot to resolve
     * @return snapshot, or empty when the slot cannot be resolved
     */
    Optional<BeaconStateSnapshot> stateAtSlot(long slot);

    /**
     * Indices active at {@code epoch}, ascending.
     */
    List<Long> activeValidatorIndices(BeaconStateSnapshot snapshot, long epoch);

    /**
     * Shuffling seed for ({@code epoch}, {@code domain}).
     */
    Bytes32 seed(BeaconStateSnapshot snapshot, long epoch, Domain domain);

    long finalizedCheckpointEpoch();

    /**
     * Current head state.
     *
     * @throws com.qqsuccubus.beacon.core.error.DutyException NOT_FOUND when no head is available yet
     */
    BeaconStateSnapshot headState();
}
