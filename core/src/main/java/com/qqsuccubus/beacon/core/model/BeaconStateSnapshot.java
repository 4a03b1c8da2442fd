package com.qqsuccubus.beacon.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a beacon state at one slot.
 * <p>
 * Snapshots are never mutated: collections are copied into immutable lists on construction and a
 * public key index is built once. A different chain view is a different snapshot.
 * </p>
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class BeaconStateSnapshot {
    @ToString.Include
    private final long slot;
    private final long genesisTime;
    @ToString.Include
    private final Bytes32 stateRoot;
    @ToString.Include
    private final ForkVersion version;
    private final List<ValidatorRecord> validators;
    private final List<Long> balances;
    private final List<Bytes32> randaoMixes;
    @ToString.Include
    private final long finalizedCheckpointEpoch;

    @Getter(lombok.AccessLevel.NONE)
    private final ImmutableMap<BlsPublicKey, Long> indexByPubkey;

    @Builder(toBuilder = true)
    public BeaconStateSnapshot(long slot,
                               long genesisTime,
                               Bytes32 stateRoot,
                               ForkVersion version,
                               List<ValidatorRecord> validators,
                               List<Long> balances,
                               List<Bytes32> randaoMixes,
                               long finalizedCheckpointEpoch) {
        this.slot = slot;
        this.genesisTime = genesisTime;
        this.stateRoot = stateRoot != null ? stateRoot : Bytes32.ZERO;
        this.version = version != null ? version : ForkVersion.PHASE0;
        this.validators = validators != null ? ImmutableList.copyOf(validators) : ImmutableList.of();
        this.balances = balances != null ? ImmutableList.copyOf(balances) : ImmutableList.of();
        this.randaoMixes = randaoMixes != null ? ImmutableList.copyOf(randaoMixes) : ImmutableList.of();
        this.finalizedCheckpointEpoch = finalizedCheckpointEpoch;

        ImmutableMap.Builder<BlsPublicKey, Long> index = ImmutableMap.builderWithExpectedSize(this.validators.size());
        for (int i = 0; i < this.validators.size(); i++) {
            index.put(this.validators.get(i).getPubkey(), (long) i);
        }
        this.indexByPubkey = index.buildKeepingLast();
    }

    public int validatorCount() {
        return validators.size();
    }

    public Optional<Long> indexOf(BlsPublicKey pubkey) {
        return Optional.ofNullable(indexByPubkey.get(pubkey));
    }

    public ValidatorRecord validatorAt(long index) {
        return validators.get(Math.toIntExact(index));
    }

    /**
     * Balance at {@code index}, or the validator's effective balance when the balance list is
     * shorter than the registry.
     */
    public long balanceAt(long index) {
        int i = Math.toIntExact(index);
        return i < balances.size() ? balances.get(i) : validators.get(i).getEffectiveBalance();
    }
}
