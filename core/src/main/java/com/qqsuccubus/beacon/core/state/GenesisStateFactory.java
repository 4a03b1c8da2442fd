package com.qqsuccubus.beacon.core.state;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.hash.Hashers;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.time.Epochs;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds deterministic genesis states for development chains.
 * <p>
 * Keys and randao mixes are derived from hashes of their position, so two factories with the same
 * inputs produce identical states.
 * </p>
 */
public final class GenesisStateFactory {
    private GenesisStateFactory() {
    }

    /**
     * Genesis state with {@code validatorCount} validators, all active from epoch 0 at maximum
     * effective balance.
     */
    public static BeaconStateSnapshot create(ChainConfig config, long genesisTime, int validatorCount) {
        List<ValidatorRecord> validators = new ArrayList<>(validatorCount);
        List<Long> balances = new ArrayList<>(validatorCount);
        for (int i = 0; i < validatorCount; i++) {
            validators.add(activeValidator(config, i));
            balances.add(config.getMaxEffectiveBalance());
        }
        return BeaconStateSnapshot.builder()
                .slot(0)
                .genesisTime(genesisTime)
                .stateRoot(Bytes32.wrap(Hashers.sha256("genesis".getBytes(StandardCharsets.UTF_8))))
                .version(config.forkAt(Epochs.GENESIS_EPOCH))
                .validators(validators)
                .balances(balances)
                .randaoMixes(randaoMixes(config, 0))
                .finalizedCheckpointEpoch(Epochs.GENESIS_EPOCH)
                .build();
    }

    public static ValidatorRecord activeValidator(ChainConfig config, int index) {
        return ValidatorRecord.builder()
                .pubkey(pubkeyFor(index))
                .activationEligibilityEpoch(Epochs.GENESIS_EPOCH)
                .activationEpoch(Epochs.GENESIS_EPOCH)
                .exitEpoch(Epochs.FAR_FUTURE_EPOCH)
                .withdrawableEpoch(Epochs.FAR_FUTURE_EPOCH)
                .effectiveBalance(config.getMaxEffectiveBalance())
                .slashed(false)
                .build();
    }

    /**
     * Deterministic 48-byte key for the validator at {@code index}.
     */
    public static BlsPublicKey pubkeyFor(long index) {
        byte[] head = Hashers.sha256(Hashers.uint64(index));
        byte[] tail = Hashers.sha256(head);
        byte[] key = Arrays.copyOf(head, BlsPublicKey.LENGTH);
        System.arraycopy(tail, 0, key, Bytes32.LENGTH, BlsPublicKey.LENGTH - Bytes32.LENGTH);
        return BlsPublicKey.wrap(key);
    }

    /**
     * Full historical vector of mixes; {@code generation} distinguishes competing branches.
     */
    public static List<Bytes32> randaoMixes(ChainConfig config, long generation) {
        int length = Math.toIntExact(config.getEpochsPerHistoricalVector());
        List<Bytes32> mixes = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            mixes.add(Bytes32.wrap(Hashers.sha256(Hashers.uint64(generation), Hashers.uint64(i))));
        }
        return mixes;
    }
}
