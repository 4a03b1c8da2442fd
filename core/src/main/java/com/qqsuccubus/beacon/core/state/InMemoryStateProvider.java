package com.qqsuccubus.beacon.core.state;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.hash.Hashers;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.Domain;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.time.SlotClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * State provider backed by snapshots registered in memory.
 * <p>
 * A request for a slot resolves to the latest snapshot registered at or before that slot, re-stamped
 * with the requested slot. Registering a snapshot at slot {@code s} therefore changes the answer for
 * every slot from {@code s} on, which is how the development chain models a reorg.
 * </p>
 */
public class InMemoryStateProvider implements IStateProvider {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStateProvider.class);

    private final ChainConfig config;
    private final SlotClock clock;
    private final ConcurrentSkipListMap<Long, BeaconStateSnapshot> states = new ConcurrentSkipListMap<>();

    public InMemoryStateProvider(ChainConfig config, SlotClock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void putState(BeaconStateSnapshot snapshot) {
        states.put(snapshot.getSlot(), snapshot);
        log.debug("Registered state {} at slot {}", snapshot.getStateRoot(), snapshot.getSlot());
    }

    @Override
    public Optional<BeaconStateSnapshot> stateAtSlot(long slot) {
        Map.Entry<Long, BeaconStateSnapshot> entry = states.floorEntry(slot);
        if (entry == null) {
            return Optional.empty();
        }
        BeaconStateSnapshot snapshot = entry.getValue();
        return Optional.of(snapshot.getSlot() == slot ? snapshot : snapshot.toBuilder().slot(slot).build());
    }

    @Override
    public List<Long> activeValidatorIndices(BeaconStateSnapshot snapshot, long epoch) {
        List<ValidatorRecord> validators = snapshot.getValidators();
        List<Long> active = new ArrayList<>(validators.size());
        for (int i = 0; i < validators.size(); i++) {
            if (validators.get(i).isActive(epoch)) {
                active.add((long) i);
            }
        }
        return active;
    }

    /**
     * {@code sha256(domainType || uint64(epoch) || mix)} where the mix is taken
     * {@code MIN_SEED_LOOKAHEAD + 1} epochs back in the historical vector.
     */
    @Override
    public Bytes32 seed(BeaconStateSnapshot snapshot, long epoch, Domain domain) {
        long vectorLength = config.getEpochsPerHistoricalVector();
        List<Bytes32> mixes = snapshot.getRandaoMixes();
        if (mixes.size() != vectorLength) {
            throw DutyException.computationFailure(snapshot.getSlot(),
                    String.format("Malformed state: %d randao mixes, expected %d", mixes.size(), vectorLength), null);
        }
        long mixEpoch = (epoch + vectorLength - config.getMinSeedLookahead() - 1) % vectorLength;
        Bytes32 mix = mixes.get((int) mixEpoch);
        return Bytes32.wrap(Hashers.sha256(domain.type(), Hashers.uint64(epoch), mix.toArray()));
    }

    @Override
    public long finalizedCheckpointEpoch() {
        return headState().getFinalizedCheckpointEpoch();
    }

    @Override
    public BeaconStateSnapshot headState() {
        return stateAtSlot(clock.currentSlot())
                .orElseThrow(() -> DutyException.notFound("No head state available"));
    }
}
