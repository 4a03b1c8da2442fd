package com.qqsuccubus.beacon.assignment.proposer;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.hash.Hashers;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.ProposerDuties;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.shuffle.IShuffler;
import com.qqsuccubus.beacon.core.time.Epochs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Picks the block proposer of every slot in an epoch.
 * <p>
 * <b>Selection:</b> the slot seed is {@code sha256(epochSeed || uint64(slot))}. Candidates are drawn in
 * shuffled order; candidate {@code i} is accepted when
 * {@code effectiveBalance * 255 >= MAX_EFFECTIVE_BALANCE * randomByte(i)}, which weights selection by
 * effective balance.
 * </p>
 * <p>
 * Slot 0 has no proposer. The result must hold exactly one proposer per remaining slot; anything else
 * means the inputs are broken and is reported as a structural failure.
 * </p>
 */
public class ProposerDutyComputer {
    private static final Logger log = LoggerFactory.getLogger(ProposerDutyComputer.class);

    private static final int MAX_RANDOM_BYTE = 255;
    private static final long MAX_CANDIDATES_PER_INDEX = 1024;

    private final ChainConfig config;
    private final IShuffler shuffler;

    public ProposerDutyComputer(ChainConfig config, IShuffler shuffler) {
        this.config = config;
        this.shuffler = shuffler;
    }

    /**
     * @param epoch         Target epoch
     * @param activeIndices Indices active in the epoch
     * @param seed          Proposer seed of the epoch
     * @param registry      Validator registry the indices point into
     * @return direct and inverse proposer mappings
     */
    public ProposerDuties computeProposers(long epoch, List<Long> activeIndices, Bytes32 seed,
                                           List<ValidatorRecord> registry) {
        long startSlot = Epochs.startSlot(epoch, config);
        if (activeIndices.isEmpty()) {
            throw DutyException.computationFailure(startSlot, "No active validators in epoch " + epoch, null);
        }

        SortedMap<Long, Long> proposerBySlot = new TreeMap<>();
        for (long slot = startSlot; slot < startSlot + config.getSlotsPerEpoch(); slot++) {
            if (slot == 0) {
                continue;
            }
            byte[] slotSeed = Hashers.sha256(seed.toArray(), Hashers.uint64(slot));
            proposerBySlot.put(slot, proposerIndex(slot, activeIndices, slotSeed, registry));
        }

        long expected = config.getSlotsPerEpoch() - (epoch == Epochs.GENESIS_EPOCH ? 1 : 0);
        if (proposerBySlot.size() != expected) {
            throw DutyException.structuralFailure(String.format(
                    "Epoch %d produced %d proposers, expected %d", epoch, proposerBySlot.size(), expected));
        }

        log.debug("Computed {} proposers for epoch {}", proposerBySlot.size(), epoch);
        return ProposerDuties.of(epoch, proposerBySlot);
    }

    private long proposerIndex(long slot, List<Long> indices, byte[] slotSeed, List<ValidatorRecord> registry) {
        long total = indices.size();
        Bytes32 seed = Bytes32.wrap(slotSeed);
        long limit = total * MAX_CANDIDATES_PER_INDEX;

        for (long i = 0; i < limit; i++) {
            long candidate;
            ValidatorRecord record;
            try {
                candidate = indices.get((int) shuffler.shuffledIndex(i % total, total, seed));
                record = registry.get(Math.toIntExact(candidate));
            } catch (RuntimeException e) {
                throw DutyException.computationFailure(slot, "Proposer sampling failed at slot " + slot, e);
            }
            byte[] random = Hashers.sha256(slotSeed, Hashers.uint64(i / 32));
            int randomByte = random[(int) (i % 32)] & 0xFF;
            if (record.getEffectiveBalance() * MAX_RANDOM_BYTE >= config.getMaxEffectiveBalance() * randomByte) {
                return candidate;
            }
        }
        throw DutyException.computationFailure(slot,
                String.format("No proposer accepted after %d candidates at slot %d", limit, slot), null);
    }
}
