package com.qqsuccubus.beacon.assignment.committee;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.CommitteeAssignment;
import com.qqsuccubus.beacon.core.shuffle.IShuffler;
import com.qqsuccubus.beacon.core.time.Epochs;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Splits the active validator set of an epoch into per-slot attestation committees.
 * <p>
 * <b>Algorithm:</b>
 * <ul>
 *   <li>{@code committeesPerSlot = clamp(n / SLOTS_PER_EPOCH / TARGET_COMMITTEE_SIZE, 1, MAX_COMMITTEES_PER_SLOT)}</li>
 *   <li>every (slot, committee index) pair takes its slice of the shuffled active list</li>
 * </ul>
 * The slices cover the list exactly once, so the committees of an epoch partition the active set.
 * Output depends only on (epoch, active indices, seed); results are memoized in a
 * {@link CommitteeCache} that callers invalidate on reorg.
 * </p>
 */
public class CommitteeAssignmentEngine {
    private static final Logger log = LoggerFactory.getLogger(CommitteeAssignmentEngine.class);

    private final ChainConfig config;
    private final IShuffler shuffler;
    private final CommitteeCache cache;

    public CommitteeAssignmentEngine(ChainConfig config, IShuffler shuffler, CommitteeCache cache) {
        this.config = config;
        this.shuffler = shuffler;
        this.cache = cache;
    }

    public CommitteeAssignmentEngine(ChainConfig config, IShuffler shuffler, MeterRegistry registry, long cacheSize) {
        this(config, shuffler, new CommitteeCache(cacheSize, registry));
    }

    public static long committeesPerSlot(long activeCount, ChainConfig config) {
        long perSlot = activeCount / config.getSlotsPerEpoch() / config.getTargetCommitteeSize();
        return Math.max(1L, Math.min(config.getMaxCommitteesPerSlot(), perSlot));
    }

    /**
     * Computes all committees of {@code epoch}.
     *
     * @param epoch         Target epoch
     * @param activeIndices Indices active in the epoch
     * @param seed          Attester seed of the epoch
     * @return slot to committees (ordered by committee index), unmodifiable
     * @throws DutyException COMPUTATION_FAILURE tagged with the slot when shuffling fails
     */
    public SortedMap<Long, List<CommitteeAssignment>> computeCommittees(long epoch, List<Long> activeIndices, Bytes32 seed) {
        CommitteeCache.Key key = new CommitteeCache.Key(epoch, seed, activeIndices.size());
        Optional<SortedMap<Long, List<CommitteeAssignment>>> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        SortedMap<Long, List<CommitteeAssignment>> committees = compute(epoch, activeIndices, seed);
        cache.put(key, committees);
        return committees;
    }

    /**
     * Drops cached committees for {@code epoch} and later; called when a reorg replaces the branch
     * those committees were derived from.
     */
    public void invalidateFrom(long epoch) {
        int removed = cache.invalidateFrom(epoch);
        log.debug("Invalidated {} cached committee sets from epoch {}", removed, epoch);
    }

    private SortedMap<Long, List<CommitteeAssignment>> compute(long epoch, List<Long> activeIndices, Bytes32 seed) {
        long committeesPerSlot = committeesPerSlot(activeIndices.size(), config);
        long startSlot = Epochs.startSlot(epoch, config);
        long endSlot = startSlot + config.getSlotsPerEpoch();

        SortedMap<Long, List<CommitteeAssignment>> bySlot = new TreeMap<>();
        for (long slot = startSlot; slot < endSlot; slot++) {
            List<CommitteeAssignment> committees = new ArrayList<>((int) committeesPerSlot);
            for (long committeeIndex = 0; committeeIndex < committeesPerSlot; committeeIndex++) {
                List<Long> members;
                try {
                    members = shuffler.committee(activeIndices, seed, slot, committeeIndex, committeesPerSlot);
                } catch (RuntimeException e) {
                    throw DutyException.computationFailure(slot,
                            String.format("Could not compute committee %d for slot %d", committeeIndex, slot), e);
                }
                committees.add(CommitteeAssignment.builder()
                        .epoch(epoch)
                        .slot(slot)
                        .committeeIndex(committeeIndex)
                        .members(List.copyOf(members))
                        .build());
            }
            bySlot.put(slot, Collections.unmodifiableList(committees));
        }

        log.debug("Computed {} committees per slot for epoch {} ({} active validators)",
                committeesPerSlot, epoch, activeIndices.size());
        return Collections.unmodifiableSortedMap(bySlot);
    }
}
