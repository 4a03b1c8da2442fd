package com.qqsuccubus.beacon.core.shuffle;

import com.qqsuccubus.beacon.core.model.Bytes32;

import java.util.List;

/**
 * Protocol shuffling primitive (Dependency Inversion Principle).
 */
public interface IShuffler {

    /**
     * Ordered members of one committee.
     *
     * @param indices           Active validator indices of the epoch
     * @param seed              Attester seed of the epoch
     * @param slot              Slot the committee attests in
     * @param committeeIndex    Committee position within the slot
     * @param committeesPerSlot Number of committees per slot
     * @return members in shuffled order
     * @throws IllegalArgumentException when the position is out of bounds
     */
    List<Long> committee(List<Long> indices, Bytes32 seed, long slot, long committeeIndex, long committeesPerSlot);

    /**
     * Position that {@code index} is moved to by the shuffle of {@code indexCount} elements.
     */
    long shuffledIndex(long index, long indexCount, Bytes32 seed);
}
