package com.qqsuccubus.beacon.core.shuffle;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.hash.Hashers;
import com.qqsuccubus.beacon.core.model.Bytes32;

import java.util.ArrayList;
import java.util.List;

/**
 * Swap-or-not shuffle as used by the consensus protocol.
 * <p>
 * Each of {@code SHUFFLE_ROUND_COUNT} rounds picks a pivot from the seed and, for every position,
 * decides from one hashed bit whether the position swaps with its mirror around the pivot.
 * Committees are contiguous slices of the shuffled active list: committee {@code k} of {@code c}
 * covers {@code [n*k/c, n*(k+1)/c)}.
 * </p>
 */
public class SwapOrNotShuffler implements IShuffler {

    private final ChainConfig config;

    public SwapOrNotShuffler(ChainConfig config) {
        this.config = config;
    }

    @Override
    public List<Long> committee(List<Long> indices, Bytes32 seed, long slot, long committeeIndex,
                                long committeesPerSlot) {
        if (committeesPerSlot <= 0 || committeeIndex < 0 || committeeIndex >= committeesPerSlot) {
            throw new IllegalArgumentException(String.format(
                    "Committee index %d out of range for %d committees per slot", committeeIndex, committeesPerSlot));
        }
        long count = committeesPerSlot * config.getSlotsPerEpoch();
        long index = (slot % config.getSlotsPerEpoch()) * committeesPerSlot + committeeIndex;

        long n = indices.size();
        long start = n * index / count;
        long end = n * (index + 1) / count;

        List<Long> members = new ArrayList<>((int) (end - start));
        for (long i = start; i < end; i++) {
            members.add(indices.get((int) shuffledIndex(i, n, seed)));
        }
        return members;
    }

    @Override
    public long shuffledIndex(long index, long indexCount, Bytes32 seed) {
        if (indexCount <= 0 || index < 0 || index >= indexCount) {
            throw new IllegalArgumentException(String.format(
                    "Index %d out of range for %d elements", index, indexCount));
        }
        byte[] seedBytes = seed.toArray();
        long current = index;
        for (int round = 0; round < config.getShuffleRoundCount(); round++) {
            byte[] roundByte = {(byte) round};
            long pivot = Long.remainderUnsigned(Hashers.readUint64(Hashers.sha256(seedBytes, roundByte)), indexCount);
            long flip = (pivot + indexCount - current) % indexCount;
            long position = Math.max(current, flip);
            byte[] source = Hashers.sha256(seedBytes, roundByte, Hashers.uint32(position / 256));
            int bits = source[(int) ((position % 256) / 8)] & 0xFF;
            if (((bits >> (position % 8)) & 1) == 1) {
                current = flip;
            }
        }
        return current;
    }
}
