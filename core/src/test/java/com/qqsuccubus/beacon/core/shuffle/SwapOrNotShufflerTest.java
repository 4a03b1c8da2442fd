package com.qqsuccubus.beacon.core.shuffle;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.hash.Hashers;
import com.qqsuccubus.beacon.core.model.Bytes32;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class SwapOrNotShufflerTest {

    private ChainConfig config;
    private SwapOrNotShuffler shuffler;
    private Bytes32 seed;

    @BeforeEach
    void setUp() {
        config = ChainConfig.minimal();
        shuffler = new SwapOrNotShuffler(config);
        seed = Bytes32.wrap(Hashers.sha256("seed".getBytes()));
    }

    @Test
    @DisplayName("Shuffled positions form a permutation")
    void testShuffledIndexIsPermutation() {
        int count = 97;
        Set<Long> seen = new HashSet<>();
        for (long i = 0; i < count; i++) {
            long shuffled = shuffler.shuffledIndex(i, count, seed);
            assertTrue(shuffled >= 0 && shuffled < count, "Position out of range: " + shuffled);
            seen.add(shuffled);
        }
        assertEquals(count, seen.size(), "Every position must be hit exactly once");
    }

    @Test
    @DisplayName("Different seeds give different orders")
    void testSeedChangesOrder() {
        Bytes32 other = Bytes32.wrap(Hashers.sha256("other".getBytes()));
        List<Long> first = LongStream.range(0, 64).map(i -> shuffler.shuffledIndex(i, 64, seed)).boxed().toList();
        List<Long> second = LongStream.range(0, 64).map(i -> shuffler.shuffledIndex(i, 64, other)).boxed().toList();
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Single element shuffles onto itself")
    void testSingleElement() {
        assertEquals(0, shuffler.shuffledIndex(0, 1, seed));
    }

    @Test
    @DisplayName("Committees of one epoch partition the index list")
    void testCommitteesPartitionIndices() {
        List<Long> indices = LongStream.range(100, 150).boxed().collect(Collectors.toList());
        long committeesPerSlot = 2;

        List<Long> all = new ArrayList<>();
        for (long slot = 0; slot < config.getSlotsPerEpoch(); slot++) {
            for (long c = 0; c < committeesPerSlot; c++) {
                all.addAll(shuffler.committee(indices, seed, slot, c, committeesPerSlot));
            }
        }

        assertEquals(indices.size(), all.size());
        assertEquals(new HashSet<>(indices), new HashSet<>(all));
    }

    @Test
    @DisplayName("Out of range arguments are rejected")
    void testRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> shuffler.shuffledIndex(5, 5, seed));
        assertThrows(IllegalArgumentException.class, () -> shuffler.shuffledIndex(0, 0, seed));
        assertThrows(IllegalArgumentException.class,
                () -> shuffler.committee(List.of(1L, 2L), seed, 0, 3, 2));
    }
}
