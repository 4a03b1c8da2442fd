package com.qqsuccubus.beacon.node.stream;

import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.state.GenesisStateFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionStateTest {

    private final BlsPublicKey k0 = GenesisStateFactory.pubkeyFor(0);
    private final BlsPublicKey k1 = GenesisStateFactory.pubkeyFor(1);
    private final BlsPublicKey k2 = GenesisStateFactory.pubkeyFor(2);

    @Test
    void testAddReturnsOnlyNewKeys() {
        SubscriptionState state = new SubscriptionState();

        assertEquals(List.of(k0, k1), state.add(List.of(k0, k1)));
        assertEquals(List.of(k2), state.add(List.of(k1, k2, k2)));
        assertEquals(List.of(k0, k1, k2), state.snapshot());
    }

    @Test
    void testRemoveAndSet() {
        SubscriptionState state = new SubscriptionState();
        state.add(List.of(k0, k1, k2));

        state.remove(List.of(k1));
        assertEquals(List.of(k0, k2), state.snapshot());

        state.set(List.of(k2, k1));
        assertEquals(List.of(k2, k1), state.snapshot());
        assertEquals(2, state.size());
    }

    @Test
    void testSnapshotIsDetached() {
        SubscriptionState state = new SubscriptionState();
        state.add(List.of(k0));

        List<BlsPublicKey> snapshot = state.snapshot();
        state.add(List.of(k1));

        assertEquals(List.of(k0), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(k2));
    }

    @Test
    void testConcurrentAddsCountEachKeyOnce() throws InterruptedException {
        SubscriptionState state = new SubscriptionState();
        List<BlsPublicKey> keys = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            keys.add(GenesisStateFactory.pubkeyFor(i));
        }
        List<List<BlsPublicKey>> added = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                List<BlsPublicKey> fresh = state.add(keys);
                synchronized (added) {
                    added.add(fresh);
                }
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(200, added.stream().mapToInt(List::size).sum());
        assertEquals(200, state.size());
    }
}
