package com.qqsuccubus.beacon.node.stream;

import com.qqsuccubus.beacon.core.model.BlsPublicKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keys watched by one validator info stream.
 * <p>
 * Inbound change requests and epoch-driven reporting run on different threads; mutations take the
 * write lock and readers get a copy taken under the read lock. Insertion order is kept so reports
 * list keys in the order they were added.
 * </p>
 */
public class SubscriptionState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<BlsPublicKey> keys = new LinkedHashSet<>();

    /**
     * @return the keys that were not watched before, in request order
     */
    public List<BlsPublicKey> add(Collection<BlsPublicKey> added) {
        lock.writeLock().lock();
        try {
            List<BlsPublicKey> fresh = new ArrayList<>();
            for (BlsPublicKey key : added) {
                if (keys.add(key)) {
                    fresh.add(key);
                }
            }
            return fresh;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(Collection<BlsPublicKey> removed) {
        lock.writeLock().lock();
        try {
            keys.removeAll(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(Collection<BlsPublicKey> replacement) {
        lock.writeLock().lock();
        try {
            keys.clear();
            keys.addAll(replacement);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<BlsPublicKey> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(keys);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return keys.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
