package com.qqsuccubus.beacon.assignment.committee;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.qqsuccubus.beacon.core.metrics.MetricsNames;
import com.qqsuccubus.beacon.core.metrics.MetricsTags;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.CommitteeAssignment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Bounded cache of computed committees, owned by one {@link CommitteeAssignmentEngine}.
 * <p>
 * Entries are keyed by epoch, attester seed and active set size. They are dropped either by size
 * eviction or explicitly through {@link #invalidateFrom(long)} when the chain reorganizes.
 * </p>
 */
public class CommitteeCache {

    /**
     * Cache key; the seed already pins the chain branch, the active count guards against callers that
     * pass a different validator set with the same seed.
     */
    public record Key(long epoch, Bytes32 seed, int activeCount) {
    }

    private final Cache<Key, SortedMap<Long, List<CommitteeAssignment>>> cache;
    private final Counter hits;
    private final Counter misses;
    private final Counter invalidations;

    public CommitteeCache(long maximumSize, MeterRegistry registry) {
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .build();

        this.hits = Counter.builder(MetricsNames.COMMITTEE_CACHE_TOTAL)
                .tag(MetricsTags.RESULT, "hit")
                .description("Committee cache hits")
                .register(registry);

        this.misses = Counter.builder(MetricsNames.COMMITTEE_CACHE_TOTAL)
                .tag(MetricsTags.RESULT, "miss")
                .description("Committee cache misses")
                .register(registry);

        this.invalidations = Counter.builder(MetricsNames.COMMITTEE_CACHE_INVALIDATIONS_TOTAL)
                .description("Committee cache entries dropped after reorgs")
                .register(registry);
    }

    public Optional<SortedMap<Long, List<CommitteeAssignment>>> get(Key key) {
        SortedMap<Long, List<CommitteeAssignment>> value = cache.getIfPresent(key);
        if (value != null) {
            hits.increment();
        } else {
            misses.increment();
        }
        return Optional.ofNullable(value);
    }

    public void put(Key key, SortedMap<Long, List<CommitteeAssignment>> committees) {
        cache.put(key, committees);
    }

    /**
     * Drops every entry for {@code epoch} and later.
     *
     * @return number of entries removed
     */
    public int invalidateFrom(long epoch) {
        int before = (int) cache.size();
        cache.asMap().keySet().removeIf(key -> key.epoch() >= epoch);
        int removed = before - (int) cache.size();
        invalidations.increment(removed);
        return removed;
    }

    public long size() {
        return cache.size();
    }
}
