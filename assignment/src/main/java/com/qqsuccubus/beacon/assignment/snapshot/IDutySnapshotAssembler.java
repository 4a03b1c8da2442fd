package com.qqsuccubus.beacon.assignment.snapshot;

import com.qqsuccubus.beacon.core.model.DutySnapshot;
import com.qqsuccubus.beacon.core.model.ReorgInfo;
import com.qqsuccubus.beacon.core.msg.ChainEvents;

/**
 * Produces the per-epoch duty payload for streams (Dependency Inversion Principle).
 */
public interface IDutySnapshotAssembler {

    /**
     * Computes the snapshot of {@code epoch}.
     *
     * @param epoch     Target epoch
     * @param reorgInfo Reorg linkage to attach, or null for regular snapshots
     * @throws com.qqsuccubus.beacon.core.error.DutyException on missing state or failed computation
     */
    DutySnapshot assemble(long epoch, ReorgInfo reorgInfo);

    /**
     * Drops derived data that the reorg made stale.
     */
    void onReorg(ChainEvents.Reorg reorg);
}
