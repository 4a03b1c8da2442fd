package com.qqsuccubus.beacon.core.msg;

import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.ReorgInfo;
import lombok.Builder;
import lombok.Value;

/**
 * Chain notifications consumed by the duty streams.
 * <p>
 * The event feed publishes these when the head crosses an epoch boundary or when fork choice
 * switches to a different branch.
 * </p>
 */
public final class ChainEvents {
    private ChainEvents() {
    }

    /**
     * Head reached the first slot of a new epoch.
     */
    @Value
    public static class EpochBoundary {
        long slot;
    }

    /**
     * Fork choice replaced the head with a block on a different branch.
     */
    @Value
    @Builder(toBuilder = true)
    public static class Reorg {
        /**
         * Epoch whose duties must be recomputed against the new head.
         */
        long epoch;

        /**
         * Slot of the new head.
         */
        long slot;

        /**
         * Number of blocks removed from the canonical chain.
         */
        long depth;

        Bytes32 oldHeadRoot;
        Bytes32 newHeadRoot;

        public ReorgInfo toInfo() {
            return ReorgInfo.builder()
                    .slot(slot)
                    .depth(depth)
                    .oldHeadRoot(oldHeadRoot)
                    .newHeadRoot(newHeadRoot)
                    .build();
        }
    }
}
