package com.qqsuccubus.beacon.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Old/new head linkage attached to snapshots recomputed after a chain reorganization.
 */
@Value
@Builder
public class ReorgInfo {
    long slot;
    long depth;
    Bytes32 oldHeadRoot;
    Bytes32 newHeadRoot;
}
