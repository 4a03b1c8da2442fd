package com.qqsuccubus.beacon.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.SortedMap;

/**
 * Per-epoch payload pushed on the duty stream.
 * <p>
 * {@code reorgInfo} is present only on snapshots recomputed because of a reorganization; such a
 * snapshot replaces any earlier snapshot for the same epoch.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DutySnapshot {
    long epoch;
    long epochStartTimestamp;
    SortedMap<Long, BlsPublicKey> proposerPubkeysBySlot;
    ReorgInfo reorgInfo;

    @JsonIgnore
    public boolean isReorg() {
        return reorgInfo != null;
    }
}
