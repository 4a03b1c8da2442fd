package com.qqsuccubus.beacon.core.model;

import lombok.Value;

/**
 * Lifecycle state plus the unix timestamp of the next transition (0 when not projectable).
 */
@Value
public class ValidatorStatus {
    LifecycleState state;
    long transitionTimestamp;

    public static ValidatorStatus unknown() {
        return new ValidatorStatus(LifecycleState.UNKNOWN, 0L);
    }
}
