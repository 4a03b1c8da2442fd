package com.qqsuccubus.beacon.core.model;

/**
 * Protocol upgrades in activation order.
 */
public enum ForkVersion {
    PHASE0,
    ALTAIR,
    BELLATRIX,
    CAPELLA,
    DENEB;

    public boolean isAtLeast(ForkVersion other) {
        return compareTo(other) >= 0;
    }
}
