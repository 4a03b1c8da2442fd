package com.qqsuccubus.beacon.core.model;

/**
 * Lifecycle of a validator as seen from one epoch.
 */
public enum LifecycleState {
    /** No registry entry (the key is not known to the state). */
    UNKNOWN,
    /** Deposit processed, not yet eligible for activation. */
    DEPOSITED,
    /** Eligible, waiting in the activation queue. */
    PENDING,
    ACTIVE,
    /** Voluntary exit scheduled. */
    EXITING,
    /** Exit forced by slashing. */
    SLASHING,
    EXITED
}
