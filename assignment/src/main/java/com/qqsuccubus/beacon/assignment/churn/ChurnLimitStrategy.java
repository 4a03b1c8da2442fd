package com.qqsuccubus.beacon.assignment.churn;

import com.qqsuccubus.beacon.core.config.ChainConfig;

/**
 * Per-epoch churn limits of one protocol version.
 */
public interface ChurnLimitStrategy {

    /**
     * Maximum validators that may be activated in one epoch.
     */
    long activationChurnLimit(long activeCount, ChainConfig config);

    /**
     * Maximum validators that may exit in one epoch.
     */
    long exitChurnLimit(long activeCount, ChainConfig config);
}
