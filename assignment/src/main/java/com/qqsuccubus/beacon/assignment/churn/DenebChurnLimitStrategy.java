package com.qqsuccubus.beacon.assignment.churn;

import com.qqsuccubus.beacon.core.config.ChainConfig;

/**
 * Deneb caps activations at {@code MAX_PER_EPOCH_ACTIVATION_CHURN_LIMIT}; exits keep the base limit.
 */
public class DenebChurnLimitStrategy extends Phase0ChurnLimitStrategy {

    @Override
    public long activationChurnLimit(long activeCount, ChainConfig config) {
        return Math.min(config.getMaxPerEpochActivationChurnLimit(), validatorChurnLimit(activeCount, config));
    }
}
