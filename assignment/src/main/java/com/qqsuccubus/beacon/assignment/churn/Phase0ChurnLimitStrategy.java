package com.qqsuccubus.beacon.assignment.churn;

import com.qqsuccubus.beacon.core.config.ChainConfig;

/**
 * {@code max(MIN_PER_EPOCH_CHURN_LIMIT, activeCount / CHURN_LIMIT_QUOTIENT)} for both directions.
 */
public class Phase0ChurnLimitStrategy implements ChurnLimitStrategy {

    @Override
    public long activationChurnLimit(long activeCount, ChainConfig config) {
        return validatorChurnLimit(activeCount, config);
    }

    @Override
    public long exitChurnLimit(long activeCount, ChainConfig config) {
        return validatorChurnLimit(activeCount, config);
    }

    protected long validatorChurnLimit(long activeCount, ChainConfig config) {
        return Math.max(config.getMinPerEpochChurnLimit(), activeCount / config.getChurnLimitQuotient());
    }
}
