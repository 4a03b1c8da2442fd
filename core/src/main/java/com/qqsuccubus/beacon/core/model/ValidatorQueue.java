package com.qqsuccubus.beacon.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Activation and exit queues at the head state, with the churn limits that bound them.
 * Index and key lists are parallel and share the same order.
 */
@Value
@Builder(toBuilder = true)
public class ValidatorQueue {
    long churnLimit;
    long exitChurnLimit;
    List<BlsPublicKey> activationPublicKeys;
    List<Long> activationValidatorIndices;
    List<BlsPublicKey> exitPublicKeys;
    List<Long> exitValidatorIndices;
}
