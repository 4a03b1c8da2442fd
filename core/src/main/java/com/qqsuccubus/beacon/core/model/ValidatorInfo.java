package com.qqsuccubus.beacon.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Status record of one watched validator, reported on the validator info stream.
 * {@code index} is absent for keys the state does not know.
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidatorInfo {
    BlsPublicKey publicKey;
    Long index;
    long epoch;
    LifecycleState status;
    long transitionTimestamp;
    long balance;
    long effectiveBalance;
}
