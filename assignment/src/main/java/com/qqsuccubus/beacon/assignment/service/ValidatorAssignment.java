package com.qqsuccubus.beacon.assignment.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Attester and proposer duties of one validator in one epoch.
 * Attester fields are absent when the validator is not active in the epoch.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidatorAssignment {
    long validatorIndex;
    BlsPublicKey publicKey;
    long epoch;
    Long attesterSlot;
    Long committeeIndex;
    List<Long> beaconCommittee;
    List<Long> proposerSlots;
}
