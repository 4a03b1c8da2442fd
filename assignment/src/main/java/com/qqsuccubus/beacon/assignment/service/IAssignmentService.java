package com.qqsuccubus.beacon.assignment.service;

import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.EpochSelector;
import com.qqsuccubus.beacon.core.model.ValidatorInfo;
import com.qqsuccubus.beacon.core.model.ValidatorQueue;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Request/response duty queries (Dependency Inversion Principle).
 * <p>
 * Every operation fails with a {@link com.qqsuccubus.beacon.core.error.DutyException}:
 * INVALID_REQUEST for future epochs or malformed filters, NOT_FOUND for unknown keys or missing
 * state, COMPUTATION_FAILURE when shuffling fails.
 * </p>
 */
public interface IAssignmentService {

    /**
     * Attester and proposer duties for the filtered validators.
     *
     * @param selector Target epoch
     * @param filter   Validators to include
     * @return one entry per validator, ascending by index
     */
    Mono<List<ValidatorAssignment>> listAssignments(EpochSelector selector, AssignmentFilter filter);

    Mono<CommitteeListing> listCommittees(EpochSelector selector);

    /**
     * Activation and exit queues at the head.
     */
    Mono<ValidatorQueue> getValidatorQueue();

    /**
     * Status of a single validator at the head.
     *
     * @param publicKey Validator key
     * @return Mono of ValidatorInfo, NOT_FOUND when the key is not in the registry
     */
    Mono<ValidatorInfo> validatorStatus(BlsPublicKey publicKey);
}
