package com.qqsuccubus.beacon.assignment.service;

import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Validators an assignment query is restricted to. Empty on both sides means every active validator.
 */
@Value
@Builder(toBuilder = true)
public class AssignmentFilter {
    @Singular("index")
    List<Long> indices;
    @Singular("publicKey")
    List<BlsPublicKey> publicKeys;

    public static AssignmentFilter all() {
        return AssignmentFilter.builder().build();
    }

    public boolean isEmpty() {
        return indices.isEmpty() && publicKeys.isEmpty();
    }
}
