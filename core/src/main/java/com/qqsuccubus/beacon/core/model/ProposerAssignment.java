package com.qqsuccubus.beacon.core.model;

import lombok.Value;

/**
 * The single validator allowed to propose the block for {@code slot}.
 */
@Value
public class ProposerAssignment {
    long epoch;
    long slot;
    long validatorIndex;
}
