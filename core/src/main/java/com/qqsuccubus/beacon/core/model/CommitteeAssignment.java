package com.qqsuccubus.beacon.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One attestation committee: the ordered members assigned to {@code slot} at {@code committeeIndex}.
 */
@Value
@Builder(toBuilder = true)
public class CommitteeAssignment {
    long epoch;
    long slot;
    long committeeIndex;
    List<Long> members;
}
