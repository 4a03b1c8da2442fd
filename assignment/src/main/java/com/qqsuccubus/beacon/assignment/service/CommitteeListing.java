package com.qqsuccubus.beacon.assignment.service;

import com.qqsuccubus.beacon.core.model.CommitteeAssignment;
import lombok.Value;

import java.util.List;
import java.util.SortedMap;

@Value
public class CommitteeListing {
    long epoch;
    long activeValidatorCount;
    SortedMap<Long, List<CommitteeAssignment>> committeesBySlot;
}
