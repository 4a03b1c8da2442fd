package com.qqsuccubus.beacon.core.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Proposer schedule for one epoch.
 * <p>
 * Holds the direct mapping (slot to proposer) used by announcement feeds and the inverse mapping
 * (validator to its slots) used when answering duty queries for a given validator.
 * </p>
 */
@Value
public class ProposerDuties {
    long epoch;
    SortedMap<Long, Long> proposerBySlot;
    Map<Long, List<Long>> slotsByValidator;

    public static ProposerDuties of(long epoch, SortedMap<Long, Long> proposerBySlot) {
        Map<Long, List<Long>> inverse = new TreeMap<>();
        proposerBySlot.forEach((slot, validator) ->
                inverse.computeIfAbsent(validator, v -> new ArrayList<>()).add(slot));
        inverse.replaceAll((validator, slots) -> Collections.unmodifiableList(slots));
        return new ProposerDuties(
                epoch,
                Collections.unmodifiableSortedMap(new TreeMap<>(proposerBySlot)),
                Collections.unmodifiableMap(inverse)
        );
    }

    public int size() {
        return proposerBySlot.size();
    }

    public List<Long> slotsOf(long validatorIndex) {
        return slotsByValidator.getOrDefault(validatorIndex, List.of());
    }

    public List<ProposerAssignment> assignments() {
        List<ProposerAssignment> result = new ArrayList<>(proposerBySlot.size());
        proposerBySlot.forEach((slot, validator) -> result.add(new ProposerAssignment(epoch, slot, validator)));
        return result;
    }
}
