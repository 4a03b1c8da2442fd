package com.qqsuccubus.beacon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Client request mutating the set of keys watched on a validator info stream.
 */
@Value
public class ValidatorChangeSet {

    public enum Action {
        ADD,
        REMOVE,
        SET
    }

    @JsonProperty("action")
    Action action;

    @JsonProperty("publicKeys")
    List<BlsPublicKey> publicKeys;

    @JsonCreator
    public ValidatorChangeSet(
            @JsonProperty("action") Action action,
            @JsonProperty("publicKeys") List<BlsPublicKey> publicKeys
    ) {
        if (action == null) {
            throw new IllegalArgumentException("Change set must name an action");
        }
        this.action = action;
        this.publicKeys = publicKeys != null ? List.copyOf(publicKeys) : List.of();
    }
}
