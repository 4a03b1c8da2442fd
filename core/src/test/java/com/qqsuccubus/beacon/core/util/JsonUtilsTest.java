package com.qqsuccubus.beacon.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.DutySnapshot;
import com.qqsuccubus.beacon.core.model.ValidatorChangeSet;
import com.qqsuccubus.beacon.core.state.GenesisStateFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    private static final BlsPublicKey KEY = GenesisStateFactory.pubkeyFor(3);

    // ========== Read Tests ==========

    @Test
    void testChangeSetWithUnknownFieldsAccepted() {
        String json = "{\"action\":\"ADD\",\"publicKeys\":[\"" + KEY.toHex() + "\"],\"clientVersion\":\"2\"}";

        ValidatorChangeSet changeSet = JsonUtils.fromJson(json, ValidatorChangeSet.class);

        assertEquals(ValidatorChangeSet.Action.ADD, changeSet.getAction());
        assertEquals(List.of(KEY), changeSet.getPublicKeys());
    }

    @Test
    void testMalformedInputIsInvalidRequest() {
        List<String> inputs = List.of(
                "not json",
                "{\"action\":\"MERGE\",\"publicKeys\":[]}",
                "{\"publicKeys\":[]}",
                "{\"action\":\"SET\",\"publicKeys\":[\"0x1234\"]}");

        for (String json : inputs) {
            DutyException error = assertThrows(DutyException.class,
                    () -> JsonUtils.fromJson(json, ValidatorChangeSet.class), json);
            assertEquals(DutyException.ErrorKind.INVALID_REQUEST, error.getKind(), json);
            assertTrue(error.getMessage().startsWith("Malformed ValidatorChangeSet"), json);
        }
    }

    // ========== Write Tests ==========

    @Test
    void testSnapshotWithoutReorgOmitsReorgInfo() {
        TreeMap<Long, BlsPublicKey> proposers = new TreeMap<>();
        proposers.put(17L, KEY);
        DutySnapshot snapshot = DutySnapshot.builder()
                .epoch(2)
                .epochStartTimestamp(1_700_000_096L)
                .proposerPubkeysBySlot(proposers)
                .build();

        JsonNode json = JsonUtils.fromJson(JsonUtils.toJson(snapshot), JsonNode.class);

        assertEquals(2, json.get("epoch").asLong());
        assertEquals(1_700_000_096L, json.get("epochStartTimestamp").asLong());
        assertEquals(KEY.toHex(), json.get("proposerPubkeysBySlot").get("17").asText());
        assertFalse(json.has("reorgInfo"));
        assertFalse(json.has("reorg"));
    }
}
