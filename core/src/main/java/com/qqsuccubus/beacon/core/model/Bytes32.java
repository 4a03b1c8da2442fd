package com.qqsuccubus.beacon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.qqsuccubus.beacon.core.hash.Hashers;

import java.util.Arrays;

/**
 * Immutable 32-byte value: seeds, randao mixes, block and state roots.
 * Serialized as a {@code 0x}-prefixed lowercase hex string.
 */
public final class Bytes32 {
    public static final int LENGTH = 32;

    public static final Bytes32 ZERO = new Bytes32(new byte[LENGTH]);

    private final byte[] bytes;

    private Bytes32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Bytes32 wrap(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Expected " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Bytes32(bytes.clone());
    }

    @JsonCreator
    public static Bytes32 fromHex(String hex) {
        return wrap(Hashers.fromHex(hex));
    }

    public byte[] toArray() {
        return bytes.clone();
    }

    @JsonValue
    public String toHex() {
        return "0x" + Hashers.toHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bytes32 other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
