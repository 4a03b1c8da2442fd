package com.qqsuccubus.beacon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.qqsuccubus.beacon.core.hash.Hashers;

import java.util.Arrays;

/**
 * Compressed 48-byte BLS public key identifying a validator.
 * <p>
 * Only the byte identity matters here; no curve validation is performed.
 * </p>
 */
public final class BlsPublicKey {
    public static final int LENGTH = 48;

    private final byte[] bytes;

    private BlsPublicKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static BlsPublicKey wrap(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Public key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new BlsPublicKey(bytes.clone());
    }

    @JsonCreator
    public static BlsPublicKey fromHex(String hex) {
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
        return o instanceof BlsPublicKey other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        String hex = toHex();
        return hex.substring(0, 10) + "..." + hex.substring(hex.length() - 4);
    }
}
