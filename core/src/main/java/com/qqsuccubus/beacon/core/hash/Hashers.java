package com.qqsuccubus.beacon.core.hash;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Hash and byte helpers used by shuffling, seed derivation and proposer selection.
 * <p>
 * The protocol hash is SHA-256; integers are serialized little-endian.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    /**
     * SHA-256 over the concatenation of all parts.
     *
     * @param parts Input byte arrays
     * @return 32-byte digest
     */
    public static byte[] sha256(byte[]... parts) {
        Hasher hasher = Hashing.sha256().newHasher();
        for (byte[] part : parts) {
            hasher.putBytes(part);
        }
        return hasher.hash().asBytes();
    }

    /**
     * Little-endian 8-byte encoding of an unsigned 64-bit value.
     */
    public static byte[] uint64(long value) {
        return ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
    }

    /**
     * Little-endian 4-byte encoding of an unsigned 32-bit value.
     */
    public static byte[] uint32(long value) {
        return ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array();
    }

    /**
     * Reads the first 8 bytes of {@code bytes} as a little-endian unsigned 64-bit value.
     */
    public static long readUint64(byte[] bytes) {
        return ByteBuffer.wrap(bytes, 0, Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }

    public static String toHex(byte[] bytes) {
        return HEX.encode(bytes);
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static byte[] fromHex(String hex) {
        String body = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return HEX.decode(body.toLowerCase());
    }
}
