package com.qqsuccubus.beacon.core.model;

/**
 * Signature/seed domains relevant to duty computation.
 */
public enum Domain {
    BEACON_PROPOSER(new byte[]{0x00, 0x00, 0x00, 0x00}),
    BEACON_ATTESTER(new byte[]{0x01, 0x00, 0x00, 0x00});

    private final byte[] type;

    Domain(byte[] type) {
        this.type = type;
    }

    /**
     * 4-byte domain type mixed into the seed.
     */
    public byte[] type() {
        return type.clone();
    }
}
