package com.qqsuccubus.beacon.core.time;

import com.qqsuccubus.beacon.core.config.ChainConfig;

/**
 * Epoch and slot arithmetic.
 * <p>
 * Epochs and slots are unsigned in the protocol and held as {@code long} here. The protocol's
 * far-future sentinel is mapped to {@link Long#MAX_VALUE}; every helper saturates at the sentinel
 * instead of overflowing, so a sentinel operand always yields the sentinel.
 * </p>
 */
public final class Epochs {
    private Epochs() {
    }

    public static final long FAR_FUTURE_EPOCH = Long.MAX_VALUE;

    public static final long GENESIS_EPOCH = 0L;

    public static boolean isFarFuture(long epoch) {
        return epoch == FAR_FUTURE_EPOCH;
    }

    /**
     * Saturating addition of two non-negative values.
     */
    public static long add(long epoch, long delta) {
        if (isFarFuture(epoch) || isFarFuture(delta)) {
            return FAR_FUTURE_EPOCH;
        }
        long sum = epoch + delta;
        return sum < epoch ? FAR_FUTURE_EPOCH : sum;
    }

    public static long toEpoch(long slot, ChainConfig config) {
        return slot / config.getSlotsPerEpoch();
    }

    public static long startSlot(long epoch, ChainConfig config) {
        if (isFarFuture(epoch)) {
            return FAR_FUTURE_EPOCH;
        }
        try {
            return Math.multiplyExact(epoch, config.getSlotsPerEpoch());
        } catch (ArithmeticException e) {
            return FAR_FUTURE_EPOCH;
        }
    }

    /**
     * Epoch at which an activation or exit initiated during {@code epoch} takes effect.
     */
    public static long activationExitEpoch(long epoch, ChainConfig config) {
        return add(add(epoch, 1), config.getMaxSeedLookahead());
    }

    /**
     * Converts an epoch to the unix timestamp (seconds) of its first slot.
     *
     * @return timestamp, or 0 when the epoch is the sentinel or the result overflows
     */
    public static long toTimestamp(long epoch, long genesisTime, ChainConfig config) {
        if (isFarFuture(epoch)) {
            return 0L;
        }
        try {
            long secondsPerEpoch = Math.multiplyExact(config.getSlotsPerEpoch(), config.getSecondsPerSlot());
            return Math.addExact(genesisTime, Math.multiplyExact(epoch, secondsPerEpoch));
        } catch (ArithmeticException e) {
            return 0L;
        }
    }
}
