package com.qqsuccubus.beacon.core.model;

import com.qqsuccubus.beacon.core.error.DutyException;

/**
 * Which epoch a list request targets.
 * <p>
 * Each variant carries only what it needs; {@link #resolve(long)} is the single place where the
 * variants are told apart.
 * </p>
 */
public interface EpochSelector {

    record Genesis() implements EpochSelector {
    }

    record AtEpoch(long epoch) implements EpochSelector {
    }

    record Current() implements EpochSelector {
    }

    static EpochSelector genesis() {
        return new Genesis();
    }

    static EpochSelector at(long epoch) {
        return new AtEpoch(epoch);
    }

    static EpochSelector current() {
        return new Current();
    }

    /**
     * @param currentEpoch wall-clock epoch used for {@link Current}
     * @return the requested epoch, not yet checked against the wall clock
     * @throws DutyException INVALID_REQUEST for a selector that is none of the known variants
     */
    default long resolve(long currentEpoch) {
        if (this instanceof Genesis) {
            return 0L;
        }
        if (this instanceof AtEpoch at) {
            return at.epoch();
        }
        if (this instanceof Current) {
            return currentEpoch;
        }
        throw DutyException.invalidRequest("Unsupported epoch selector " + getClass().getSimpleName());
    }
}
