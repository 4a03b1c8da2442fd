package com.qqsuccubus.beacon.core.time;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import lombok.Getter;

import java.time.Clock;

/**
 * Wall-clock view of the chain: which slot and epoch "now" falls into.
 */
public class SlotClock {

    @Getter
    private final long genesisTime;
    private final ChainConfig config;
    private final Clock clock;

    public SlotClock(long genesisTime, ChainConfig config, Clock clock) {
        this.genesisTime = genesisTime;
        this.config = config;
        this.clock = clock;
    }

    public SlotClock(long genesisTime, ChainConfig config) {
        this(genesisTime, config, Clock.systemUTC());
    }

    /**
     * Current slot; 0 before genesis.
     */
    public long currentSlot() {
        long now = clock.instant().getEpochSecond();
        if (now < genesisTime) {
            return 0L;
        }
        return (now - genesisTime) / config.getSecondsPerSlot();
    }

    public long currentEpoch() {
        return Epochs.toEpoch(currentSlot(), config);
    }
}
