package com.qqsuccubus.beacon.core.config;

import com.qqsuccubus.beacon.core.model.ForkVersion;
import com.qqsuccubus.beacon.core.time.Epochs;
import lombok.Builder;
import lombok.Value;

/**
 * Protocol constants that drive committee sizing, shuffling, churn and time conversion.
 * <p>
 * Two presets are provided:
 * <ul>
 *   <li>{@link #mainnet()}: production values</li>
 *   <li>{@link #minimal()}: small values used by the development chain and local testing</li>
 * </ul>
 * Individual values are overridden through {@code toBuilder()}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ChainConfig {

    long slotsPerEpoch;
    long secondsPerSlot;
    long targetCommitteeSize;
    long maxCommitteesPerSlot;
    int shuffleRoundCount;

    long minPerEpochChurnLimit;
    long churnLimitQuotient;
    long maxPerEpochActivationChurnLimit;
    long maxEffectiveBalance;

    long minSeedLookahead;
    long maxSeedLookahead;
    long minValidatorWithdrawabilityDelay;
    long epochsPerHistoricalVector;

    /**
     * First epoch of the Deneb upgrade ({@link Epochs#FAR_FUTURE_EPOCH} when not scheduled).
     */
    long denebForkEpoch;

    public static ChainConfig mainnet() {
        return ChainConfig.builder()
                .slotsPerEpoch(32)
                .secondsPerSlot(12)
                .targetCommitteeSize(128)
                .maxCommitteesPerSlot(64)
                .shuffleRoundCount(90)
                .minPerEpochChurnLimit(4)
                .churnLimitQuotient(65_536)
                .maxPerEpochActivationChurnLimit(8)
                .maxEffectiveBalance(32_000_000_000L)
                .minSeedLookahead(1)
                .maxSeedLookahead(4)
                .minValidatorWithdrawabilityDelay(256)
                .epochsPerHistoricalVector(65_536)
                .denebForkEpoch(269_568)
                .build();
    }

    public static ChainConfig minimal() {
        return ChainConfig.builder()
                .slotsPerEpoch(8)
                .secondsPerSlot(6)
                .targetCommitteeSize(4)
                .maxCommitteesPerSlot(4)
                .shuffleRoundCount(10)
                .minPerEpochChurnLimit(2)
                .churnLimitQuotient(32)
                .maxPerEpochActivationChurnLimit(4)
                .maxEffectiveBalance(32_000_000_000L)
                .minSeedLookahead(1)
                .maxSeedLookahead(4)
                .minValidatorWithdrawabilityDelay(256)
                .epochsPerHistoricalVector(64)
                .denebForkEpoch(Epochs.FAR_FUTURE_EPOCH)
                .build();
    }

    /**
     * Resolves a preset by name ("mainnet" or "minimal").
     */
    public static ChainConfig preset(String name) {
        return switch (name.toLowerCase()) {
            case "mainnet" -> mainnet();
            case "minimal" -> minimal();
            default -> throw new IllegalArgumentException("Unknown chain preset: " + name);
        };
    }

    /**
     * Fork active at the given epoch. Only the Deneb boundary is tracked; earlier upgrades share the
     * same duty rules and are reported as {@link ForkVersion#CAPELLA}.
     */
    public ForkVersion forkAt(long epoch) {
        return epoch >= denebForkEpoch ? ForkVersion.DENEB : ForkVersion.CAPELLA;
    }
}
