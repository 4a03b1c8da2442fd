package com.qqsuccubus.beacon.node.config;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Configuration for the duty node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class DutyNodeConfig {

    String nodeId;
    int httpPort;
    String chainPreset;
    int devnetValidators;
    int devnetGenesisEpochsAgo;
    /**
     * 0 disables reorg injection.
     */
    int devnetReorgEveryEpochs;
    long committeeCacheSize;
    int perConnBufferSize;
    boolean useVirtualThreads;

    public static DutyNodeConfig fromEnv() {
        return DutyNodeConfig.builder()
                .nodeId(getEnv("NODE_ID", "duty-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .chainPreset(getEnv("CHAIN_PRESET", "minimal"))
                .devnetValidators(Integer.parseInt(getEnv("DEVNET_VALIDATORS", "256")))
                .devnetGenesisEpochsAgo(Integer.parseInt(getEnv("DEVNET_GENESIS_EPOCHS_AGO", "8")))
                .devnetReorgEveryEpochs(Integer.parseInt(getEnv("DEVNET_REORG_EVERY_EPOCHS", "5")))
                .committeeCacheSize(Long.parseLong(getEnv("COMMITTEE_CACHE_SIZE", "64")))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .useVirtualThreads(Boolean.parseBoolean(getEnv("USE_VIRTUAL_THREADS", "false")))
                .build();
    }

    public ChainConfig chainConfig() {
        return ChainConfig.preset(chainPreset);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
