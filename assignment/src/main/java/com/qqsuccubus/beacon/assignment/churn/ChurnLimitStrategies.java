package com.qqsuccubus.beacon.assignment.churn;

import com.qqsuccubus.beacon.core.model.ForkVersion;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Version to churn strategy table. Every churn calculation goes through {@link #forVersion}.
 */
public final class ChurnLimitStrategies {
    private ChurnLimitStrategies() {
    }

    private static final Map<ForkVersion, ChurnLimitStrategy> STRATEGIES;

    static {
        Map<ForkVersion, ChurnLimitStrategy> table = new EnumMap<>(ForkVersion.class);
        ChurnLimitStrategy phase0 = new Phase0ChurnLimitStrategy();
        table.put(ForkVersion.PHASE0, phase0);
        table.put(ForkVersion.ALTAIR, phase0);
        table.put(ForkVersion.BELLATRIX, phase0);
        table.put(ForkVersion.CAPELLA, phase0);
        table.put(ForkVersion.DENEB, new DenebChurnLimitStrategy());
        STRATEGIES = Collections.unmodifiableMap(table);
    }

    public static ChurnLimitStrategy forVersion(ForkVersion version) {
        ChurnLimitStrategy strategy = STRATEGIES.get(version);
        if (strategy == null) {
            throw new IllegalArgumentException("No churn strategy for " + version);
        }
        return strategy;
    }
}
