package com.qqsuccubus.beacon.assignment.churn;

import com.qqsuccubus.beacon.assignment.lifecycle.ValidatorLifecycleClassifier;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.ForkVersion;
import com.qqsuccubus.beacon.core.model.ValidatorQueue;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.state.GenesisStateFactory;
import com.qqsuccubus.beacon.core.time.Epochs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChurnQueueSimulatorTest {

    private static final long FAR = Epochs.FAR_FUTURE_EPOCH;

    private final ChainConfig config = ChainConfig.mainnet();
    private final ChurnQueueSimulator simulator =
            new ChurnQueueSimulator(config, new ValidatorLifecycleClassifier(config));

    // ========== Activation Queue Tests ==========

    @Test
    @DisplayName("Activation queue is ordered by eligibility epoch, ties broken by index")
    void testActivationQueueOrdering() {
        List<ValidatorRecord> validators = new ArrayList<>();
        validators.add(validator(0, 0, 0, FAR, FAR));     // active long ago
        validators.add(validator(1, 12, FAR, FAR, FAR));
        validators.add(validator(2, 11, FAR, FAR, FAR));
        validators.add(validator(3, 11, FAR, FAR, FAR));
        validators.add(validator(4, 8, 14, FAR, FAR));    // fixed before the finalized floor
        validators.add(validator(5, 9, 16, FAR, FAR));
        validators.add(validator(6, FAR, FAR, FAR, FAR)); // never eligible

        ValidatorQueue queue = simulator.computeQueues(state(validators, 10, ForkVersion.PHASE0), 12, 1);

        assertEquals(List.of(5L, 2L, 3L, 1L), queue.getActivationValidatorIndices());
        assertEquals(validators.get(5).getPubkey(), queue.getActivationPublicKeys().get(0));
        assertEquals(validators.get(1).getPubkey(), queue.getActivationPublicKeys().get(3));
        assertEquals(4, queue.getChurnLimit());
        assertEquals(4, queue.getExitChurnLimit());
    }

    @Test
    void testDenebChurnLimits() {
        BeaconStateSnapshot state = state(List.of(validator(0, 0, 0, FAR, FAR)), 0, ForkVersion.DENEB);

        ValidatorQueue queue = simulator.computeQueues(state, 1, 1_000_000);

        assertEquals(8, queue.getChurnLimit());
        assertEquals(15, queue.getExitChurnLimit());
    }

    // ========== Exit Queue Tests ==========

    @Test
    @DisplayName("Exit queue excludes withdrawable-horizon and already exited validators")
    void testExitQueueHorizon() {
        List<ValidatorRecord> validators = exitingRegistry();

        ValidatorQueue queue = simulator.computeQueues(state(validators, 0, ForkVersion.PHASE0), 5, 100);

        assertEquals(List.of(4L), queue.getExitValidatorIndices());
        assertEquals(List.of(validators.get(4).getPubkey()), queue.getExitPublicKeys());
        assertTrue(queue.getActivationValidatorIndices().isEmpty());
    }

    @Test
    @DisplayName("A full exit queue epoch moves the horizon one epoch out")
    void testExitQueueEpochBump() {
        List<ValidatorRecord> validators = exitingRegistry();
        validators.add(validator(6, 0, 0, 10, 266));

        ValidatorQueue queue = simulator.computeQueues(state(validators, 0, ForkVersion.PHASE0), 5, 100);

        assertEquals(List.of(4L, 1L, 2L, 3L, 6L), queue.getExitValidatorIndices());
    }

    // ========== Projection Tests ==========

    @Test
    @DisplayName("Target behind ten earlier candidates at churn 4 activates three epochs later plus lookahead")
    void testProjectionExample() {
        ChainConfig noLookahead = config.toBuilder().maxSeedLookahead(0).build();
        ChurnQueueSimulator sim = new ChurnQueueSimulator(noLookahead, new ValidatorLifecycleClassifier(noLookahead));

        List<ValidatorRecord> validators = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            validators.add(validator(i, 0, 0, FAR, FAR));
        }
        for (int i = 20; i < 30; i++) {
            validators.add(validator(i, 5, FAR, FAR, FAR));
        }
        validators.add(validator(30, 6, FAR, FAR, FAR));

        Map<Long, Long> projected = sim.projectActivations(state(validators, 0, ForkVersion.PHASE0), 10, Set.of(30L));

        assertEquals(Map.of(30L, 14L), projected);
    }

    @Test
    void testProjectionRespectsChurnPerEpoch() {
        List<ValidatorRecord> validators = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            validators.add(validator(i, 1, FAR, FAR, FAR));
        }
        Set<Long> targets = LongStream.range(0, 12).boxed().collect(Collectors.toSet());

        Map<Long, Long> projected = simulator.projectActivations(state(validators, 0, ForkVersion.PHASE0), 2, targets);

        assertEquals(12, projected.size());
        Map<Long, Long> perEpoch = new HashMap<>();
        projected.values().forEach(epoch -> perEpoch.merge(epoch, 1L, Long::sum));
        perEpoch.values().forEach(count -> assertTrue(count <= 4));
        // simulated epochs 3, 4, 5 plus activation delay
        assertEquals(Set.of(8L, 9L, 10L), perEpoch.keySet());
        assertEquals(8L, projected.get(0L));
        assertEquals(10L, projected.get(11L));
    }

    @Test
    void testProjectionTerminatesWithoutCandidates() {
        List<ValidatorRecord> validators = List.of(validator(0, 0, 0, FAR, FAR), validator(1, 0, 0, FAR, FAR));

        Map<Long, Long> projected = simulator.projectActivations(state(validators, 0, ForkVersion.PHASE0), 3, Set.of(0L, 7L));

        assertTrue(projected.isEmpty());
    }

    private List<ValidatorRecord> exitingRegistry() {
        List<ValidatorRecord> validators = new ArrayList<>();
        validators.add(validator(0, 0, 0, FAR, FAR));
        validators.add(validator(1, 0, 0, 10, 266));
        validators.add(validator(2, 0, 0, 10, 266));
        validators.add(validator(3, 0, 0, 10, 266));
        validators.add(validator(4, 0, 0, 8, 264));
        validators.add(validator(5, 0, 0, 3, 259));   // exited by epoch 5
        return validators;
    }

    private ValidatorRecord validator(int index, long eligibility, long activation, long exit, long withdrawable) {
        return GenesisStateFactory.activeValidator(config, index).toBuilder()
                .activationEligibilityEpoch(eligibility)
                .activationEpoch(activation)
                .exitEpoch(exit)
                .withdrawableEpoch(withdrawable)
                .build();
    }

    private BeaconStateSnapshot state(List<ValidatorRecord> validators, long finalized, ForkVersion version) {
        return BeaconStateSnapshot.builder()
                .slot(0)
                .genesisTime(0)
                .version(version)
                .validators(validators)
                .finalizedCheckpointEpoch(finalized)
                .build();
    }
}
