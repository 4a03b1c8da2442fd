package com.qqsuccubus.beacon.node.devnet;

import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.hash.Hashers;
import com.qqsuccubus.beacon.core.model.BeaconStateSnapshot;
import com.qqsuccubus.beacon.core.model.Bytes32;
import com.qqsuccubus.beacon.core.model.ValidatorRecord;
import com.qqsuccubus.beacon.core.msg.ChainEvents;
import com.qqsuccubus.beacon.core.state.GenesisStateFactory;
import com.qqsuccubus.beacon.core.state.InMemoryChainEventFeed;
import com.qqsuccubus.beacon.core.state.InMemoryStateProvider;
import com.qqsuccubus.beacon.core.time.Epochs;
import com.qqsuccubus.beacon.core.time.SlotClock;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local chain driving the in-memory state provider and event feed.
 * <p>
 * The registry is fixed at genesis: most validators active, one sixteenth waiting for activation
 * and one sixteenth exiting. Every new epoch registers a head state with the finalized checkpoint
 * two epochs back and publishes the boundary. Every {@code devnetReorgEveryEpochs} epochs the head
 * moves to a new branch (fresh randao mixes) and a reorg event is published.
 * </p>
 */
public class DevnetChain {
    private static final Logger log = LoggerFactory.getLogger(DevnetChain.class);

    private static final Duration TICK = Duration.ofSeconds(1);

    private final DutyNodeConfig nodeConfig;
    private final ChainConfig config;
    private final SlotClock clock;
    private final InMemoryStateProvider stateProvider;
    private final InMemoryChainEventFeed eventFeed;

    private final AtomicLong lastEpoch = new AtomicLong(-1);
    private final AtomicLong generation = new AtomicLong();
    private volatile BeaconStateSnapshot head;

    public DevnetChain(DutyNodeConfig nodeConfig,
                       ChainConfig config,
                       SlotClock clock,
                       InMemoryStateProvider stateProvider,
                       InMemoryChainEventFeed eventFeed) {
        this.nodeConfig = nodeConfig;
        this.config = config;
        this.clock = clock;
        this.stateProvider = stateProvider;
        this.eventFeed = eventFeed;
    }

    /**
     * Registers genesis and the state of the current epoch without publishing events.
     */
    public void initialize() {
        head = genesisState();
        stateProvider.putState(head);
        long epoch = clock.currentEpoch();
        if (epoch > Epochs.GENESIS_EPOCH) {
            advanceTo(epoch);
        }
        lastEpoch.set(epoch);
        log.info("Devnet initialized: {} validators, genesis {}, current epoch {}",
                head.validatorCount(), clock.getGenesisTime(), epoch);
    }

    /**
     * Starts ticking; dispose the result to stop.
     */
    public Disposable start() {
        return Flux.interval(TICK)
                .map(tick -> clock.currentEpoch())
                .filter(epoch -> epoch > lastEpoch.get())
                .subscribe(this::onNewEpoch, err -> log.error("Devnet ticker failed", err));
    }

    void onNewEpoch(long epoch) {
        lastEpoch.set(epoch);
        long slot = Epochs.startSlot(epoch, config);
        advanceTo(epoch);
        eventFeed.publishEpochBoundary(slot);
        log.debug("Epoch {} started at slot {}", epoch, slot);

        int every = nodeConfig.getDevnetReorgEveryEpochs();
        if (every > 0 && epoch % every == 0) {
            injectReorg(epoch, slot);
        }
    }

    private void advanceTo(long epoch) {
        head = head.toBuilder()
                .slot(Epochs.startSlot(epoch, config))
                .version(config.forkAt(epoch))
                .finalizedCheckpointEpoch(Math.max(Epochs.GENESIS_EPOCH, epoch - 2))
                .build();
        stateProvider.putState(head);
    }

    private void injectReorg(long epoch, long slot) {
        long branch = generation.incrementAndGet();
        Bytes32 oldRoot = head.getStateRoot();
        head = head.toBuilder()
                .stateRoot(Bytes32.wrap(Hashers.sha256(
                        "devnet".getBytes(StandardCharsets.UTF_8), Hashers.uint64(branch), Hashers.uint64(epoch))))
                .randaoMixes(GenesisStateFactory.randaoMixes(config, branch))
                .build();
        stateProvider.putState(head);

        log.info("Injecting reorg at epoch {} (branch {})", epoch, branch);
        eventFeed.publishReorg(ChainEvents.Reorg.builder()
                .epoch(epoch)
                .slot(slot)
                .depth(1)
                .oldHeadRoot(oldRoot)
                .newHeadRoot(head.getStateRoot())
                .build());
    }

    private BeaconStateSnapshot genesisState() {
        int count = nodeConfig.getDevnetValidators();
        int slice = Math.max(1, count / 16);
        BeaconStateSnapshot genesis = GenesisStateFactory.create(config, clock.getGenesisTime(), count);

        List<ValidatorRecord> validators = new ArrayList<>(genesis.getValidators());
        for (int i = count - slice; i < count; i++) {
            // deposited after genesis, waiting in the activation queue
            validators.set(i, validators.get(i).toBuilder()
                    .activationEligibilityEpoch(1 + (i % 4))
                    .activationEpoch(Epochs.FAR_FUTURE_EPOCH)
                    .build());
        }
        int exitEpochBase = nodeConfig.getDevnetGenesisEpochsAgo() + 2;
        for (int i = Math.max(0, count - 2 * slice); i < count - slice; i++) {
            long exitEpoch = exitEpochBase + (i % 3);
            validators.set(i, validators.get(i).toBuilder()
                    .exitEpoch(exitEpoch)
                    .withdrawableEpoch(exitEpoch + config.getMinValidatorWithdrawabilityDelay())
                    .build());
        }
        return genesis.toBuilder().validators(validators).build();
    }
}
