package com.qqsuccubus.beacon.core.state;

import com.qqsuccubus.beacon.core.msg.ChainEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Event feed backed by multicast sinks. Events published while nobody listens are dropped.
 */
public class InMemoryChainEventFeed implements IChainEventFeed {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChainEventFeed.class);

    private final Sinks.Many<ChainEvents.EpochBoundary> epochSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<ChainEvents.Reorg> reorgSink = Sinks.many().multicast().directBestEffort();

    @Override
    public Flux<ChainEvents.EpochBoundary> epochBoundaries() {
        return epochSink.asFlux();
    }

    @Override
    public Flux<ChainEvents.Reorg> reorgs() {
        return reorgSink.asFlux();
    }

    public synchronized void publishEpochBoundary(long slot) {
        Sinks.EmitResult result = epochSink.tryEmitNext(new ChainEvents.EpochBoundary(slot));
        logIfFailed("epoch boundary", result);
    }

    public synchronized void publishReorg(ChainEvents.Reorg reorg) {
        Sinks.EmitResult result = reorgSink.tryEmitNext(reorg);
        logIfFailed("reorg", result);
    }

    /**
     * Completes both fluxes; subscribers see the feed as closed.
     */
    public synchronized void close() {
        epochSink.tryEmitComplete();
        reorgSink.tryEmitComplete();
        log.info("Chain event feed closed");
    }

    private void logIfFailed(String type, Sinks.EmitResult result) {
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to publish {} event: {}", type, result);
        }
    }
}
