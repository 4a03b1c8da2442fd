package com.qqsuccubus.beacon.core.state;

import com.qqsuccubus.beacon.core.msg.ChainEvents;
import reactor.core.publisher.Flux;

/**
 * Live chain notifications (Dependency Inversion Principle).
 * <p>
 * Both fluxes are hot; completion means the feed itself shut down.
 * </p>
 */
public interface IChainEventFeed {

    Flux<ChainEvents.EpochBoundary> epochBoundaries();

    Flux<ChainEvents.Reorg> reorgs();
}
