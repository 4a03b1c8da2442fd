package com.qqsuccubus.beacon.core.state;

import com.qqsuccubus.beacon.core.msg.ChainEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryChainEventFeedTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryChainEventFeed feed;

    @BeforeEach
    void setUp() {
        feed = new InMemoryChainEventFeed();
    }

    // ========== Publish Tests ==========

    @Test
    void testSubscriberReceivesBoundariesInOrder() {
        StepVerifier.create(feed.epochBoundaries())
                .then(() -> {
                    feed.publishEpochBoundary(8);
                    feed.publishEpochBoundary(16);
                })
                .expectNext(new ChainEvents.EpochBoundary(8), new ChainEvents.EpochBoundary(16))
                .then(feed::close)
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void testReorgsAndBoundariesAreSeparate() {
        ChainEvents.Reorg reorg = ChainEvents.Reorg.builder().epoch(3).slot(26).depth(1).build();

        StepVerifier.create(feed.reorgs())
                .then(() -> {
                    feed.publishEpochBoundary(24);
                    feed.publishReorg(reorg);
                })
                .expectNext(reorg)
                .then(feed::close)
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    @DisplayName("Events published with no subscriber are dropped, not buffered")
    void testPublishWithoutSubscribersIsDropped() {
        assertDoesNotThrow(() -> feed.publishEpochBoundary(8));

        StepVerifier.create(feed.epochBoundaries())
                .then(() -> feed.publishEpochBoundary(16))
                .expectNext(new ChainEvents.EpochBoundary(16))
                .then(feed::close)
                .expectComplete()
                .verify(TIMEOUT);
    }

    // ========== Close Tests ==========

    @Test
    void testCloseCompletesActiveSubscribers() {
        StepVerifier.create(feed.epochBoundaries().mergeWith(feed.reorgs().cast(ChainEvents.EpochBoundary.class)))
                .then(feed::close)
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    @DisplayName("After close, publishing is a no-op and late subscribers complete immediately")
    void testPublishAfterClose() {
        feed.close();

        assertDoesNotThrow(() -> feed.publishEpochBoundary(8));
        assertDoesNotThrow(() -> feed.publishReorg(ChainEvents.Reorg.builder().epoch(1).build()));

        StepVerifier.create(feed.epochBoundaries()).expectComplete().verify(TIMEOUT);
        StepVerifier.create(feed.reorgs()).expectComplete().verify(TIMEOUT);
    }
}
