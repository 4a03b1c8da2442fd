package com.qqsuccubus.beacon.node.session;

import com.qqsuccubus.beacon.core.metrics.MetricsNames;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import com.qqsuccubus.beacon.node.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class StreamSessionManagerTest {

    private SimpleMeterRegistry registry;
    private StreamSessionManager manager;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MetricsService metricsService = new MetricsService(registry, DutyNodeConfig.builder().nodeId("test-node").build());
        manager = new StreamSessionManager(metricsService,
                Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    }

    @Test
    void testOpenAndCloseTrackGauge() {
        StreamSession session = manager.open("s-1", StreamType.DUTIES);
        manager.open("s-2", StreamType.VALIDATORS);

        assertEquals(Instant.ofEpochSecond(1_700_000_000L), session.getOpenedAt());
        assertEquals(2.0, registry.get(MetricsNames.STREAMS_ACTIVE).gauge().value());

        manager.close(session);
        manager.close(session);

        assertEquals(1, manager.activeCount());
        assertEquals(StreamType.VALIDATORS, manager.activeSessions().iterator().next().getType());
        assertEquals(1.0, registry.get(MetricsNames.STREAMS_ACTIVE).gauge().value());
    }

    @Test
    void testSharedSessionIdClosesOnlyItsOwnConnection() {
        StreamSession first = manager.open("dup", StreamType.DUTIES);
        StreamSession second = manager.open("dup", StreamType.DUTIES);

        assertNotEquals(first.getConnectionId(), second.getConnectionId());
        assertEquals(2, manager.activeCount());

        manager.close(first);

        assertEquals(1, manager.activeCount());
        assertSame(second, manager.activeSessions().iterator().next());

        manager.close(second);

        assertEquals(0, manager.activeCount());
    }

    @Test
    void testServiceContextReplaysShutdown() {
        ServiceContext context = new ServiceContext();
        assertFalse(context.isShuttingDown());

        context.shutdown();
        context.shutdown();

        assertTrue(context.isShuttingDown());
        StepVerifier.create(context.onShutdown()).expectComplete().verify(Duration.ofSeconds(1));
    }
}
