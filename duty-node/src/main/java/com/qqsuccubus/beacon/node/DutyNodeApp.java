package com.qqsuccubus.beacon.node;

import com.qqsuccubus.beacon.assignment.churn.ChurnQueueSimulator;
import com.qqsuccubus.beacon.assignment.committee.CommitteeAssignmentEngine;
import com.qqsuccubus.beacon.assignment.info.ValidatorInfoGenerator;
import com.qqsuccubus.beacon.assignment.lifecycle.ValidatorLifecycleClassifier;
import com.qqsuccubus.beacon.assignment.proposer.ProposerDutyComputer;
import com.qqsuccubus.beacon.assignment.service.AssignmentService;
import com.qqsuccubus.beacon.assignment.snapshot.DutySnapshotAssembler;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.shuffle.SwapOrNotShuffler;
import com.qqsuccubus.beacon.core.state.InMemoryChainEventFeed;
import com.qqsuccubus.beacon.core.state.InMemoryStateProvider;
import com.qqsuccubus.beacon.core.time.SlotClock;
import com.qqsuccubus.beacon.node.config.DutyNodeConfig;
import com.qqsuccubus.beacon.node.devnet.DevnetChain;
import com.qqsuccubus.beacon.node.http.DutyApiHandler;
import com.qqsuccubus.beacon.node.http.HttpServer;
import com.qqsuccubus.beacon.node.metrics.MetricsService;
import com.qqsuccubus.beacon.node.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.beacon.node.session.ServiceContext;
import com.qqsuccubus.beacon.node.session.StreamSessionManager;
import com.qqsuccubus.beacon.node.stream.DutyStreamCoordinator;
import com.qqsuccubus.beacon.node.stream.ValidatorInfoStream;
import com.qqsuccubus.beacon.node.ws.DutyWebSocketHandler;
import com.qqsuccubus.beacon.node.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.time.Instant;

/**
 * Main entry point for the duty node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Run a development chain feeding the in-memory state provider and event feed</li>
 *   <li>Serve duty queries at /v1/*</li>
 *   <li>Stream duties at /ws/duties (query: startEpoch, sessionId)</li>
 *   <li>Stream validator info at /ws/validators</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class DutyNodeApp {
    private static final Logger log = LoggerFactory.getLogger(DutyNodeApp.class);

    public static void main(String[] args) {
        DutyNodeConfig config = DutyNodeConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        if (config.isUseVirtualThreads()) {
            System.setProperty("reactor.schedulers.defaultBoundedElasticOnVirtualThreads", "true");
            log.info("reactor.schedulers.defaultBoundedElasticOnVirtualThreads = true");
        }

        ChainConfig chain = config.chainConfig();
        long genesisTime = Instant.now().getEpochSecond()
            - (long) config.getDevnetGenesisEpochsAgo() * chain.getSlotsPerEpoch() * chain.getSecondsPerSlot();

        log.info("Starting duty node: {}", config.getNodeId());
        log.info("  Preset: {} ({} slots/epoch, {}s slots)", config.getChainPreset(),
            chain.getSlotsPerEpoch(), chain.getSecondsPerSlot());
        log.info("  Devnet: {} validators, genesis {}", config.getDevnetValidators(), genesisTime);

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config);
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        // Chain ports
        SlotClock clock = new SlotClock(genesisTime, chain);
        InMemoryStateProvider stateProvider = new InMemoryStateProvider(chain, clock);
        InMemoryChainEventFeed eventFeed = new InMemoryChainEventFeed();
        DevnetChain devnet = new DevnetChain(config, chain, clock, stateProvider, eventFeed);
        devnet.initialize();

        // Duty computation
        SwapOrNotShuffler shuffler = new SwapOrNotShuffler(chain);
        CommitteeAssignmentEngine committeeEngine = new CommitteeAssignmentEngine(
            chain, shuffler, metricsExporter.getRegistry(), config.getCommitteeCacheSize()
        );
        ProposerDutyComputer proposerComputer = new ProposerDutyComputer(chain, shuffler);
        ValidatorLifecycleClassifier classifier = new ValidatorLifecycleClassifier(chain);
        ChurnQueueSimulator churnSimulator = new ChurnQueueSimulator(chain, classifier);
        ValidatorInfoGenerator infoGenerator = new ValidatorInfoGenerator(chain, classifier, churnSimulator);
        AssignmentService assignmentService = new AssignmentService(
            chain, clock, stateProvider, committeeEngine, proposerComputer, churnSimulator, infoGenerator
        );

        // Streams
        ServiceContext serviceContext = new ServiceContext();
        StreamSessionManager sessionManager = new StreamSessionManager(metricsService);
        DutyStreamCoordinator coordinator = new DutyStreamCoordinator(
            chain, clock, stateProvider, eventFeed,
            new DutySnapshotAssembler(chain, stateProvider, proposerComputer, committeeEngine),
            serviceContext, metricsService
        );
        ValidatorInfoStream validatorInfoStream = new ValidatorInfoStream(
            chain, stateProvider, eventFeed, infoGenerator, serviceContext, metricsService
        );

        // Start HTTP + WebSocket server
        DutyWebSocketHandler wsHandler = new DutyWebSocketHandler(
            config, coordinator, validatorInfoStream, sessionManager, metricsService
        );
        HttpServer httpServer = new HttpServer(
            config,
            new DutyApiHandler(assignmentService),
            new WebSocketUpgradeHandler(wsHandler, serviceContext),
            serviceContext,
            metricsExporter
        );
        httpServer.start();

        Disposable ticker = devnet.start();

        log.info("Duty node {} is ready", config.getNodeId());

        handleShutdown(config, serviceContext, sessionManager, httpServer, eventFeed, ticker, metricsExporter);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(DutyNodeConfig config,
                                       ServiceContext serviceContext,
                                       StreamSessionManager sessionManager,
                                       HttpServer httpServer,
                                       InMemoryChainEventFeed eventFeed,
                                       Disposable ticker,
                                       PrometheusMetricsExporter metricsExporter) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, closing {} open streams...", sessionManager.activeCount());

            // Streams end with "Service context canceled" before the feed completes
            serviceContext.shutdown();
            ticker.dispose();
            eventFeed.close();

            httpServer.stop();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
