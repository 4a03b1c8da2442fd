package com.qqsuccubus.beacon.node.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Node-wide lifetime. Streams end with "Service context canceled" once {@link #shutdown()} runs,
 * including streams opened afterwards.
 */
public class ServiceContext {
    private static final Logger log = LoggerFactory.getLogger(ServiceContext.class);

    private final Sinks.Empty<Void> shutdownSink = Sinks.empty();
    private volatile boolean shuttingDown;

    public Mono<Void> onShutdown() {
        return shutdownSink.asMono();
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    public void shutdown() {
        shuttingDown = true;
        Sinks.EmitResult result = shutdownSink.tryEmitEmpty();
        if (result.isSuccess()) {
            log.info("Service context canceled, closing open streams");
        }
    }
}
