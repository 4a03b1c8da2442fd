package com.qqsuccubus.beacon.node.stream;

import com.qqsuccubus.beacon.assignment.info.ValidatorInfoGenerator;
import com.qqsuccubus.beacon.core.config.ChainConfig;
import com.qqsuccubus.beacon.core.error.DutyException;
import com.qqsuccubus.beacon.core.model.BlsPublicKey;
import com.qqsuccubus.beacon.core.model.ValidatorChangeSet;
import com.qqsuccubus.beacon.core.model.ValidatorInfo;
import com.qqsuccubus.beacon.core.state.IChainEventFeed;
import com.qqsuccubus.beacon.core.state.IStateProvider;
import com.qqsuccubus.beacon.core.time.Epochs;
import com.qqsuccubus.beacon.node.metrics.MetricsService;
import com.qqsuccubus.beacon.node.session.ServiceContext;
import com.qqsuccubus.beacon.node.session.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams status records for a client-managed set of validator keys.
 * <p>
 * Reports go out when keys are added (the new keys only), when the set is replaced (every key) and
 * on each new epoch (every key). Removing keys reports nothing.
 * </p>
 */
public class ValidatorInfoStream {
    private static final Logger log = LoggerFactory.getLogger(ValidatorInfoStream.class);

    private final ChainConfig config;
    private final IStateProvider stateProvider;
    private final IChainEventFeed eventFeed;
    private final ValidatorInfoGenerator generator;
    private final ServiceContext serviceContext;
    private final MetricsService metricsService;

    public ValidatorInfoStream(ChainConfig config,
                               IStateProvider stateProvider,
                               IChainEventFeed eventFeed,
                               ValidatorInfoGenerator generator,
                               ServiceContext serviceContext,
                               MetricsService metricsService) {
        this.config = config;
        this.stateProvider = stateProvider;
        this.eventFeed = eventFeed;
        this.generator = generator;
        this.serviceContext = serviceContext;
        this.metricsService = metricsService;
    }

    /**
     * @param changes          Change requests from the client; completion ends the stream
     * @param connectionClosed Completes when the client connection goes away
     */
    public Flux<ValidatorInfo> streamValidatorInfo(Flux<ValidatorChangeSet> changes, Mono<Void> connectionClosed) {
        return Flux.defer(() -> {
            SubscriptionState subscription = new SubscriptionState();
            AtomicReference<String> closeReason = new AtomicReference<>("complete");

            Flux<ValidatorInfo> onChange = changes
                    .concatMap(change -> report(apply(subscription, change)))
                    .concatWith(Mono.error(() -> DutyException.canceled("Stream context canceled")));

            Flux<ValidatorInfo> onEpoch = eventFeed.epochBoundaries()
                    .map(boundary -> Epochs.toEpoch(boundary.getSlot(), config))
                    .distinctUntilChanged()
                    .concatMap(epoch -> {
                        log.debug("New epoch {}, reporting {} watched validators", epoch, subscription.size());
                        return report(subscription.snapshot());
                    })
                    .concatWith(Mono.error(() -> DutyException.aborted("Subscriber closed")));

            return Flux.merge(
                            onChange,
                            onEpoch,
                            connectionClosed.then(Mono.<ValidatorInfo>error(
                                    () -> DutyException.canceled("Stream context canceled"))),
                            serviceContext.onShutdown().then(Mono.<ValidatorInfo>error(
                                    () -> DutyException.canceled("Service context canceled"))))
                    .doOnError(err -> closeReason.set(DutyStreamCoordinator.reasonOf(err)))
                    .doFinally(signal -> {
                        String reason = signal == SignalType.CANCEL ? "cancel" : closeReason.get();
                        metricsService.recordStreamClosed(StreamType.VALIDATORS, reason);
                        log.debug("Validator info stream closed with {} keys ({})", subscription.size(), reason);
                    });
        });
    }

    private List<BlsPublicKey> apply(SubscriptionState subscription, ValidatorChangeSet change) {
        if (change.getAction() == null) {
            log.warn("Ignoring change set without action ({} keys)", change.getPublicKeys().size());
            return List.of();
        }
        return switch (change.getAction()) {
            case ADD -> subscription.add(change.getPublicKeys());
            case REMOVE -> {
                subscription.remove(change.getPublicKeys());
                yield List.of();
            }
            case SET -> {
                subscription.set(change.getPublicKeys());
                yield subscription.snapshot();
            }
        };
    }

    private Flux<ValidatorInfo> report(List<BlsPublicKey> keys) {
        if (keys.isEmpty()) {
            return Flux.empty();
        }
        return Mono.fromCallable(() -> generator.generate(keys, stateProvider.headState()))
                .doOnNext(infos -> metricsService.recordValidatorInfo(infos.size()))
                .flatMapIterable(infos -> infos)
                .onErrorResume(err -> {
                    if (err instanceof DutyException duty && duty.isSkippable()) {
                        log.warn("Skipping validator info report for {} keys: {}", keys.size(), duty.getMessage());
                        metricsService.recordEpochSkipped(duty.getKind());
                        return Flux.empty();
                    }
                    log.error("Validator info computation failed, closing stream", err);
                    return Flux.error(DutyException.canceled("Could not compute validator info", err));
                });
    }
}
