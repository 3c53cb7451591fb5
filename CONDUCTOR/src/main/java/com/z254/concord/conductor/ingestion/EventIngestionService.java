package com.z254.concord.conductor.ingestion;

import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.exception.PersistenceException;
import com.z254.concord.conductor.ingestion.handler.EventHandler;
import com.z254.concord.conductor.ingestion.ledger.ProcessedEventLedger;
import com.z254.concord.conductor.network.EventNetwork;
import com.z254.concord.conductor.network.EventSigner;
import com.z254.concord.conductor.network.NetworkEvent;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Feeds network events to their handlers, each distinct event id exactly once.
 *
 * <p>On start the processed-event ledger is loaded in full, then the subscription opens.
 * Events are handled one at a time in delivery order and confirmed to the network once
 * handled. An event whose id is already in the ledger is dropped before classification; a
 * handler failure is logged and the event stays processed. On stop the service refuses new
 * events, flushes the ledger and closes the subscription. Claiming an id and the final flush
 * are serialized, so no id claimed before stop is left out of the ledger.
 *
 * <p>A subscription that terminates on its own leaves the service not accepting, with the
 * cause reported by {@link #subscriptionFailure()}.
 */
@Service
@Slf4j
public class EventIngestionService implements SmartLifecycle {

    private final EventNetwork network;
    private final EventSigner signer;
    private final ProcessedEventLedger ledger;
    private final EventClassifier classifier;
    private final SubscriptionFilterFactory filterFactory;
    private final StructuredLogger structuredLogger;
    private final ConductorProperties.IngestionProperties config;
    private final Map<EventCategory, EventHandler> handlers = new EnumMap<>(EventCategory.class);
    private final Map<IngestionOutcome, Counter> outcomeCounters = new EnumMap<>(IngestionOutcome.class);

    private final Object claimLock = new Object();

    private volatile boolean accepting;
    private volatile boolean running;
    private volatile Disposable subscription;
    private volatile String subscriptionFailure;

    public EventIngestionService(
            EventNetwork network,
            EventSigner signer,
            ProcessedEventLedger ledger,
            EventClassifier classifier,
            SubscriptionFilterFactory filterFactory,
            List<EventHandler> eventHandlers,
            StructuredLogger structuredLogger,
            ConductorProperties properties,
            MeterRegistry meterRegistry) {
        this.network = network;
        this.signer = signer;
        this.ledger = ledger;
        this.classifier = classifier;
        this.filterFactory = filterFactory;
        this.structuredLogger = structuredLogger;
        this.config = properties.getIngestion();
        for (EventHandler handler : eventHandlers) {
            EventHandler previous = handlers.putIfAbsent(handler.category(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.category() + ": "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        for (IngestionOutcome outcome : IngestionOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("concord.ingestion.events")
                    .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        Integer loaded = ledger.load().block();
        subscriptionFailure = null;
        synchronized (claimLock) {
            accepting = true;
        }
        subscription = network.subscribe(filterFactory.filters(), config.getSubscriptionLabel())
                .concatMap(event -> ingest(event).doOnNext(outcome -> {
                    if (outcome != IngestionOutcome.NOT_ACCEPTING) {
                        network.confirm(event);
                    }
                }))
                .subscribe(
                        outcome -> { },
                        error -> subscriptionTerminated(error.toString(), error),
                        () -> subscriptionTerminated("subscription completed", null));
        running = true;
        log.info("Event ingestion started on {} transport ({} processed ids known)", network.transport(), loaded);
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        synchronized (claimLock) {
            accepting = false;
        }
        try {
            Integer flushed = ledger.flush().block(config.getShutdownFlushTimeout());
            log.info("Flushed {} ledger entries on shutdown", flushed);
        } catch (PersistenceException e) {
            log.error("Ledger flush on shutdown failed, {} ids not persisted", ledger.pendingCount(), e);
        } catch (IllegalStateException e) {
            log.error("Ledger flush on shutdown timed out after {}", config.getShutdownFlushTimeout(), e);
        }
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
        running = false;
        log.info("Event ingestion stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return config.isAutoStart();
    }

    /**
     * Offer one event.
     */
    public Mono<IngestionOutcome> ingest(NetworkEvent event) {
        return Mono.defer(() -> {
                    if (!accepting) {
                        return Mono.just(IngestionOutcome.NOT_ACCEPTING);
                    }
                    if (config.isVerifySignatures() && !signer.verify(event)) {
                        log.warn("Rejected event {} from {}: id or signature does not verify",
                                event.getId(), event.getPubkey());
                        return Mono.just(IngestionOutcome.REJECTED);
                    }
                    boolean claimed;
                    synchronized (claimLock) {
                        if (!accepting) {
                            return Mono.just(IngestionOutcome.NOT_ACCEPTING);
                        }
                        claimed = ledger.tryAccept(event.getId());
                    }
                    if (!claimed) {
                        log.debug("Dropped duplicate event {}", event.getId());
                        return Mono.just(IngestionOutcome.DUPLICATE);
                    }
                    EventCategory category = classifier.classify(event);
                    EventHandler handler = handlers.get(category);
                    if (handler == null) {
                        log.debug("Event {} kind {} classified {}, not dispatched", event.getId(), event.getKind(), category);
                        return Mono.just(IngestionOutcome.IGNORED);
                    }
                    return dispatch(handler, event);
                })
                .doOnNext(outcome -> outcomeCounters.get(outcome).increment());
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Why the subscription ended while the service was running, if it did.
     */
    public Optional<String> subscriptionFailure() {
        return Optional.ofNullable(subscriptionFailure);
    }

    private void subscriptionTerminated(String cause, Throwable error) {
        synchronized (claimLock) {
            accepting = false;
        }
        subscriptionFailure = cause;
        log.error("Ingestion subscription {} terminated: {}", config.getSubscriptionLabel(), cause, error);
    }

    private Mono<IngestionOutcome> dispatch(EventHandler handler, NetworkEvent event) {
        return Mono.defer(() -> {
                    structuredLogger.setEventContext(event.getId());
                    return handler.handle(event);
                })
                .thenReturn(IngestionOutcome.DISPATCHED)
                .onErrorResume(e -> {
                    log.error("Handler {} failed on event {}; event stays processed",
                            handler.getClass().getSimpleName(), event.getId(), e);
                    return Mono.just(IngestionOutcome.FAILED);
                })
                .doFinally(signal -> structuredLogger.clearContext());
    }
}
