package com.z254.concord.conductor.ingestion.ledger;

import com.z254.concord.conductor.exception.PersistenceException;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Set of event ids that have been handled, surviving restarts.
 *
 * <p>The whole ledger is loaded into memory before ingestion starts. {@link #tryAccept} claims
 * an id atomically; newly claimed ids are buffered and appended to the day's segment by the
 * periodic {@link #flush}. Ids that fail to flush stay buffered for the next cycle.
 */
@Component
@Slf4j
public class ProcessedEventLedger {

    private final LedgerStore store;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final Set<String> processed = ConcurrentHashMap.newKeySet();
    private final Queue<LedgerEntry> pending = new ConcurrentLinkedQueue<>();
    private final Counter acceptedCounter;
    private final Counter duplicateCounter;
    private final Counter flushFailureCounter;
    private volatile String lastFlushFailure;

    @Autowired
    public ProcessedEventLedger(LedgerStore store, StructuredLogger structuredLogger, MeterRegistry meterRegistry) {
        this(store, structuredLogger, meterRegistry, Clock.systemUTC());
    }

    ProcessedEventLedger(LedgerStore store, StructuredLogger structuredLogger, MeterRegistry meterRegistry,
                         Clock clock) {
        this.store = store;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.acceptedCounter = Counter.builder("concord.ledger.accepted").register(meterRegistry);
        this.duplicateCounter = Counter.builder("concord.ledger.duplicates").register(meterRegistry);
        this.flushFailureCounter = Counter.builder("concord.ledger.flush.failures")
                .description("Ledger flushes that failed and were left for retry")
                .register(meterRegistry);
        Gauge.builder("concord.ledger.pending", pending, Queue::size).register(meterRegistry);
    }

    /**
     * Load every stored id.
     *
     * @return the number of distinct ids known afterwards
     */
    public Mono<Integer> load() {
        return store.loadAll()
                .doOnNext(processed::add)
                .then(Mono.fromCallable(processed::size))
                .doOnSuccess(size -> log.info("Loaded {} processed event ids from {}", size, store.describe()));
    }

    /**
     * Claim an event id.
     *
     * @return true the first time the id is seen, false for a duplicate
     */
    public boolean tryAccept(String eventId) {
        if (processed.add(eventId)) {
            pending.add(new LedgerEntry(eventId, LocalDate.now(clock)));
            acceptedCounter.increment();
            return true;
        }
        duplicateCounter.increment();
        return false;
    }

    public boolean contains(String eventId) {
        return processed.contains(eventId);
    }

    /**
     * Write buffered ids to the store.
     *
     * @return number of ids written; {@link PersistenceException} when the store failed, in
     * which case the ids are buffered again
     */
    public Mono<Integer> flush() {
        return Mono.defer(() -> {
            List<LedgerEntry> batch = drain();
            if (batch.isEmpty()) {
                return Mono.just(0);
            }
            Map<LocalDate, List<String>> byDay = new TreeMap<>();
            for (LedgerEntry entry : batch) {
                byDay.computeIfAbsent(entry.day(), day -> new ArrayList<>()).add(entry.eventId());
            }
            long start = System.currentTimeMillis();
            return Flux.fromIterable(byDay.entrySet())
                    .concatMap(segment -> store.append(segment.getKey(), segment.getValue()))
                    .then(Mono.fromCallable(() -> {
                        lastFlushFailure = null;
                        structuredLogger.logLedgerFlush(batch.size(), System.currentTimeMillis() - start, true);
                        return batch.size();
                    }))
                    .onErrorResume(e -> {
                        pending.addAll(batch);
                        flushFailureCounter.increment();
                        lastFlushFailure = Instant.now(clock) + " " + e.getMessage();
                        structuredLogger.logLedgerFlush(batch.size(), System.currentTimeMillis() - start, false);
                        log.error("Ledger flush of {} ids to {} failed, will retry: {}",
                                batch.size(), store.describe(), e.getMessage());
                        return Mono.error(e instanceof PersistenceException
                                ? e
                                : new PersistenceException("Ledger flush failed: " + e.getMessage(), e));
                    });
        });
    }

    @Scheduled(fixedDelayString = "${concord.ledger.flush-interval-ms:2000}")
    public void scheduledFlush() {
        flush().onErrorResume(PersistenceException.class, e -> Mono.empty()).block();
    }

    /**
     * Forget every id, in memory and in the store.
     */
    public Mono<Void> clear() {
        return Mono.defer(() -> {
            int size = processed.size();
            processed.clear();
            pending.clear();
            return store.clear()
                    .doOnSuccess(v -> log.warn("Cleared processed event ledger ({} ids)", size));
        });
    }

    public int size() {
        return processed.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public Optional<String> lastFlushFailure() {
        return Optional.ofNullable(lastFlushFailure);
    }

    private List<LedgerEntry> drain() {
        List<LedgerEntry> batch = new ArrayList<>();
        LedgerEntry entry;
        while ((entry = pending.poll()) != null) {
            batch.add(entry);
        }
        return batch;
    }

    private record LedgerEntry(String eventId, LocalDate day) {
    }
}
