package com.z254.concord.conductor.ingestion.ledger;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Durable storage behind the processed-event ledger, segmented by day.
 */
public interface LedgerStore {

    /**
     * Every id in every segment. Ids may repeat across segments.
     */
    Flux<String> loadAll();

    /**
     * Append ids to the day's segment.
     */
    Mono<Void> append(LocalDate day, Collection<String> eventIds);

    /**
     * Remove every segment.
     */
    Mono<Void> clear();

    String describe();
}
