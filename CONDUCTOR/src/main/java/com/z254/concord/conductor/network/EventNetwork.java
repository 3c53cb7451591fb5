package com.z254.concord.conductor.network;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Publish/subscribe access to the event network. Delivery is at least once: a subscriber
 * may see the same event more than once.
 */
public interface EventNetwork {

    /**
     * Subscribe to events matching any of the filters.
     *
     * @param filters subscription filters
     * @param label   name used in logs
     * @return events in delivery order, until the subscription is disposed
     */
    Flux<NetworkEvent> subscribe(List<EventFilter> filters, String label);

    /**
     * Publish a signed event.
     *
     * @param event the event
     * @return completion once the network accepted the event
     */
    Mono<Void> publish(NetworkEvent event);

    /**
     * Confirm that a delivered event has been handled. Transports that commit consumption,
     * such as consumer offsets, release the event here; others need nothing.
     *
     * @param event an event received from {@link #subscribe}
     */
    default void confirm(NetworkEvent event) {
    }

    /**
     * Transport identifier for logs and health details.
     */
    String transport();
}
