package com.z254.concord.conductor.network;

import com.z254.concord.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event network. Keeps a bounded history for replay on subscribe and fans each
 * published event out once per simulated relay, so subscribers see the duplicates a
 * multi-relay deployment produces.
 */
@Component
@ConditionalOnProperty(prefix = "concord.network", name = "transport", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryEventNetwork implements EventNetwork {

    private final int relays;
    private final int historySize;
    private final Object lock = new Object();
    private final Deque<NetworkEvent> history = new ArrayDeque<>();
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    @Autowired
    public InMemoryEventNetwork(ConductorProperties properties) {
        this(properties.getNetwork().getRelays(), properties.getNetwork().getHistorySize());
    }

    public InMemoryEventNetwork(int relays, int historySize) {
        this.relays = Math.max(1, relays);
        this.historySize = Math.max(0, historySize);
        log.info("Initialized in-memory event network ({} relays, history {})", this.relays, this.historySize);
    }

    @Override
    public Flux<NetworkEvent> subscribe(List<EventFilter> filters, String label) {
        return Flux.defer(() -> {
            Subscriber subscriber = new Subscriber(label, List.copyOf(filters),
                    Sinks.many().unicast().onBackpressureBuffer());
            synchronized (lock) {
                replay(subscriber);
                subscribers.add(subscriber);
            }
            log.debug("Subscription {} opened with {} filters", label, filters.size());
            return subscriber.sink().asFlux()
                    .doFinally(signal -> {
                        subscribers.remove(subscriber);
                        log.debug("Subscription {} closed ({})", label, signal);
                    });
        });
    }

    @Override
    public Mono<Void> publish(NetworkEvent event) {
        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                history.addLast(event);
                while (history.size() > historySize) {
                    history.removeFirst();
                }
                for (Subscriber subscriber : subscribers) {
                    if (subscriber.accepts(event)) {
                        for (int relay = 0; relay < relays; relay++) {
                            Sinks.EmitResult result = subscriber.sink().tryEmitNext(event);
                            if (result.isFailure()) {
                                log.warn("Failed to deliver event {} to {}: {}", event.getId(), subscriber.label(), result);
                            }
                        }
                    }
                }
            }
        });
    }

    @Override
    public String transport() {
        return "memory";
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void replay(Subscriber subscriber) {
        for (EventFilter filter : subscriber.filters()) {
            List<NetworkEvent> matching = new ArrayList<>();
            for (NetworkEvent event : history) {
                if (filter.matches(event)) {
                    matching.add(event);
                }
            }
            int from = filter.getLimit() != null ? Math.max(0, matching.size() - filter.getLimit()) : 0;
            matching.subList(from, matching.size()).forEach(subscriber.sink()::tryEmitNext);
        }
    }

    private record Subscriber(String label, List<EventFilter> filters, Sinks.Many<NetworkEvent> sink) {

        boolean accepts(NetworkEvent event) {
            return filters.stream().anyMatch(filter -> filter.matches(event));
        }
    }
}
