package com.z254.concord.conductor.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.concord.conductor.config.ConductorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event network carried over a Kafka topic. Events travel as JSON keyed by event id;
 * filters are applied on consumption. Stored-event replay is left to consumer offsets,
 * so {@link EventFilter#getLimit()} is not applied.
 *
 * <p>The listener container starts when the first subscriber attaches and stops when the
 * last one leaves. Each record is handed to the subscribers one at a time and its offset is
 * committed only after a subscriber {@linkplain #confirm confirms} the event, or after every
 * subscriber's filters passed it over. A record that cannot be handed off, or is not
 * confirmed within the handoff timeout, is negatively acknowledged and delivered again.
 */
@Component
@ConditionalOnProperty(prefix = "concord.network", name = "transport", havingValue = "kafka")
@Slf4j
public class KafkaEventNetwork implements EventNetwork {

    public static final String LISTENER_ID = "concord-network-events";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final KafkaListenerEndpointRegistry listenerRegistry;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Duration handoffTimeout;
    private final Duration redeliveryBackoff;
    private final Sinks.Many<NetworkEvent> inbound =
            Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger subscribers = new AtomicInteger();
    private final Counter publishedCounter;
    private final Counter consumedCounter;
    private final Counter malformedCounter;
    private final Counter redeliveredCounter;

    public KafkaEventNetwork(
            KafkaTemplate<String, String> kafkaTemplate,
            KafkaListenerEndpointRegistry listenerRegistry,
            ObjectMapper objectMapper,
            ConductorProperties properties,
            MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.listenerRegistry = listenerRegistry;
        this.objectMapper = objectMapper;
        this.topic = properties.getKafka().getTopics().getEvents();
        this.handoffTimeout = properties.getKafka().getHandoffTimeout();
        this.redeliveryBackoff = properties.getKafka().getRedeliveryBackoff();

        this.publishedCounter = Counter.builder("concord.kafka.events.published").register(meterRegistry);
        this.consumedCounter = Counter.builder("concord.kafka.events.consumed").register(meterRegistry);
        this.malformedCounter = Counter.builder("concord.kafka.events.malformed").register(meterRegistry);
        this.redeliveredCounter = Counter.builder("concord.kafka.events.redelivered").register(meterRegistry);
    }

    @Override
    public Flux<NetworkEvent> subscribe(List<EventFilter> filters, String label) {
        List<EventFilter> copy = List.copyOf(filters);
        return inbound.asFlux()
                .filter(event -> {
                    boolean matches = copy.stream().anyMatch(filter -> filter.matches(event));
                    if (!matches) {
                        confirm(event);
                    }
                    return matches;
                })
                .doOnSubscribe(s -> {
                    subscribers.incrementAndGet();
                    log.info("Subscription {} attached to topic {}", label, topic);
                    startListener();
                })
                .doFinally(signal -> {
                    log.info("Subscription {} detached from topic {} ({})", label, topic, signal);
                    if (subscribers.decrementAndGet() == 0) {
                        inFlight.values().forEach(handoff ->
                                handoff.completeExceptionally(new CancellationException("no subscribers left")));
                        stopListener();
                    }
                });
    }

    @Override
    public Mono<Void> publish(NetworkEvent event) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
                .flatMap(json -> Mono.fromFuture(kafkaTemplate.send(topic, event.getId(), json)))
                .doOnNext(result -> {
                    publishedCounter.increment();
                    log.debug("Published event {} to partition {} offset {}",
                            event.getId(),
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                })
                .doOnError(e -> log.warn("Failed to publish event {}: {}", event.getId(), e.getMessage()))
                .then();
    }

    @Override
    public void confirm(NetworkEvent event) {
        CompletableFuture<Void> handoff = inFlight.get(event.getId());
        if (handoff != null) {
            handoff.complete(null);
        }
    }

    @Override
    public String transport() {
        return "kafka";
    }

    @KafkaListener(
            id = LISTENER_ID,
            autoStartup = "false",
            topics = "${concord.kafka.topics.events:concord.network.events}",
            groupId = "${spring.kafka.consumer.group-id:concord-conductor}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        consumedCounter.increment();
        NetworkEvent event;
        try {
            event = objectMapper.readValue(record.value(), NetworkEvent.class);
        } catch (JsonProcessingException e) {
            malformedCounter.increment();
            log.warn("Dropping malformed event at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getOriginalMessage());
            ack.acknowledge();
            return;
        }
        log.debug("Received event {} from partition {} offset {}", event.getId(), record.partition(), record.offset());

        if (subscribers.get() == 0) {
            redeliver(record, ack, event, "no subscriber attached");
            return;
        }

        CompletableFuture<Void> handoff = new CompletableFuture<>();
        inFlight.put(event.getId(), handoff);
        try {
            Sinks.EmitResult result = inbound.tryEmitNext(event);
            if (result.isFailure()) {
                redeliver(record, ack, event, "hand-off failed with " + result);
                return;
            }
            handoff.get(handoffTimeout.toMillis(), TimeUnit.MILLISECONDS);
            ack.acknowledge();
        } catch (TimeoutException e) {
            redeliver(record, ack, event, "not confirmed within " + handoffTimeout);
        } catch (ExecutionException | CancellationException e) {
            redeliver(record, ack, event, "hand-off abandoned");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            redeliver(record, ack, event, "listener interrupted");
        } finally {
            inFlight.remove(event.getId(), handoff);
        }
    }

    private void redeliver(ConsumerRecord<String, String> record, Acknowledgment ack, NetworkEvent event, String why) {
        redeliveredCounter.increment();
        log.warn("Event {} at partition {} offset {} will be delivered again: {}",
                event.getId(), record.partition(), record.offset(), why);
        ack.nack(redeliveryBackoff);
    }

    private void startListener() {
        MessageListenerContainer container = listenerRegistry.getListenerContainer(LISTENER_ID);
        if (container == null) {
            log.warn("No listener container {} registered; topic {} is not consumed", LISTENER_ID, topic);
        } else if (!container.isRunning()) {
            container.start();
            log.info("Started consuming topic {}", topic);
        }
    }

    private void stopListener() {
        MessageListenerContainer container = listenerRegistry.getListenerContainer(LISTENER_ID);
        if (container != null && container.isRunning()) {
            container.stop(() -> log.info("Stopped consuming topic {}", topic));
        }
    }
}
