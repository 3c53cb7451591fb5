package com.z254.concord.conductor.network;

import com.z254.concord.conductor.ConductorTestFixtures;
import com.z254.concord.conductor.config.ConductorProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Subscription;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.SendResult;
import reactor.core.Disposable;
import reactor.core.publisher.BaseSubscriber;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link KafkaEventNetwork}.
 */
@ExtendWith(MockitoExtension.class)
class KafkaEventNetworkTest {

    private static final String TOPIC = "concord.network.events";
    private static final Duration REDELIVERY_BACKOFF = Duration.ofMillis(5);
    private static final AgentIdentity AUTHOR = AgentIdentity.generate();

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private KafkaListenerEndpointRegistry listenerRegistry;

    @Mock
    private MessageListenerContainer container;

    @Mock
    private Acknowledgment ack;

    @Captor
    private ArgumentCaptor<String> payloadCaptor;

    private MeterRegistry meterRegistry;
    private KafkaEventNetwork network;
    private NetworkEvent event;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ConductorProperties properties = new ConductorProperties();
        properties.getKafka().setHandoffTimeout(Duration.ofMillis(100));
        properties.getKafka().setRedeliveryBackoff(REDELIVERY_BACKOFF);
        network = new KafkaEventNetwork(kafkaTemplate, listenerRegistry, ConductorTestFixtures.objectMapper(),
                properties, meterRegistry);
        event = note("hello");
    }

    private static NetworkEvent note(String content) {
        return new EventSigner().sign(AUTHOR, EventKind.TEXT_NOTE.getCode(),
                List.of(EventTags.tag(EventTags.CONVERSATION, "root")), content, 1_715_688_000L);
    }

    @Nested
    @DisplayName("Publishing")
    class PublishingTests {

        @Test
        @DisplayName("should send the event as JSON keyed by its id")
        void publishKeyedById() {
            when(kafkaTemplate.send(eq(TOPIC), eq(event.getId()), payloadCaptor.capture()))
                    .thenReturn(createSuccessfulFuture());

            StepVerifier.create(network.publish(event)).verifyComplete();

            assertThat(payloadCaptor.getValue())
                    .contains("\"created_at\":1715688000")
                    .contains("\"sig\":\"" + event.getSig() + "\"");
            assertThat(meterRegistry.counter("concord.kafka.events.published").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should surface broker failures")
        void publishFailure() {
            when(kafkaTemplate.send(eq(TOPIC), eq(event.getId()), payloadCaptor.capture()))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

            StepVerifier.create(network.publish(event))
                    .expectErrorMessage("broker down")
                    .verify();
        }
    }

    @Nested
    @DisplayName("Consuming")
    class ConsumingTests {

        private final List<EventFilter> textNotes =
                List.of(EventFilter.builder().kind(EventKind.TEXT_NOTE.getCode()).build());

        @BeforeEach
        void setUpListener() {
            lenient().when(listenerRegistry.getListenerContainer(KafkaEventNetwork.LISTENER_ID)).thenReturn(container);
        }

        @Test
        @DisplayName("should acknowledge a record once the subscriber confirms it")
        void consumeConfirmed() {
            List<NetworkEvent> received = new CopyOnWriteArrayList<>();
            Disposable subscription = network.subscribe(textNotes, "test")
                    .subscribe(value -> {
                        received.add(value);
                        network.confirm(value);
                    });

            network.consume(record(json(event)), ack);
            subscription.dispose();

            assertThat(received).singleElement().isEqualTo(event);
            verify(ack).acknowledge();
            verify(ack, never()).nack(any(Duration.class));
            verify(container).start();
        }

        @Test
        @DisplayName("should deliver again a record the subscriber never confirms")
        void consumeUnconfirmed() {
            List<NetworkEvent> received = new CopyOnWriteArrayList<>();
            Disposable subscription = network.subscribe(textNotes, "test").subscribe(received::add);

            network.consume(record(json(event)), ack);
            subscription.dispose();

            assertThat(received).singleElement().isEqualTo(event);
            verify(ack, never()).acknowledge();
            verify(ack).nack(REDELIVERY_BACKOFF);
            assertThat(meterRegistry.counter("concord.kafka.events.redelivered").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should acknowledge records every subscriber filters out")
        void consumeFilteredOut() {
            List<NetworkEvent> received = new CopyOnWriteArrayList<>();
            Disposable subscription = network.subscribe(
                    List.of(EventFilter.builder().kind(EventKind.AGENT_STATUS.getCode()).build()), "status")
                    .subscribe(received::add);

            network.consume(record(json(event)), ack);
            subscription.dispose();

            assertThat(received).isEmpty();
            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("should not acknowledge records consumed before anyone subscribed")
        void consumeWithoutSubscriber() {
            network.consume(record(json(event)), ack);

            verify(ack, never()).acknowledge();
            verify(ack).nack(REDELIVERY_BACKOFF);
        }

        @Test
        @DisplayName("should hold records for a slow subscriber without failing the stream")
        void slowSubscriber() {
            List<NetworkEvent> received = new CopyOnWriteArrayList<>();
            List<Throwable> errors = new CopyOnWriteArrayList<>();
            BaseSubscriber<NetworkEvent> oneAtATime = new BaseSubscriber<>() {
                @Override
                protected void hookOnSubscribe(Subscription subscription) {
                    request(1);
                }

                @Override
                protected void hookOnNext(NetworkEvent value) {
                    received.add(value);
                    network.confirm(value);
                }

                @Override
                protected void hookOnError(Throwable throwable) {
                    errors.add(throwable);
                }
            };
            network.subscribe(textNotes, "slow").subscribe(oneAtATime);

            for (int i = 0; i < 3; i++) {
                network.consume(record(json(note("update " + i))), ack);
            }
            oneAtATime.dispose();

            assertThat(received).hasSize(1);
            assertThat(errors).isEmpty();
            verify(ack, times(1)).acknowledge();
            verify(ack, times(2)).nack(REDELIVERY_BACKOFF);
        }

        @Test
        @DisplayName("should stop the listener when the last subscriber leaves")
        void listenerFollowsSubscribers() {
            when(container.isRunning()).thenReturn(false, true);

            Disposable subscription = network.subscribe(textNotes, "test").subscribe();
            subscription.dispose();

            verify(container).start();
            verify(container).stop(any(Runnable.class));
        }

        @Test
        @DisplayName("should acknowledge and drop malformed records")
        void consumeMalformed() {
            network.consume(record("{not json"), ack);

            verify(ack).acknowledge();
            assertThat(meterRegistry.counter("concord.kafka.events.malformed").count()).isEqualTo(1.0);
        }
    }

    private String json(NetworkEvent value) {
        try {
            return ConductorTestFixtures.objectMapper().writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>(TOPIC, 0, 0L, "key", value);
    }

    private CompletableFuture<SendResult<String, String>> createSuccessfulFuture() {
        RecordMetadata metadata = new RecordMetadata(
                new TopicPartition(TOPIC, 0),
                0L, 0, 0L, 0, 0
        );
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, "key", "value");
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }
}
