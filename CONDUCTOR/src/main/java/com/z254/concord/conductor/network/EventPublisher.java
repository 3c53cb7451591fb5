package com.z254.concord.conductor.network;

import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.exception.TransportException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Signs events with the conductor's identity and publishes them, retrying transient
 * failures with backoff. Each event is signed once, so retries carry the same id.
 */
@Component
@Slf4j
public class EventPublisher {

    private final EventNetwork network;
    private final EventSigner signer;
    private final AgentIdentity identity;
    private final ConductorProperties.DelegationProperties config;
    private final Counter publishedCounter;
    private final Counter failureCounter;

    public EventPublisher(
            EventNetwork network,
            EventSigner signer,
            AgentIdentity orchestratorIdentity,
            ConductorProperties properties,
            MeterRegistry meterRegistry) {
        this.network = network;
        this.signer = signer;
        this.identity = orchestratorIdentity;
        this.config = properties.getDelegation();
        this.publishedCounter = Counter.builder("concord.events.published").register(meterRegistry);
        this.failureCounter = Counter.builder("concord.events.publish.failures").register(meterRegistry);
    }

    /**
     * Publish a delegation request to one recipient.
     *
     * @return the published event; {@link TransportException} once retries are exhausted
     */
    public Mono<NetworkEvent> publishRequest(String conversationId, String turnId, String phase,
                                             String recipientPubkey, String content) {
        List<List<String>> tags = new ArrayList<>();
        tags.add(EventTags.tag(EventTags.CONVERSATION, conversationId));
        tags.add(EventTags.tag(EventTags.RECIPIENT, recipientPubkey));
        tags.add(EventTags.tag(EventTags.TURN, turnId));
        tags.add(EventTags.tag(EventTags.PHASE, phase));
        return publish(EventKind.GENERIC_REPLY.getCode(), tags, content);
    }

    public Mono<NetworkEvent> publish(int kind, List<List<String>> tags, String content) {
        return Mono.fromCallable(() -> signer.sign(identity, kind, List.copyOf(tags), content,
                        Instant.now().getEpochSecond()))
                .flatMap(this::publish);
    }

    public Mono<NetworkEvent> publish(NetworkEvent event) {
        return Mono.defer(() -> network.publish(event))
                .retryWhen(Retry.backoff(config.getPublishRetries(), config.getPublishBackoff())
                        .doBeforeRetry(signal -> log.warn("Retrying publish of event {} (attempt {}): {}",
                                event.getId(), signal.totalRetries() + 1, signal.failure().getMessage())))
                .onErrorMap(Exceptions::isRetryExhausted, e -> {
                    failureCounter.increment();
                    return new TransportException("Failed to publish event " + event.getId()
                            + " via " + network.transport(), e.getCause());
                })
                .thenReturn(event)
                .doOnNext(published -> {
                    publishedCounter.increment();
                    log.debug("Published event {} kind {}", published.getId(), published.getKind());
                });
    }

    public String publicKey() {
        return identity.publicKeyHex();
    }
}
