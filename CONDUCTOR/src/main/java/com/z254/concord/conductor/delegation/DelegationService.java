package com.z254.concord.conductor.delegation;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.conversation.CompletionMode;
import com.z254.concord.conductor.conversation.CompletionOutcome;
import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.domain.model.Agent;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import com.z254.concord.conductor.exception.ConcurrencyConflictException;
import com.z254.concord.conductor.exception.OrphanedCompletionException;
import com.z254.concord.conductor.exception.TransportException;
import com.z254.concord.conductor.exception.ValidationException;
import com.z254.concord.conductor.network.EventPublisher;
import com.z254.concord.conductor.phase.PhaseStateMachine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Synchronous-over-asynchronous delegation.
 *
 * <p>{@link #delegate} opens a routing turn, publishes one request per recipient and completes
 * once the turn closes: with every reply when all recipients answered, or with the partial set
 * when the turn was closed by force. Replies reach the turn through {@link #recordCompletion},
 * normally fed by event ingestion.
 *
 * <p>There is no built-in timeout. Callers that need one bound the returned {@code Mono} and
 * close the turn through {@link PhaseStateMachine#forceCloseTurn}. Disposing the subscription
 * only drops the wait; {@link #cancel} also closes the turn.
 */
@Service
@Slf4j
public class DelegationService {

    private final ConversationStore store;
    private final PhaseStateMachine phaseStateMachine;
    private final EventPublisher publisher;
    private final AgentRegistry registry;

    // conversation id -> the caller waiting on its open turn
    private final Map<String, PendingTurn> waits = new ConcurrentHashMap<>();

    private final Counter delegationCounter;
    private final Counter partialCounter;
    private final Counter orphanCounter;

    public DelegationService(
            ConversationStore store,
            PhaseStateMachine phaseStateMachine,
            EventPublisher publisher,
            AgentRegistry registry,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.phaseStateMachine = phaseStateMachine;
        this.publisher = publisher;
        this.registry = registry;
        this.delegationCounter = Counter.builder("concord.delegations").register(meterRegistry);
        this.partialCounter = Counter.builder("concord.delegations.partial").register(meterRegistry);
        this.orphanCounter = Counter.builder("concord.completions.orphaned").register(meterRegistry);
        store.onTurnClosed(this::onTurnClosed);
    }

    /**
     * Delegate work and wait for the replies.
     *
     * @return the turn's replies once it closes. Fails with {@link ValidationException} for
     * unknown recipients, {@link ConcurrencyConflictException} when a turn is already open,
     * {@link TransportException} when a request could not be published (the turn stays open)
     * and {@link CancellationException} after {@link #cancel}
     */
    public Mono<DelegationResult> delegate(String conversationId, DelegationRequest request) {
        return Mono.defer(() -> {
            List<Agent> recipients = resolveRecipients(request.getRecipients());
            List<String> slugs = recipients.stream().map(Agent::getSlug).toList();

            return store.openTurn(conversationId, slugs, request.getReason(), request.getInitiator())
                    .flatMap(turn -> {
                        delegationCounter.increment();
                        PendingTurn pending = new PendingTurn(turn.getTurnId(), Sinks.one());
                        waits.put(conversationId, pending);

                        return publishRequests(conversationId, turn, recipients, request.getPayload())
                                .then(resolveIfAlreadyClosed(conversationId, pending))
                                .then(pending.result().asMono())
                                .doOnError(TransportException.class, e -> {
                                    waits.remove(conversationId, pending);
                                    log.error("Delegation for {} turn {} failed to publish, turn left open: {}",
                                            conversationId, turn.getTurnId(), e.getMessage());
                                })
                                .doOnCancel(() -> {
                                    if (waits.remove(conversationId, pending)) {
                                        log.info("Wait on {} turn {} disposed", conversationId, turn.getTurnId());
                                    }
                                });
                    });
        });
    }

    /**
     * Record an agent's reply on a turn. A null turn id means the open turn.
     */
    public Mono<CompletionOutcome> recordCompletion(String conversationId, String turnId,
                                                    Completion completion, CompletionMode mode) {
        return store.recordCompletion(conversationId, turnId, completion, mode)
                .doOnNext(outcome -> log.debug("Completion from {} on {} turn {}: {}",
                        completion.getAgent(), conversationId, turnId, outcome))
                .doOnError(OrphanedCompletionException.class, e -> orphanCounter.increment());
    }

    /**
     * Cancel the wait on the open turn and close the turn. Replies arriving later are orphaned.
     *
     * @return the closed turn, empty when none was open
     */
    public Mono<RoutingEntry> cancel(String conversationId, String reason) {
        return Mono.defer(() -> {
            PendingTurn pending = waits.remove(conversationId);
            if (pending != null) {
                pending.result().tryEmitError(new CancellationException("Delegation cancelled: " + reason));
                log.info("Cancelled wait on {} turn {}: {}", conversationId, pending.turnId(), reason);
            }
            return phaseStateMachine.forceCloseTurn(conversationId, "cancelled: " + reason);
        });
    }

    public int openWaits() {
        return waits.size();
    }

    public boolean isWaiting(String conversationId) {
        return waits.containsKey(conversationId);
    }

    private List<Agent> resolveRecipients(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new ValidationException("Delegation needs at least one recipient");
        }
        Map<String, Agent> recipients = new LinkedHashMap<>();
        List<String> invalid = new ArrayList<>();
        for (String slug : requested) {
            Agent agent = registry.find(slug).orElse(null);
            if (agent == null || !agent.isRoutable() || !StringUtils.hasText(agent.getPubkey())) {
                invalid.add(slug);
            } else {
                recipients.putIfAbsent(agent.getSlug(), agent);
            }
        }
        if (!invalid.isEmpty()) {
            throw new ValidationException("Cannot delegate to " + invalid + "; routable agents: "
                    + registry.routableSlugs());
        }
        return new ArrayList<>(recipients.values());
    }

    private Mono<Void> publishRequests(String conversationId, RoutingEntry turn, List<Agent> recipients,
                                       String payload) {
        return Flux.fromIterable(recipients)
                .concatMap(agent -> publisher.publishRequest(conversationId, turn.getTurnId(), turn.getPhase(),
                        agent.getPubkey(), payload))
                .then();
    }

    // A reply or a forced close may land before the wait is observed
    private Mono<Void> resolveIfAlreadyClosed(String conversationId, PendingTurn pending) {
        return store.find(conversationId)
                .doOnNext(conversation -> conversation.findTurn(pending.turnId())
                        .filter(RoutingEntry::isCompleted)
                        .ifPresent(turn -> resolve(conversationId, pending, turn)))
                .then();
    }

    private void onTurnClosed(String conversationId, RoutingEntry turn) {
        PendingTurn pending = waits.get(conversationId);
        if (pending != null && pending.turnId().equals(turn.getTurnId())) {
            resolve(conversationId, pending, turn);
        }
    }

    private void resolve(String conversationId, PendingTurn pending, RoutingEntry turn) {
        if (!waits.remove(conversationId, pending)) {
            return;
        }
        DelegationResult result = DelegationResult.from(conversationId, turn);
        if (!result.isComplete()) {
            partialCounter.increment();
        }
        pending.result().tryEmitValue(result);
    }

    private record PendingTurn(String turnId, Sinks.One<DelegationResult> result) {
    }
}
