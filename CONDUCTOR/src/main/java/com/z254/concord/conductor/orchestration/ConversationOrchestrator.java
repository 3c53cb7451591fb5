package com.z254.concord.conductor.orchestration;

import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.delegation.DelegationRequest;
import com.z254.concord.conductor.delegation.DelegationResult;
import com.z254.concord.conductor.domain.model.AgentState;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.RoutingDecision;
import com.z254.concord.conductor.exception.ConductorException;
import com.z254.concord.conductor.exception.ValidationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * The routing loop: decide, change phase when asked, delegate, wait for the replies, repeat
 * until the routing engine answers END.
 *
 * <p>At most one loop runs per conversation. A cycle that fails closes the open turn with the
 * failure as its close reason and records the failure in the conversation metadata under
 * {@value #LAST_ROUTING_FAILURE}; the loop then ends.
 */
@Service
@Slf4j
public class ConversationOrchestrator {

    public static final String LAST_ROUTING_FAILURE = "lastRoutingFailure";

    private final OrchestrationContext context;
    private final ConductorProperties.RoutingProperties routing;
    private final Duration waitTimeout;

    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final Map<String, Disposable> loops = new ConcurrentHashMap<>();

    private final Counter cycleCounter;
    private final Map<OrchestrationOutcome, Counter> outcomeCounters = new EnumMap<>(OrchestrationOutcome.class);

    public ConversationOrchestrator(OrchestrationContext context, MeterRegistry meterRegistry) {
        this.context = context;
        this.routing = context.getProperties().getRouting();
        this.waitTimeout = context.getProperties().getDelegation().getWaitTimeout();
        this.cycleCounter = Counter.builder("concord.orchestration.cycles").register(meterRegistry);
        for (OrchestrationOutcome outcome : OrchestrationOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("concord.orchestration.loops")
                    .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
    }

    // --------------------------------------------------------------------------------------------
    // Loop control
    // --------------------------------------------------------------------------------------------

    /**
     * Start the routing loop in the background.
     *
     * @return false when a loop is already running for the conversation
     */
    public boolean start(String conversationId) {
        if (!running.add(conversationId)) {
            return false;
        }
        Disposable loop = run(conversationId)
                .doFinally(signal -> running.remove(conversationId))
                .subscribe(
                        outcome -> log.info("Routing loop for {} ended: {}", conversationId, outcome),
                        error -> log.error("Routing loop for {} terminated", conversationId, error));
        loops.put(conversationId, loop);
        if (!running.contains(conversationId)) {
            loops.remove(conversationId, loop);
        }
        return true;
    }

    public boolean isRunning(String conversationId) {
        return running.contains(conversationId);
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * Stop the loop. A pending delegation wait is cancelled and its turn closed.
     *
     * @return true when a loop was running
     */
    public Mono<Boolean> stop(String conversationId, String reason) {
        boolean wasRunning = running.contains(conversationId);
        return context.getDelegationService().cancel(conversationId, reason)
                .then(Mono.fromRunnable(() -> {
                    Disposable loop = loops.remove(conversationId);
                    if (loop != null) {
                        loop.dispose();
                    }
                    running.remove(conversationId);
                }))
                .thenReturn(wasRunning);
    }

    /**
     * Run the loop to completion.
     */
    public Mono<OrchestrationOutcome> run(String conversationId) {
        return cycle(conversationId, 1)
                .onErrorResume(CancellationException.class, e -> {
                    log.info("Routing for {} cancelled: {}", conversationId, e.getMessage());
                    return Mono.just(OrchestrationOutcome.CANCELLED);
                })
                .onErrorResume(e -> recordFailure(conversationId, e).thenReturn(OrchestrationOutcome.FAILED))
                .doOnNext(outcome -> outcomeCounters.get(outcome).increment())
                .doFinally(signal -> loops.remove(conversationId));
    }

    // --------------------------------------------------------------------------------------------
    // Cycle
    // --------------------------------------------------------------------------------------------

    private Mono<OrchestrationOutcome> cycle(String conversationId, int iteration) {
        if (iteration > routing.getMaxIterations()) {
            log.warn("Routing for {} stopped after {} cycles without END", conversationId, routing.getMaxIterations());
            return Mono.just(OrchestrationOutcome.ITERATION_LIMIT);
        }
        return load(conversationId)
                .flatMap(conversation -> decide(conversation)
                        .flatMap(decision -> {
                            cycleCounter.increment();
                            if (decision.isEnd()) {
                                log.info("Routing for {} complete: {}", conversationId, decision.getReason());
                                return Mono.just(OrchestrationOutcome.COMPLETED);
                            }
                            return applyPhase(conversation, decision)
                                    .then(Mono.defer(() -> delegate(conversationId, decision)))
                                    .then(Mono.defer(() -> cycle(conversationId, iteration + 1)));
                        }));
    }

    private Mono<RoutingDecision> decide(Conversation conversation) {
        int retries = Math.max(1, routing.getMaxDecisionAttempts()) - 1;
        return Mono.defer(() -> context.getRoutingEngine().decide(conversation))
                .retryWhen(Retry.max(retries).filter(ValidationException.class::isInstance))
                .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause);
    }

    private Mono<Void> applyPhase(Conversation conversation, RoutingDecision decision) {
        String target = decision.getPhase();
        if (target == null || target.equals(conversation.getPhase())) {
            return Mono.empty();
        }
        return context.getPhaseStateMachine()
                .transition(conversation.getId(), target, null,
                        context.getRegistry().orchestrator().getSlug(), decision.getReason())
                .then();
    }

    private Mono<DelegationResult> delegate(String conversationId, RoutingDecision decision) {
        return load(conversationId).flatMap(conversation -> {
            DelegationRequest request = DelegationRequest.builder()
                    .initiator(context.getRegistry().orchestrator().getSlug())
                    .recipients(decision.getAgents())
                    .payload(payload(conversation, decision))
                    .reason(decision.getReason())
                    .build();

            Mono<DelegationResult> wait = context.getDelegationService().delegate(conversationId, request);
            if (waitTimeout != null) {
                wait = wait.timeout(waitTimeout)
                        .onErrorResume(TimeoutException.class, e -> context.getPhaseStateMachine()
                                .forceCloseTurn(conversationId, "no reply within " + waitTimeout)
                                .map(turn -> DelegationResult.from(conversationId, turn)));
            }
            return wait.doOnNext(result -> {
                if (!result.isComplete()) {
                    log.warn("Turn {} of {} closed without replies from {}: {}", result.getTurnId(),
                            conversationId, result.getMissingAgents(), result.getCloseReason());
                }
            });
        });
    }

    String payload(Conversation conversation, RoutingDecision decision) {
        String phase = conversation.getPhase();
        StringBuilder text = new StringBuilder();
        if (announcesPhase(conversation, decision.getAgents())) {
            text.append("Phase is now ").append(phase).append('.');
            String instructions = context.getPhaseStateMachine().phaseInstructions(conversation, phase);
            if (StringUtils.hasText(instructions)) {
                text.append(' ').append(instructions);
            }
            text.append("\n\n");
        }
        text.append(decision.getReason());
        if (StringUtils.hasText(conversation.getOriginalRequest())) {
            text.append("\n\nOriginal request: ").append(conversation.getOriginalRequest());
        }
        return text.toString();
    }

    private boolean announcesPhase(Conversation conversation, List<String> agents) {
        return agents.stream().anyMatch(agent -> {
            AgentState state = conversation.getAgentStates() != null
                    ? conversation.getAgentStates().get(agent)
                    : null;
            return state == null || !Objects.equals(state.getLastSeenPhase(), conversation.getPhase());
        });
    }

    // --------------------------------------------------------------------------------------------
    // Failure handling
    // --------------------------------------------------------------------------------------------

    private Mono<Void> recordFailure(String conversationId, Throwable error) {
        String kind = error instanceof ConductorException conductorError
                ? conductorError.getKind().name()
                : error.getClass().getSimpleName();
        String message = error.getMessage() != null ? error.getMessage() : kind;
        log.error("Routing cycle for {} failed: {}", conversationId, message, error);
        context.getStructuredLogger().logRoutingFailure(conversationId, kind, message);

        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("kind", kind);
        failure.put("message", message);
        failure.put("at", Instant.now().toString());

        return context.getPhaseStateMachine().forceCloseTurn(conversationId, "routing failure: " + message)
                .then(context.getStore().update(conversationId,
                        conversation -> conversation.putMetadata(LAST_ROUTING_FAILURE, failure)))
                .then()
                .onErrorResume(e -> {
                    log.error("Could not record routing failure for {}: {}", conversationId, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Conversation> load(String conversationId) {
        return context.getStore().find(conversationId)
                .switchIfEmpty(Mono.error(() -> new ValidationException("Unknown conversation: " + conversationId)));
    }
}
