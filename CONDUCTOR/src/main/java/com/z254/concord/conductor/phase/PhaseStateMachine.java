package com.z254.concord.conductor.phase;

import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.Phase;
import com.z254.concord.conductor.domain.model.PhaseTransition;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import com.z254.concord.conductor.exception.ValidationException;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates and applies phase transitions.
 *
 * <p>A transition is checked against {@link PhaseTransitionGraph} before anything changes. If a
 * turn is open it is force-closed first, then the transition is logged and the phase updated,
 * all in one store mutation.
 */
@Service
@Slf4j
public class PhaseStateMachine {

    private static final Pattern PHASE_NAME = Pattern.compile("[A-Z][A-Z0-9_-]{0,63}");

    private final ConversationStore store;
    private final PhaseTransitionGraph graph;
    private final StructuredLogger structuredLogger;
    private final Counter transitionCounter;
    private final Counter rejectedCounter;

    public PhaseStateMachine(
            ConversationStore store,
            PhaseTransitionGraph graph,
            StructuredLogger structuredLogger,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.graph = graph;
        this.structuredLogger = structuredLogger;
        this.transitionCounter = Counter.builder("concord.phase.transitions").register(meterRegistry);
        this.rejectedCounter = Counter.builder("concord.phase.transitions.rejected").register(meterRegistry);
    }

    /**
     * Move a conversation to another phase.
     *
     * @param conversationId   conversation
     * @param targetPhase      standard or custom phase name, case-insensitive
     * @param instructions     instructions for the target; required to enter an unregistered custom phase
     * @param initiatingAgent  agent slug requesting the change
     * @param reason           why
     * @return the recorded transition; {@link ValidationException} when the target is unreachable
     */
    public Mono<PhaseTransition> transition(String conversationId, String targetPhase, String instructions,
                                            String initiatingAgent, String reason) {
        String to = Phase.normalize(targetPhase);
        if (!StringUtils.hasText(to) || !PHASE_NAME.matcher(to).matches()) {
            rejectedCounter.increment();
            return Mono.error(new ValidationException("Invalid phase name: " + targetPhase));
        }
        boolean hasInstructions = StringUtils.hasText(instructions);

        return store.mutate(conversationId, conversation -> {
                    String from = conversation.getPhase();
                    if (!graph.isAllowed(from, to, conversation.getCustomPhases(), hasInstructions)) {
                        throw new ValidationException(describeRejection(conversation, from, to));
                    }
                    Instant now = Instant.now();
                    if (conversation.hasOpenTurn()) {
                        conversation.closeCurrentTurn("phase change " + from + " -> " + to, true, now);
                    }
                    if (!Phase.isStandard(to) && hasInstructions) {
                        conversation.registerCustomPhase(to, instructions);
                    }
                    PhaseTransition transition = PhaseTransition.builder()
                            .from(from)
                            .to(to)
                            .initiatingAgent(initiatingAgent)
                            .reason(reason)
                            .instructions(hasInstructions ? instructions : phaseInstructions(conversation, to))
                            .timestamp(now)
                            .build();
                    conversation.addPhaseTransition(transition);
                    return transition;
                })
                .doOnNext(transition -> {
                    transitionCounter.increment();
                    structuredLogger.logPhaseTransition(conversationId, transition);
                })
                .doOnError(ValidationException.class, e -> {
                    rejectedCounter.increment();
                    log.warn("Rejected phase transition for {}: {}", conversationId, e.getMessage());
                });
    }

    /**
     * Close the open turn without waiting for the remaining agents, e.g. after an external
     * timeout expired.
     *
     * @return the closed turn, empty when none was open
     */
    public Mono<RoutingEntry> forceCloseTurn(String conversationId, String reason) {
        return store.closeTurn(conversationId, reason)
                .doOnNext(turn -> log.info("Force-closed turn {} of {}: {}",
                        turn.getTurnId(), conversationId, reason));
    }

    /**
     * Instructions surfaced to agents working in the given phase.
     */
    public String phaseInstructions(Conversation conversation, String phase) {
        String normalized = Phase.normalize(phase);
        if (conversation.getCustomPhases() != null && conversation.getCustomPhases().containsKey(normalized)) {
            return conversation.getCustomPhases().get(normalized);
        }
        return Phase.find(normalized)
                .map(Phase::getDescription)
                .orElse(null);
    }

    public List<String> validTransitions(Conversation conversation) {
        return graph.validTransitions(conversation.getPhase(), conversation.getCustomPhases());
    }

    private String describeRejection(Conversation conversation, String from, String to) {
        if (!Phase.isStandard(to) && !conversation.getCustomPhases().containsKey(to)) {
            return "Custom phase " + to + " requires instructions";
        }
        return "Transition " + from + " -> " + to + " is not allowed; valid targets: "
                + graph.validTransitions(from, conversation.getCustomPhases());
    }
}
