package com.z254.concord.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A multi-agent conversation: current phase, message history, the open routing turn, the
 * log of closed turns and the phase transitions that led here.
 *
 * <p>Instances are owned by the conversation store. Other components receive snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    /**
     * Unique identifier, the id of the root event that started the conversation.
     */
    private String id;

    private String title;

    /**
     * Current phase name, a {@link Phase} or a registered custom phase.
     */
    @Builder.Default
    private String phase = Phase.CHAT.name();

    /**
     * The user request the current workflow is serving.
     */
    private String originalRequest;

    @Builder.Default
    private List<ConversationMessage> history = new ArrayList<>();

    /**
     * Per-agent state keyed by agent slug.
     */
    @Builder.Default
    private Map<String, AgentState> agentStates = new LinkedHashMap<>();

    @Builder.Default
    private List<PhaseTransition> phaseTransitions = new ArrayList<>();

    /**
     * Closed turns, oldest first.
     */
    @Builder.Default
    private List<RoutingEntry> turnLog = new ArrayList<>();

    /**
     * The open turn, null when none is open.
     */
    private RoutingEntry currentTurn;

    /**
     * Custom phase name to the instructions agents receive in that phase.
     */
    @Builder.Default
    private Map<String, String> customPhases = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private ExecutionTime executionTime = new ExecutionTime();

    /**
     * Incremented on every stored mutation. Repositories ignore writes older than what
     * they already hold.
     */
    private long revision;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasOpenTurn() {
        return currentTurn != null && !currentTurn.isCompleted();
    }

    public void openTurn(RoutingEntry turn, Instant now) {
        this.currentTurn = turn;
        executionTime().start(now);
    }

    /**
     * Close the open turn and move it to the turn log.
     *
     * @param reason why the turn closed
     * @param forced true when not every target agent replied
     * @param now    closing time
     * @return the closed turn, or null when no turn was open
     */
    public RoutingEntry closeCurrentTurn(String reason, boolean forced, Instant now) {
        if (currentTurn == null) {
            return null;
        }
        RoutingEntry closed = currentTurn;
        closed.setCompleted(true);
        closed.setForceClosed(forced);
        closed.setCloseReason(reason);
        closed.setClosedAt(now);
        if (turnLog == null) {
            turnLog = new ArrayList<>();
        }
        turnLog.add(closed);
        currentTurn = null;
        executionTime().stop(now);
        return closed;
    }

    public Optional<RoutingEntry> findTurn(String turnId) {
        if (turnId == null) {
            return Optional.empty();
        }
        if (currentTurn != null && turnId.equals(currentTurn.getTurnId())) {
            return Optional.of(currentTurn);
        }
        if (turnLog == null) {
            return Optional.empty();
        }
        return turnLog.stream()
                .filter(turn -> turnId.equals(turn.getTurnId()))
                .findFirst();
    }

    public void appendMessage(ConversationMessage message) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(message);
    }

    public AgentState agentState(String agent) {
        if (agentStates == null) {
            agentStates = new LinkedHashMap<>();
        }
        return agentStates.computeIfAbsent(agent, k -> new AgentState());
    }

    public void addPhaseTransition(PhaseTransition transition) {
        if (phaseTransitions == null) {
            phaseTransitions = new ArrayList<>();
        }
        phaseTransitions.add(transition);
        this.phase = transition.getTo();
    }

    public void registerCustomPhase(String name, String instructions) {
        if (customPhases == null) {
            customPhases = new LinkedHashMap<>();
        }
        customPhases.put(name, instructions);
    }

    public void putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        metadata.put(key, value);
    }

    private ExecutionTime executionTime() {
        if (executionTime == null) {
            executionTime = new ExecutionTime();
        }
        return executionTime;
    }
}
