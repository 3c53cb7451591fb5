package com.z254.concord.conductor.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.concord.conductor.domain.model.PhaseTransition;
import com.z254.concord.conductor.domain.model.RoutingDecision;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for CONDUCTOR.
 * Provides consistent, machine-parseable audit entries for routing, phase and turn changes.
 */
@Component
@Slf4j
public class StructuredLogger {

    private final ObjectMapper objectMapper;

    // MDC keys for context
    public static final String MDC_CONVERSATION_ID = "conversationId";
    public static final String MDC_TURN_ID = "turnId";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_EVENT_ID = "eventId";

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for work on a conversation.
     */
    public void setConversationContext(String conversationId, String turnId, String agentId) {
        if (conversationId != null) MDC.put(MDC_CONVERSATION_ID, conversationId);
        if (turnId != null) MDC.put(MDC_TURN_ID, turnId);
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
    }

    public void setEventContext(String eventId) {
        if (eventId != null) MDC.put(MDC_EVENT_ID, eventId);
    }

    /**
     * Clear MDC context.
     */
    public void clearContext() {
        MDC.remove(MDC_CONVERSATION_ID);
        MDC.remove(MDC_TURN_ID);
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_EVENT_ID);
    }

    public void logRoutingDecision(String conversationId, String currentPhase, RoutingDecision decision) {
        Map<String, Object> data = new HashMap<>();
        data.put("conversationId", conversationId);
        data.put("currentPhase", currentPhase);
        data.put("agents", decision.getAgents());
        data.put("reason", decision.getReason());
        if (decision.getPhase() != null) data.put("targetPhase", decision.getPhase());
        logEvent("routing_decision", data);
    }

    public void logRoutingFailure(String conversationId, String errorKind, String errorMessage) {
        logEvent("routing_failure", Map.of(
                "conversationId", conversationId,
                "errorKind", errorKind,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"
        ));
    }

    public void logPhaseTransition(String conversationId, PhaseTransition transition) {
        Map<String, Object> data = new HashMap<>();
        data.put("conversationId", conversationId);
        data.put("from", transition.getFrom());
        data.put("to", transition.getTo());
        if (transition.getInitiatingAgent() != null) data.put("initiatingAgent", transition.getInitiatingAgent());
        if (transition.getReason() != null) data.put("reason", transition.getReason());
        logEvent("phase_transition", data);
    }

    public void logTurnOpened(String conversationId, RoutingEntry turn) {
        logEvent("turn_opened", Map.of(
                "conversationId", conversationId,
                "turnId", turn.getTurnId(),
                "phase", turn.getPhase(),
                "agents", turn.getAgents()
        ));
    }

    public void logTurnClosed(String conversationId, RoutingEntry turn) {
        Map<String, Object> data = new HashMap<>();
        data.put("conversationId", conversationId);
        data.put("turnId", turn.getTurnId());
        data.put("completions", turn.getCompletions().size());
        data.put("forced", turn.isForceClosed());
        if (turn.getCloseReason() != null) data.put("closeReason", turn.getCloseReason());
        if (turn.isForceClosed()) data.put("pendingAgents", turn.pendingAgents());
        logEvent("turn_closed", data);
    }

    public void logOrphanedCompletion(String conversationId, String turnId, String agent, String detail) {
        Map<String, Object> data = new HashMap<>();
        data.put("conversationId", conversationId);
        data.put("agent", agent);
        data.put("detail", detail);
        if (turnId != null) data.put("turnId", turnId);
        logEvent("orphaned_completion", data);
    }

    public void logLedgerFlush(int entries, long durationMs, boolean success) {
        logEvent("ledger_flush", Map.of(
                "entries", entries,
                "durationMs", durationMs,
                "success", success
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "conductor");

        // Add MDC context
        String eventId = MDC.get(MDC_EVENT_ID);
        if (eventId != null) event.put("eventId", eventId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
