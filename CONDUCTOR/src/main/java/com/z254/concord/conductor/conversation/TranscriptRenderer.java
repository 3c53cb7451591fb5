package com.z254.concord.conductor.conversation;

import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a conversation's routing history as the narrative the routing engine reasons over.
 *
 * <p>Closed turns appear in log order as {@code [PHASE → agents]} with their reason and each
 * reply in arrival order. An open turn follows, marked CURRENT with the agents still
 * pending. The originating user request comes last. Rendering has no side effects.
 */
@Component
public class TranscriptRenderer {

    static final String ARROW = " → ";

    public List<TranscriptEntry> transcript(Conversation conversation) {
        List<TranscriptEntry> entries = new ArrayList<>();
        if (conversation.getTurnLog() != null) {
            for (RoutingEntry turn : conversation.getTurnLog()) {
                renderTurn(turn, false, entries);
            }
        }
        if (conversation.hasOpenTurn()) {
            renderTurn(conversation.getCurrentTurn(), true, entries);
        }
        if (StringUtils.hasText(conversation.getOriginalRequest())) {
            entries.add(TranscriptEntry.user("Original request: " + conversation.getOriginalRequest()));
        }
        return entries;
    }

    /**
     * The transcript as a single block of text, for logs and the inspection API.
     */
    public String render(Conversation conversation) {
        StringBuilder text = new StringBuilder();
        for (TranscriptEntry entry : transcript(conversation)) {
            text.append(entry.role()).append("> ").append(entry.content()).append("\n\n");
        }
        return text.toString().trim();
    }

    private void renderTurn(RoutingEntry turn, boolean current, List<TranscriptEntry> entries) {
        StringBuilder header = new StringBuilder()
                .append('[').append(turn.getPhase()).append(ARROW)
                .append(String.join(", ", turn.getAgents())).append(']');
        if (current) {
            header.append(" CURRENT");
        }
        if (StringUtils.hasText(turn.getReason())) {
            header.append("\nReason: ").append(turn.getReason());
        }
        if (current) {
            header.append("\nWaiting for: ").append(String.join(", ", turn.pendingAgents()));
        } else if (turn.isForceClosed()) {
            header.append("\nClosed early: ").append(turn.getCloseReason());
            List<String> missing = turn.pendingAgents();
            if (!missing.isEmpty()) {
                header.append(" (no reply from ").append(String.join(", ", missing)).append(')');
            }
        }
        entries.add(TranscriptEntry.assistant(header.toString()));

        for (Completion completion : turn.getCompletions()) {
            entries.add(TranscriptEntry.user(completion.getAgent() + ": " + completion.getContent()));
        }
    }
}
