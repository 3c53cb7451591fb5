package com.z254.concord.conductor.delegation;

import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Replies collected for a delegated turn.
 */
@Value
@Builder
public class DelegationResult {

    String conversationId;
    String turnId;

    /**
     * Replies in arrival order.
     */
    List<Completion> completions;

    /**
     * False when the turn was closed before every recipient replied.
     */
    boolean complete;

    String closeReason;

    /**
     * Recipients that did not reply before the turn closed.
     */
    List<String> missingAgents;

    public static DelegationResult from(String conversationId, RoutingEntry turn) {
        return DelegationResult.builder()
                .conversationId(conversationId)
                .turnId(turn.getTurnId())
                .completions(List.copyOf(turn.getCompletions()))
                .complete(!turn.isForceClosed())
                .closeReason(turn.getCloseReason())
                .missingAgents(turn.pendingAgents())
                .build();
    }
}
