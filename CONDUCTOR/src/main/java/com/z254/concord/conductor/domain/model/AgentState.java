package com.z254.concord.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What one agent has seen of a conversation and what it last reported.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentState {

    /**
     * Index into the history of the last message delivered to the agent, -1 for none.
     */
    @Builder.Default
    private int lastSeenMessageIndex = -1;

    /**
     * Phase the agent was last told about. A different current phase is announced on the
     * next delegation.
     */
    private String lastSeenPhase;

    private String status;
    private String statusMessage;
    private Instant lastActivityAt;
}
