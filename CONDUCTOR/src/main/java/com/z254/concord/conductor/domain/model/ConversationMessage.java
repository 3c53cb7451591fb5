package com.z254.concord.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single message in the conversation history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_AGENT = "agent";
    public static final String ROLE_SYSTEM = "system";

    private String id;
    private String role;
    private String author;    // agent slug, or the user's pubkey
    private String content;
    private String phase;
    private String turnId;    // set for agent replies to a routing turn
    private Instant timestamp;
}
