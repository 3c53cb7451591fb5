package com.z254.concord.conductor.conversation;

/**
 * Result of recording a completion on a conversation.
 */
public enum CompletionOutcome {
    /** Added to the open turn; other target agents are still pending. */
    RECORDED,
    /** Added to the open turn and every target agent has now replied. */
    TURN_COMPLETED,
    /** The agent had already replied to this turn. Nothing changed. */
    DUPLICATE,
    /** Added with {@link CompletionMode#RECORD_ANYWAY}; no turn was closed. */
    RECORDED_FORCED
}
