package com.z254.concord.conductor.exception;

/**
 * A reply that matches no open turn, or comes from an agent the turn did not target.
 */
public class OrphanedCompletionException extends ConductorException {

    private final String conversationId;
    private final String turnId;
    private final String agent;

    public OrphanedCompletionException(String conversationId, String turnId, String agent, String message) {
        super(ErrorKind.ORPHANED_COMPLETION, message);
        this.conversationId = conversationId;
        this.turnId = turnId;
        this.agent = agent;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getTurnId() {
        return turnId;
    }

    public String getAgent() {
        return agent;
    }
}
