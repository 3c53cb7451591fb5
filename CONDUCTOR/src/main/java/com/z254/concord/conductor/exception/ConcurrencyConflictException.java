package com.z254.concord.conductor.exception;

/**
 * A second turn was requested while one is still open on the conversation.
 */
public class ConcurrencyConflictException extends ConductorException {

    private final String openTurnId;

    public ConcurrencyConflictException(String message, String openTurnId) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
        this.openTurnId = openTurnId;
    }

    public String getOpenTurnId() {
        return openTurnId;
    }
}
