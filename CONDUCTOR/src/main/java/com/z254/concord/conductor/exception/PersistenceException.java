package com.z254.concord.conductor.exception;

/**
 * Durable state (ledger segment, conversation record) could not be read or written.
 */
public class PersistenceException extends ConductorException {

    public PersistenceException(String message) {
        super(ErrorKind.PERSISTENCE, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
