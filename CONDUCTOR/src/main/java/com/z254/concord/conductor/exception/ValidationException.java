package com.z254.concord.conductor.exception;

/**
 * Rejected input: an unreachable phase, a malformed routing decision, an unknown agent.
 * Raised before any state is changed.
 */
public class ValidationException extends ConductorException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
