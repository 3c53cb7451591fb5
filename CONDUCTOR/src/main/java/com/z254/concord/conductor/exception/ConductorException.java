package com.z254.concord.conductor.exception;

/**
 * Base class for errors raised by the orchestration core.
 */
public abstract class ConductorException extends RuntimeException {

    private final ErrorKind kind;

    protected ConductorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ConductorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
