package com.z254.concord.conductor.exception;

/**
 * A remote endpoint failed: publishing to the event network after the configured retries,
 * or the completion service.
 */
public class TransportException extends ConductorException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
