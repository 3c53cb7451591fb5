package com.z254.concord.conductor.exception;

/**
 * Error taxonomy shared by the store, phase machine, delegation and ingestion layers.
 */
public enum ErrorKind {
    VALIDATION,
    CONCURRENCY_CONFLICT,
    TRANSPORT,
    ORPHANED_COMPLETION,
    PERSISTENCE
}
